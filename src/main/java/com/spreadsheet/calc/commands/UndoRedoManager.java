package com.spreadsheet.calc.commands;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Undo and redo stacks, newest entry first. Both are bounded; when full the
 * oldest entry is dropped.
 */
@Slf4j
public class UndoRedoManager {
    private final Deque<Command> undoStack = new ArrayDeque<>();
    private final Deque<Command> redoStack = new ArrayDeque<>();
    private final int maxUndoSize;
    private final int maxRedoSize;

    public UndoRedoManager(int maxUndoSize, int maxRedoSize) {
        if (maxUndoSize < 1 || maxRedoSize < 1) {
            throw new IllegalArgumentException("Stack sizes must be positive");
        }
        this.maxUndoSize = maxUndoSize;
        this.maxRedoSize = maxRedoSize;
    }

    /**
     * Runs the command and records it. A command that throws is not recorded.
     */
    public void execute(Command command, CommandExecutor executor) {
        command.execute(executor);
        record(command);
    }

    /**
     * Records a command that has already been applied. Clears the redo stack.
     */
    public void record(Command command) {
        push(undoStack, command, maxUndoSize);
        redoStack.clear();
    }

    /**
     * @return false when there is nothing to undo
     */
    public boolean undo(CommandExecutor executor) {
        Command command = undoStack.poll();
        if (command == null) {
            return false;
        }
        try {
            command.undo(executor);
        } catch (RuntimeException e) {
            undoStack.push(command);
            throw e;
        }
        push(redoStack, command, maxRedoSize);
        log.debug("Undid: {}", command.getDescription());
        return true;
    }

    /**
     * @return false when there is nothing to redo
     */
    public boolean redo(CommandExecutor executor) {
        Command command = redoStack.poll();
        if (command == null) {
            return false;
        }
        try {
            command.execute(executor);
        } catch (RuntimeException e) {
            redoStack.push(command);
            throw e;
        }
        push(undoStack, command, maxUndoSize);
        log.debug("Redid: {}", command.getDescription());
        return true;
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public Optional<String> peekUndo() {
        return Optional.ofNullable(undoStack.peek()).map(Command::getDescription);
    }

    public Optional<String> peekRedo() {
        return Optional.ofNullable(redoStack.peek()).map(Command::getDescription);
    }

    /**
     * Descriptions, most recent first.
     */
    public List<String> getUndoHistory() {
        return describe(undoStack);
    }

    public List<String> getRedoHistory() {
        return describe(redoStack);
    }

    public int getUndoSize() {
        return undoStack.size();
    }

    public int getRedoSize() {
        return redoStack.size();
    }

    public void clear() {
        undoStack.clear();
        redoStack.clear();
    }

    private static void push(Deque<Command> stack, Command command, int maxSize) {
        stack.push(command);
        while (stack.size() > maxSize) {
            Command evicted = stack.removeLast();
            log.debug("History full, dropped: {}", evicted.getDescription());
        }
    }

    private static List<String> describe(Deque<Command> stack) {
        List<String> descriptions = new ArrayList<>(stack.size());
        for (Command command : stack) {
            descriptions.add(command.getDescription());
        }
        return descriptions;
    }
}
