package com.spreadsheet.calc.commands;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Several commands applied and undone as one unit.
 * Undo walks the children in reverse; execute (and redo) walks them forward.
 */
@Slf4j
public class BatchCommand extends Command {
    private final String description;
    private final List<Command> commands;

    public BatchCommand(String description, List<Command> commands) {
        this.description = description;
        this.commands = List.copyOf(commands);
    }

    /**
     * Applies every child in order. If one fails, the children already applied
     * are undone in reverse before the failure is rethrown.
     */
    @Override
    public void execute(CommandExecutor executor) {
        List<Command> applied = new ArrayList<>();
        try {
            for (Command command : commands) {
                command.execute(executor);
                applied.add(command);
            }
        } catch (RuntimeException e) {
            log.warn("{} failed after {} of {} operations, rolling back: {}",
                    description, applied.size(), commands.size(), e.getMessage());
            for (int i = applied.size() - 1; i >= 0; i--) {
                applied.get(i).undo(executor);
            }
            throw e;
        }
    }

    @Override
    public void undo(CommandExecutor executor) {
        for (int i = commands.size() - 1; i >= 0; i--) {
            commands.get(i).undo(executor);
        }
    }

    @Override
    public String getDescription() {
        return description;
    }

    public List<Command> getCommands() {
        return commands;
    }

    public int size() {
        return commands.size();
    }
}
