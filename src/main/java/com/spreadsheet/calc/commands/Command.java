package com.spreadsheet.calc.commands;

/**
 * A reversible sheet mutation. {@link #execute} doubles as redo.
 */
public abstract class Command {

    public abstract void execute(CommandExecutor executor);

    public abstract void undo(CommandExecutor executor);

    public abstract String getDescription();

    @Override
    public String toString() {
        return getDescription();
    }
}
