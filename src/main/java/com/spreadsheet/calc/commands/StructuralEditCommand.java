package com.spreadsheet.calc.commands;

import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellAddress;

import java.util.Map;

/**
 * Undo restores the whole sheet as it was before the edit, including formulas
 * that had a reference replaced by #REF!.
 */
public class StructuralEditCommand extends Command {
    private final StructuralEdit edit;
    private Map<CellAddress, Cell> before;

    public StructuralEditCommand(StructuralEdit edit) {
        this.edit = edit;
    }

    @Override
    public void execute(CommandExecutor executor) {
        before = executor.snapshotCells();
        executor.applyStructuralEdit(edit);
    }

    @Override
    public void undo(CommandExecutor executor) {
        if (before == null) {
            throw new IllegalStateException("Cannot undo an edit that was never applied: " + edit.describe());
        }
        executor.restoreCells(before);
    }

    @Override
    public String getDescription() {
        return edit.describe();
    }

    public StructuralEdit getEdit() {
        return edit;
    }
}
