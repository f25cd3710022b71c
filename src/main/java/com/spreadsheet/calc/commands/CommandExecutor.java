package com.spreadsheet.calc.commands;

import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellAddress;

import java.util.Map;
import java.util.Optional;

/**
 * Raw sheet mutations that commands are built from. Implementations apply a
 * change without recording it anywhere; recording is the command manager's job.
 */
public interface CommandExecutor {

    /**
     * Stores {@code rawValue} at {@code address}.
     *
     * @return a copy of the cell that was there before, if any
     */
    Optional<Cell> applySetCell(CellAddress address, String rawValue);

    /**
     * @return a copy of the removed cell, empty if there was nothing to remove
     */
    Optional<Cell> applyDeleteCell(CellAddress address);

    /**
     * Puts back exactly {@code previous} (raw text, formula, value), or removes
     * the cell when {@code previous} is empty.
     */
    void restoreCell(CellAddress address, Optional<Cell> previous);

    void applyStructuralEdit(StructuralEdit edit);

    Map<CellAddress, Cell> snapshotCells();

    void restoreCells(Map<CellAddress, Cell> snapshot);
}
