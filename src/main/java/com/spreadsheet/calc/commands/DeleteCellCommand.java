package com.spreadsheet.calc.commands;

import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellAddress;

import java.util.Optional;

public class DeleteCellCommand extends Command {
    private final CellAddress address;
    private Optional<Cell> previous = Optional.empty();

    public DeleteCellCommand(CellAddress address) {
        this.address = address;
    }

    @Override
    public void execute(CommandExecutor executor) {
        previous = executor.applyDeleteCell(address);
    }

    @Override
    public void undo(CommandExecutor executor) {
        // re-inserts the deleted cell with its formula
        executor.restoreCell(address, previous);
    }

    @Override
    public String getDescription() {
        return "Delete " + address.toA1();
    }

    public CellAddress getAddress() {
        return address;
    }
}
