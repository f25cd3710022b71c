package com.spreadsheet.calc.commands;

import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellAddress;

import java.util.Optional;

public class SetCellCommand extends Command {
    private final CellAddress address;
    private final String rawValue;
    private Optional<Cell> previous = Optional.empty();

    public SetCellCommand(CellAddress address, String rawValue) {
        this.address = address;
        this.rawValue = rawValue;
    }

    @Override
    public void execute(CommandExecutor executor) {
        previous = executor.applySetCell(address, rawValue);
    }

    @Override
    public void undo(CommandExecutor executor) {
        executor.restoreCell(address, previous);
    }

    @Override
    public String getDescription() {
        return "Set " + address.toA1() + " to \"" + rawValue + "\"";
    }

    public CellAddress getAddress() {
        return address;
    }

    public String getRawValue() {
        return rawValue;
    }
}
