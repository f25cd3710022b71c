package com.spreadsheet.calc.exceptions;

import com.spreadsheet.calc.models.CellAddress;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when installing a formula would close a dependency loop
 * (a cell referencing itself, or a multi-cell loop).
 * The path starts and ends with the cell being written.
 */
public class CircularReferenceException extends SpreadsheetException {
    private final List<CellAddress> cycle;

    public CircularReferenceException(List<CellAddress> cycle) {
        super("Circular reference: " + cycle.stream()
                .map(CellAddress::toA1)
                .collect(Collectors.joining(" -> ")));
        this.cycle = List.copyOf(cycle);
    }

    public List<CellAddress> getCycle() {
        return cycle;
    }
}
