package com.spreadsheet.calc.repository;

import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellAddress;

import java.util.Map;
import java.util.Optional;

/**
 * Address-keyed storage for the cells of one sheet.
 */
public interface CellRepository {

    Optional<Cell> get(CellAddress address);

    void put(CellAddress address, Cell cell);

    /**
     * Removes the cell; returns the removed cell, if there was one.
     */
    Optional<Cell> remove(CellAddress address);

    boolean contains(CellAddress address);

    /**
     * Point-in-time copy of every stored cell, sorted by address.
     */
    Map<CellAddress, Cell> snapshot();

    /**
     * Replaces the whole content with {@code cells}.
     */
    void replaceAll(Map<CellAddress, Cell> cells);

    int size();

    void clear();
}
