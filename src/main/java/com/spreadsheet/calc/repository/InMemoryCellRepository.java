package com.spreadsheet.calc.repository;

import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellAddress;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps cells in memory; nothing is persisted.
 */
public class InMemoryCellRepository implements CellRepository {

    private final Map<CellAddress, Cell> cells = new ConcurrentHashMap<>();

    @Override
    public Optional<Cell> get(CellAddress address) {
        return Optional.ofNullable(cells.get(address));
    }

    @Override
    public void put(CellAddress address, Cell cell) {
        cells.put(address, cell);
    }

    @Override
    public Optional<Cell> remove(CellAddress address) {
        return Optional.ofNullable(cells.remove(address));
    }

    @Override
    public boolean contains(CellAddress address) {
        return cells.containsKey(address);
    }

    @Override
    public Map<CellAddress, Cell> snapshot() {
        Map<CellAddress, Cell> copy = new TreeMap<>();
        cells.forEach((address, cell) -> copy.put(address, cell.copy()));
        return copy;
    }

    @Override
    public void replaceAll(Map<CellAddress, Cell> newCells) {
        cells.clear();
        newCells.forEach((address, cell) -> cells.put(address, cell.copy()));
    }

    @Override
    public int size() {
        return cells.size();
    }

    @Override
    public void clear() {
        cells.clear();
    }
}
