package com.spreadsheet.calc.events;

import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellValue;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * Something observable happened on a sheet. Which fields are set depends on the type:
 * - CELL_UPDATED: address, oldValue, newValue
 * - CELL_DELETED: address, oldValue
 * - RECALCULATION_STARTED: affectedCells
 * - RECALCULATION_COMPLETED: affectedCells, elapsed
 * - BATCH_STARTED / BATCH_COMPLETED: batchId, operationCount
 */
public class SpreadsheetEvent {

    public enum EventType {
        CELL_UPDATED,
        CELL_DELETED,
        RECALCULATION_STARTED,
        RECALCULATION_COMPLETED,
        BATCH_STARTED,
        BATCH_COMPLETED
    }

    private final EventType type;
    private final CellAddress address;
    private final CellValue oldValue;
    private final CellValue newValue;
    private final List<CellAddress> affectedCells;
    private final Duration elapsed;
    private final String batchId;
    private final int operationCount;

    private SpreadsheetEvent(EventType type, CellAddress address, CellValue oldValue, CellValue newValue,
                             List<CellAddress> affectedCells, Duration elapsed, String batchId,
                             int operationCount) {
        this.type = type;
        this.address = address;
        this.oldValue = oldValue;
        this.newValue = newValue;
        this.affectedCells = affectedCells == null ? Collections.emptyList() : List.copyOf(affectedCells);
        this.elapsed = elapsed;
        this.batchId = batchId;
        this.operationCount = operationCount;
    }

    public static SpreadsheetEvent cellUpdated(CellAddress address, CellValue oldValue, CellValue newValue) {
        return new SpreadsheetEvent(EventType.CELL_UPDATED, address, oldValue, newValue, null, null, null, 0);
    }

    public static SpreadsheetEvent cellDeleted(CellAddress address, CellValue oldValue) {
        return new SpreadsheetEvent(EventType.CELL_DELETED, address, oldValue, CellValue.EMPTY, null, null, null, 0);
    }

    public static SpreadsheetEvent recalculationStarted(List<CellAddress> affectedCells) {
        return new SpreadsheetEvent(EventType.RECALCULATION_STARTED, null, null, null, affectedCells, null, null, 0);
    }

    public static SpreadsheetEvent recalculationCompleted(List<CellAddress> affectedCells, Duration elapsed) {
        return new SpreadsheetEvent(EventType.RECALCULATION_COMPLETED, null, null, null, affectedCells, elapsed,
                null, 0);
    }

    public static SpreadsheetEvent batchStarted(String batchId, int operationCount) {
        return new SpreadsheetEvent(EventType.BATCH_STARTED, null, null, null, null, null, batchId, operationCount);
    }

    public static SpreadsheetEvent batchCompleted(String batchId, int operationCount) {
        return new SpreadsheetEvent(EventType.BATCH_COMPLETED, null, null, null, null, null, batchId,
                operationCount);
    }

    public EventType getType() {
        return type;
    }

    public CellAddress getAddress() {
        return address;
    }

    public CellValue getOldValue() {
        return oldValue;
    }

    public CellValue getNewValue() {
        return newValue;
    }

    public List<CellAddress> getAffectedCells() {
        return affectedCells;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public String getBatchId() {
        return batchId;
    }

    public int getOperationCount() {
        return operationCount;
    }

    @Override
    public String toString() {
        switch (type) {
            case CELL_UPDATED:
                return type + "{" + address + ": " + oldValue.toDisplayString() + " -> "
                        + newValue.toDisplayString() + "}";
            case CELL_DELETED:
                return type + "{" + address + "}";
            case RECALCULATION_STARTED:
                return type + "{" + affectedCells.size() + " cells}";
            case RECALCULATION_COMPLETED:
                return type + "{" + affectedCells.size() + " cells in " + elapsed.toMillis() + "ms}";
            default:
                return type + "{" + batchId + ", " + operationCount + " operations}";
        }
    }
}
