package com.spreadsheet.calc.exceptions;

/**
 * Thrown when committing or rolling back a batch id that is not the open batch.
 */
public class BatchNotFoundException extends SpreadsheetException {
    public BatchNotFoundException(String batchId) {
        super("Batch not found: " + batchId);
    }
}
