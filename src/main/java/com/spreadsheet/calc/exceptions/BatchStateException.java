package com.spreadsheet.calc.exceptions;

/**
 * Thrown for calls that are not allowed while a batch is open
 * (a second begin, undo, redo).
 */
public class BatchStateException extends SpreadsheetException {
    public BatchStateException(String message) {
        super(message);
    }
}
