package com.spreadsheet.calc.exceptions;

/**
 * Base type for engine faults: a failed API call that leaves
 * the sheet exactly as it was before the call.
 * Spreadsheet-visible errors (#DIV/0!, #REF!, ...) are values, never exceptions.
 */
public class SpreadsheetException extends RuntimeException {
    public SpreadsheetException(String message) {
        super(message);
    }

    public SpreadsheetException(String message, Throwable cause) {
        super(message, cause);
    }
}
