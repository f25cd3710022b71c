package com.spreadsheet.calc.exceptions;

/**
 * Thrown when attempting to access a sheet name
 * that doesn't exist in the workbook.
 */
public class SheetNotFoundException extends SpreadsheetException {
    public SheetNotFoundException(String message) {
        super(message);
    }
}
