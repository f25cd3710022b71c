package com.spreadsheet.calc.exceptions;

/**
 * Thrown when creating a sheet whose name is already taken (names are case-insensitive).
 */
public class DuplicateSheetException extends SpreadsheetException {
    public DuplicateSheetException(String sheetName) {
        super("Sheet already exists: " + sheetName);
    }
}
