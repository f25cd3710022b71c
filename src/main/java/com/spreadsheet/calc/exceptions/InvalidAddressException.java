package com.spreadsheet.calc.exceptions;

/**
 * Thrown when "A1"-style text does not name a cell, e.g. "1A", "A0" or "".
 */
public class InvalidAddressException extends SpreadsheetException {
    public InvalidAddressException(String message) {
        super(message);
    }
}
