package com.spreadsheet.calc.exceptions;

/**
 * Thrown when formula text cannot be turned into an expression tree:
 * empty input, unbalanced parentheses, a row below 1,
 * or a column past the configured maximum.
 */
public class FormulaParseException extends SpreadsheetException {
    private final int position;

    public FormulaParseException(String message, int position) {
        super(message + " (at position " + position + ")");
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
