package com.spreadsheet.calc.exceptions;

/**
 * Thrown when a built-in function is called with the wrong number of arguments.
 */
public class InvalidArgumentsException extends SpreadsheetException {
    private final String functionName;

    public InvalidArgumentsException(String functionName, String message) {
        super(functionName + ": " + message);
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}
