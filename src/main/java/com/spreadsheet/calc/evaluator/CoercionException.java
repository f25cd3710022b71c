package com.spreadsheet.calc.evaluator;

import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorKind;

/**
 * A value could not be converted to the type an operator or function needs.
 * Always caught inside the evaluator and turned into an error value.
 */
public class CoercionException extends Exception {
    private final ErrorKind errorKind;

    public CoercionException(ErrorKind errorKind) {
        super(errorKind.describe());
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public CellValue toValue() {
        return CellValue.error(errorKind);
    }
}
