package com.spreadsheet.calc.evaluator;

import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorKind;

/**
 * Conversions between value types used by operators and functions.
 * An error value is never converted: it is rethrown as its own kind so it
 * propagates unchanged.
 */
public final class Coercion {

    private Coercion() {
    }

    /**
     * Number as-is, TRUE/FALSE as 1/0, numeric text, empty as 0.
     */
    public static double toNumber(CellValue value) throws CoercionException {
        switch (value.getType()) {
            case NUMBER:
                return value.getNumber();
            case BOOLEAN:
                return value.getBoolean() ? 1d : 0d;
            case EMPTY:
                return 0d;
            case STRING:
                String trimmed = value.getText().trim();
                if (CellValue.isNumericText(trimmed)) {
                    return Double.parseDouble(trimmed);
                }
                throw new CoercionException(ErrorKind.valueError("number", "\"" + value.getText() + "\""));
            case ERROR:
                throw new CoercionException(value.getError());
            default:
                throw new CoercionException(ErrorKind.valueError("number", "array"));
        }
    }

    public static String toText(CellValue value) throws CoercionException {
        switch (value.getType()) {
            case ARRAY:
                throw new CoercionException(ErrorKind.valueError("text", "array"));
            default:
                return value.toDisplayString();
        }
    }

    /**
     * TRUE/FALSE, non-zero numbers, the text "TRUE"/"FALSE" in any case; empty is FALSE.
     */
    public static boolean toBoolean(CellValue value) throws CoercionException {
        switch (value.getType()) {
            case BOOLEAN:
                return value.getBoolean();
            case NUMBER:
                return value.getNumber() != 0d;
            case EMPTY:
                return false;
            case STRING:
                if ("TRUE".equalsIgnoreCase(value.getText())) {
                    return true;
                }
                if ("FALSE".equalsIgnoreCase(value.getText())) {
                    return false;
                }
                throw new CoercionException(ErrorKind.valueError("boolean", "\"" + value.getText() + "\""));
            case ERROR:
                throw new CoercionException(value.getError());
            default:
                throw new CoercionException(ErrorKind.valueError("boolean", "array"));
        }
    }
}
