package com.spreadsheet.calc.models;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Reason behind a spreadsheet-visible error value.
 * Each type has a fixed display code; the detail fields only feed messages.
 */
public final class ErrorKind {

    public enum Type {
        DIVIDE_BY_ZERO("#DIV/0!"),
        VALUE_ERROR("#VALUE!"),
        NUM_ERROR("#NUM!"),
        INVALID_REF("#REF!"),
        NAME_ERROR("#NAME?"),
        CIRCULAR_DEPENDENCY("#CIRC!"),
        PARSE_ERROR("#ERROR!");

        private final String code;

        Type(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }

        public static Type fromCode(String code) {
            for (Type type : values()) {
                if (type.code.equalsIgnoreCase(code)) {
                    return type;
                }
            }
            return null;
        }
    }

    private final Type type;
    private final String detail;
    private final String actual;
    private final List<CellAddress> cells;

    private ErrorKind(Type type, String detail, String actual, List<CellAddress> cells) {
        this.type = type;
        this.detail = detail;
        this.actual = actual;
        this.cells = cells;
    }

    public static ErrorKind divideByZero() {
        return new ErrorKind(Type.DIVIDE_BY_ZERO, null, null, Collections.emptyList());
    }

    public static ErrorKind valueError(String expected, String actual) {
        return new ErrorKind(Type.VALUE_ERROR, expected, actual, Collections.emptyList());
    }

    public static ErrorKind numError() {
        return new ErrorKind(Type.NUM_ERROR, null, null, Collections.emptyList());
    }

    public static ErrorKind invalidRef(String reference) {
        return new ErrorKind(Type.INVALID_REF, reference, null, Collections.emptyList());
    }

    public static ErrorKind nameError(String name) {
        return new ErrorKind(Type.NAME_ERROR, name, null, Collections.emptyList());
    }

    public static ErrorKind circularDependency(List<CellAddress> cells) {
        return new ErrorKind(Type.CIRCULAR_DEPENDENCY, null, null, List.copyOf(cells));
    }

    public static ErrorKind parseError(String message) {
        return new ErrorKind(Type.PARSE_ERROR, message, null, Collections.emptyList());
    }

    /**
     * Error kind for a bare code typed into a formula, e.g. "#REF!".
     * Returns null for unknown codes.
     */
    public static ErrorKind fromCode(String code) {
        Type type = Type.fromCode(code);
        if (type == null) {
            return null;
        }
        switch (type) {
            case DIVIDE_BY_ZERO:
                return divideByZero();
            case VALUE_ERROR:
                return valueError("", "");
            case NUM_ERROR:
                return numError();
            case INVALID_REF:
                return invalidRef(type.getCode());
            case NAME_ERROR:
                return nameError("");
            case CIRCULAR_DEPENDENCY:
                return circularDependency(Collections.emptyList());
            default:
                return parseError("");
        }
    }

    public Type getType() {
        return type;
    }

    public String getCode() {
        return type.getCode();
    }

    /** Expected type, reference, function name or parse message depending on the type. */
    public String getDetail() {
        return detail;
    }

    public String getActual() {
        return actual;
    }

    public List<CellAddress> getCells() {
        return cells;
    }

    public String describe() {
        switch (type) {
            case DIVIDE_BY_ZERO:
                return "Division by zero";
            case VALUE_ERROR:
                return "Expected " + detail + ", got " + actual;
            case NUM_ERROR:
                return "Numeric result out of range";
            case INVALID_REF:
                return "Invalid reference: " + detail;
            case NAME_ERROR:
                return "Unknown name: " + detail;
            case CIRCULAR_DEPENDENCY:
                return "Circular dependency: " + cells;
            default:
                return "Parse error: " + detail;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ErrorKind)) {
            return false;
        }
        ErrorKind that = (ErrorKind) o;
        return type == that.type
                && Objects.equals(detail, that.detail)
                && Objects.equals(actual, that.actual)
                && cells.equals(that.cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, detail, actual, cells);
    }

    @Override
    public String toString() {
        return getCode();
    }
}
