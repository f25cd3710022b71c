package com.spreadsheet.calc.models;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A computed cell value: number, text, boolean, empty, error or an array of values
 * (produced when a range is read where a single value is expected).
 * Immutable.
 */
public final class CellValue implements Comparable<CellValue> {

    public static final CellValue EMPTY = new CellValue(ValueType.EMPTY, 0d, null, false, null, null);
    public static final CellValue TRUE = new CellValue(ValueType.BOOLEAN, 0d, null, true, null, null);
    public static final CellValue FALSE = new CellValue(ValueType.BOOLEAN, 0d, null, false, null, null);

    static final Pattern NUMBER_PATTERN =
            Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?$");

    private final ValueType type;
    private final double number;
    private final String text;
    private final boolean bool;
    private final ErrorKind error;
    private final List<CellValue> items;

    private CellValue(ValueType type, double number, String text, boolean bool,
                      ErrorKind error, List<CellValue> items) {
        this.type = type;
        this.number = number;
        this.text = text;
        this.bool = bool;
        this.error = error;
        this.items = items;
    }

    public static CellValue number(double value) {
        return new CellValue(ValueType.NUMBER, value, null, false, null, null);
    }

    public static CellValue string(String value) {
        return new CellValue(ValueType.STRING, 0d, Objects.requireNonNull(value), false, null, null);
    }

    public static CellValue bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static CellValue error(ErrorKind kind) {
        return new CellValue(ValueType.ERROR, 0d, null, false, Objects.requireNonNull(kind), null);
    }

    public static CellValue array(List<CellValue> values) {
        return new CellValue(ValueType.ARRAY, 0d, null, false, null, List.copyOf(values));
    }

    /**
     * Interprets non-formula input typed into a cell:
     * "" is empty, numeric text is a number, TRUE/FALSE (any case) is a boolean,
     * anything else is kept as text.
     */
    public static CellValue fromLiteralText(String raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        String trimmed = raw.trim();
        if (isNumericText(trimmed)) {
            return number(Double.parseDouble(trimmed));
        }
        if ("TRUE".equalsIgnoreCase(trimmed)) {
            return TRUE;
        }
        if ("FALSE".equalsIgnoreCase(trimmed)) {
            return FALSE;
        }
        return string(raw);
    }

    public static boolean isNumericText(String text) {
        return text != null && NUMBER_PATTERN.matcher(text).matches();
    }

    /**
     * Formats a number without artificial trailing decimals: 30.0 -> "30", 0.5 -> "0.5".
     */
    public static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        String plain = Double.toString(value);
        if (plain.indexOf('E') >= 0) {
            return BigDecimal.valueOf(value).stripTrailingZeros().toString();
        }
        return plain;
    }

    public ValueType getType() {
        return type;
    }

    public boolean isNumber() {
        return type == ValueType.NUMBER;
    }

    public boolean isString() {
        return type == ValueType.STRING;
    }

    public boolean isBoolean() {
        return type == ValueType.BOOLEAN;
    }

    public boolean isEmpty() {
        return type == ValueType.EMPTY;
    }

    public boolean isError() {
        return type == ValueType.ERROR;
    }

    public boolean isArray() {
        return type == ValueType.ARRAY;
    }

    public double getNumber() {
        requireType(ValueType.NUMBER);
        return number;
    }

    public String getText() {
        requireType(ValueType.STRING);
        return text;
    }

    public boolean getBoolean() {
        requireType(ValueType.BOOLEAN);
        return bool;
    }

    public ErrorKind getError() {
        requireType(ValueType.ERROR);
        return error;
    }

    public List<CellValue> getItems() {
        requireType(ValueType.ARRAY);
        return items;
    }

    private void requireType(ValueType expected) {
        if (type != expected) {
            throw new IllegalStateException("Value is " + type + ", not " + expected);
        }
    }

    /**
     * Text shown in a grid: numbers without trailing zeros, TRUE/FALSE, "" for empty,
     * the fixed code for errors.
     */
    public String toDisplayString() {
        switch (type) {
            case NUMBER:
                return formatNumber(number);
            case STRING:
                return text;
            case BOOLEAN:
                return bool ? "TRUE" : "FALSE";
            case ERROR:
                return error.getCode();
            case ARRAY:
                return items.stream()
                        .map(CellValue::toDisplayString)
                        .collect(Collectors.joining(",", "{", "}"));
            default:
                return "";
        }
    }

    /**
     * Three-way comparison: empty sorts first; same types compare natively;
     * mixed types compare numerically when both sides have a numeric reading,
     * otherwise by display text.
     */
    @Override
    public int compareTo(CellValue other) {
        if (isEmpty() || other.isEmpty()) {
            return Boolean.compare(!isEmpty(), !other.isEmpty());
        }
        if (type == other.type) {
            switch (type) {
                case NUMBER:
                    return Double.compare(number, other.number);
                case STRING:
                    return text.compareTo(other.text);
                case BOOLEAN:
                    return Boolean.compare(bool, other.bool);
                default:
                    break;
            }
        }
        Double left = numericReading();
        Double right = other.numericReading();
        if (left != null && right != null) {
            return Double.compare(left, right);
        }
        return toDisplayString().compareTo(other.toDisplayString());
    }

    private Double numericReading() {
        switch (type) {
            case NUMBER:
                return number;
            case BOOLEAN:
                return bool ? 1d : 0d;
            case STRING:
                String trimmed = text.trim();
                return isNumericText(trimmed) ? Double.parseDouble(trimmed) : null;
            default:
                return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue that = (CellValue) o;
        if (type != that.type) {
            return false;
        }
        switch (type) {
            case NUMBER:
                return Double.compare(number, that.number) == 0;
            case STRING:
                return text.equals(that.text);
            case BOOLEAN:
                return bool == that.bool;
            case ERROR:
                return error.equals(that.error);
            case ARRAY:
                return items.equals(that.items);
            default:
                return true;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, number, text, bool, error, items);
    }

    @Override
    public String toString() {
        return type + "(" + toDisplayString() + ")";
    }
}
