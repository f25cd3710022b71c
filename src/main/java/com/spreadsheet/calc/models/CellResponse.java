package com.spreadsheet.calc.models;

/**
 * JSON view of one cell, e.g.
 * {
 *   "address": "C1",
 *   "rawValue": "=A1+B1",
 *   "value": "30",
 *   "type": "NUMBER"
 * }
 */
public class CellResponse {
    private final String address;
    private final String rawValue;
    private final String value;
    private final ValueType type;

    public CellResponse(String address, String rawValue, String value, ValueType type) {
        this.address = address;
        this.rawValue = rawValue;
        this.value = value;
        this.type = type;
    }

    public static CellResponse of(CellAddress address, Cell cell) {
        if (cell == null) {
            return new CellResponse(address.toA1(), null, "", ValueType.EMPTY);
        }
        CellValue value = cell.getEvaluatedValue();
        return new CellResponse(address.toA1(), cell.getRawValue(), value.toDisplayString(), value.getType());
    }

    public String getAddress() {
        return address;
    }

    public String getRawValue() {
        return rawValue;
    }

    public String getValue() {
        return value;
    }

    public ValueType getType() {
        return type;
    }
}
