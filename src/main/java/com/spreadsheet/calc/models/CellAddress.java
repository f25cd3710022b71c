package com.spreadsheet.calc.models;

import com.spreadsheet.calc.exceptions.InvalidAddressException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Position of a cell on a sheet: 0-based column and row.
 * Text form is "A1" style: bijective base-26 column letters followed by a 1-based row.
 * Ordered row-major (row first, then column), which is also the tie-break
 * order used by the calculation order.
 */
public final class CellAddress implements Comparable<CellAddress> {

    private static final Pattern A1_PATTERN = Pattern.compile("^\\$?([A-Za-z]+)\\$?([0-9]+)$");

    // ZZZZZZ is already past any sane column limit, and keeps the arithmetic inside int
    private static final int MAX_LABEL_LENGTH = 6;

    private final int column;
    private final int row;

    public CellAddress(int column, int row) {
        if (column < 0 || row < 0) {
            throw new InvalidAddressException("Negative cell position: column " + column + ", row " + row);
        }
        this.column = column;
        this.row = row;
    }

    public static CellAddress of(int column, int row) {
        return new CellAddress(column, row);
    }

    /**
     * Parses "B7", "$B$7", "aa10" into an address. Absolute markers are accepted and dropped.
     */
    public static CellAddress fromA1(String text) {
        if (text == null) {
            throw new InvalidAddressException("Cell address is missing");
        }
        Matcher matcher = A1_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            throw new InvalidAddressException("Invalid cell address: " + text);
        }
        int column = columnLabelToIndex(matcher.group(1));
        String rowText = matcher.group(2);
        if (rowText.length() > 9) {
            throw new InvalidAddressException("Row out of range: " + text);
        }
        int rowNumber = Integer.parseInt(rowText);
        if (rowNumber < 1) {
            throw new InvalidAddressException("Row number must be greater than 0: " + text);
        }
        return new CellAddress(column, rowNumber - 1);
    }

    /**
     * A=0, B=1, ..., Z=25, AA=26, AB=27, ... Case-insensitive.
     */
    public static int columnLabelToIndex(String label) {
        if (label == null || label.isEmpty()) {
            throw new InvalidAddressException("Empty column label");
        }
        if (label.length() > MAX_LABEL_LENGTH) {
            throw new InvalidAddressException("Column label too long: " + label);
        }
        int index = 0;
        for (int i = 0; i < label.length(); i++) {
            char c = Character.toUpperCase(label.charAt(i));
            if (c < 'A' || c > 'Z') {
                throw new InvalidAddressException("Invalid column letter: " + label);
            }
            index = index * 26 + (c - 'A' + 1);
        }
        return index - 1;
    }

    /**
     * 0=A, 25=Z, 26=AA, 701=ZZ, 702=AAA.
     */
    public static String columnIndexToLabel(int index) {
        if (index < 0) {
            throw new InvalidAddressException("Column index must be non-negative: " + index);
        }
        StringBuilder sb = new StringBuilder();
        int col = index + 1;
        while (col > 0) {
            int remainder = (col - 1) % 26;
            sb.insert(0, (char) ('A' + remainder));
            col = (col - 1) / 26;
        }
        return sb.toString();
    }

    public int getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    /**
     * Moves the address by the given deltas. Throws if the result would be negative.
     */
    public CellAddress offset(int columnDelta, int rowDelta) {
        int newColumn = column + columnDelta;
        int newRow = row + rowDelta;
        if (newColumn < 0 || newRow < 0) {
            throw new InvalidAddressException("Offset results in negative address: ("
                    + newColumn + ", " + newRow + ")");
        }
        return new CellAddress(newColumn, newRow);
    }

    public String toA1() {
        return columnIndexToLabel(column) + (row + 1);
    }

    @Override
    public int compareTo(CellAddress other) {
        int byRow = Integer.compare(row, other.row);
        return byRow != 0 ? byRow : Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return column == that.column && row == that.row;
    }

    @Override
    public int hashCode() {
        return 31 * column + row;
    }

    @Override
    public String toString() {
        return toA1();
    }
}
