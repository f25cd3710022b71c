package com.spreadsheet.calc.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rectangular block of cells, normalised so that start is the top-left corner
 * and end the bottom-right one.
 */
public final class CellRange {
    private final CellAddress start;
    private final CellAddress end;

    public CellRange(CellAddress first, CellAddress second) {
        this.start = new CellAddress(Math.min(first.getColumn(), second.getColumn()),
                Math.min(first.getRow(), second.getRow()));
        this.end = new CellAddress(Math.max(first.getColumn(), second.getColumn()),
                Math.max(first.getRow(), second.getRow()));
    }

    public static CellRange fromA1(String text) {
        int colon = text.indexOf(':');
        if (colon < 0) {
            CellAddress single = CellAddress.fromA1(text);
            return new CellRange(single, single);
        }
        return new CellRange(CellAddress.fromA1(text.substring(0, colon)),
                CellAddress.fromA1(text.substring(colon + 1)));
    }

    public CellAddress getStart() {
        return start;
    }

    public CellAddress getEnd() {
        return end;
    }

    public boolean contains(CellAddress address) {
        return address.getColumn() >= start.getColumn()
                && address.getColumn() <= end.getColumn()
                && address.getRow() >= start.getRow()
                && address.getRow() <= end.getRow();
    }

    public int getWidth() {
        return end.getColumn() - start.getColumn() + 1;
    }

    public int getHeight() {
        return end.getRow() - start.getRow() + 1;
    }

    public long size() {
        return (long) getWidth() * getHeight();
    }

    /**
     * All addresses in row-major order.
     */
    public List<CellAddress> cells() {
        List<CellAddress> cells = new ArrayList<>();
        for (int row = start.getRow(); row <= end.getRow(); row++) {
            for (int col = start.getColumn(); col <= end.getColumn(); col++) {
                cells.add(new CellAddress(col, row));
            }
        }
        return cells;
    }

    public String toA1() {
        return start.toA1() + ":" + end.toA1();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange that = (CellRange) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return toA1();
    }
}
