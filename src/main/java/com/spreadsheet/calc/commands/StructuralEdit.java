package com.spreadsheet.calc.commands;

import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellRange;

/**
 * Row or column insertion/deletion at a 0-based index, or a block move.
 */
public final class StructuralEdit {

    public enum Kind {
        INSERT_ROW,
        DELETE_ROW,
        INSERT_COLUMN,
        DELETE_COLUMN,
        MOVE_RANGE
    }

    private final Kind kind;
    private final int index;
    private final CellRange source;
    private final CellAddress target;

    private StructuralEdit(Kind kind, int index, CellRange source, CellAddress target) {
        this.kind = kind;
        this.index = index;
        this.source = source;
        this.target = target;
    }

    public static StructuralEdit insertRow(int row) {
        return new StructuralEdit(Kind.INSERT_ROW, row, null, null);
    }

    public static StructuralEdit deleteRow(int row) {
        return new StructuralEdit(Kind.DELETE_ROW, row, null, null);
    }

    public static StructuralEdit insertColumn(int column) {
        return new StructuralEdit(Kind.INSERT_COLUMN, column, null, null);
    }

    public static StructuralEdit deleteColumn(int column) {
        return new StructuralEdit(Kind.DELETE_COLUMN, column, null, null);
    }

    public static StructuralEdit moveRange(CellRange source, CellAddress target) {
        return new StructuralEdit(Kind.MOVE_RANGE, -1, source, target);
    }

    public Kind getKind() {
        return kind;
    }

    public int getIndex() {
        return index;
    }

    public CellRange getSource() {
        return source;
    }

    public CellAddress getTarget() {
        return target;
    }

    public String describe() {
        switch (kind) {
            case INSERT_ROW:
                return "Insert row " + (index + 1);
            case DELETE_ROW:
                return "Delete row " + (index + 1);
            case INSERT_COLUMN:
                return "Insert column " + CellAddress.columnIndexToLabel(index);
            case DELETE_COLUMN:
                return "Delete column " + CellAddress.columnIndexToLabel(index);
            default:
                return "Move " + source.toA1() + " to " + target.toA1();
        }
    }

    @Override
    public String toString() {
        return describe();
    }
}
