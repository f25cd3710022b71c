package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellRange;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites formulas after rows or columns are inserted or deleted, or a block
 * of cells is moved.
 *
 * <p>Only same-sheet references are touched. Absolute markers do not stop a
 * reference from shifting. A reference that loses its target is replaced by a
 * {@code #REF!} literal in place; the rest of the formula is kept.
 */
public class FormulaTransformer {

    private final int maxColumns;
    private final int maxRows;

    public FormulaTransformer(int maxColumns, int maxRows) {
        this.maxColumns = maxColumns;
        this.maxRows = maxRows;
    }

    public Expr adjustForRowInsert(Expr expr, int row) {
        return expr.accept(new AxisEdit(true, row, true));
    }

    public Expr adjustForRowDelete(Expr expr, int row) {
        return expr.accept(new AxisEdit(true, row, false));
    }

    public Expr adjustForColumnInsert(Expr expr, int column) {
        return expr.accept(new AxisEdit(false, column, true));
    }

    public Expr adjustForColumnDelete(Expr expr, int column) {
        return expr.accept(new AxisEdit(false, column, false));
    }

    /**
     * References inside {@code source} follow the block to {@code targetTopLeft}.
     * A range follows only when it lies completely inside the moved block.
     * References to cells the block lands on (outside the block itself) become #REF!.
     */
    public Expr adjustForRangeMove(Expr expr, CellRange source, CellAddress targetTopLeft) {
        return expr.accept(new Move(source, targetTopLeft));
    }

    /**
     * Drops a sheet qualifier that names {@code sheetName} (ignoring case), so
     * "Sheet1!A1" written on Sheet1 reads the same cell as "A1".
     */
    public static Expr localize(Expr expr, String sheetName) {
        return expr.accept(new Localize(sheetName));
    }

    private static Expr invalidRef(String text) {
        return Expr.literal(CellValue.error(ErrorKind.invalidRef(text)));
    }

    private boolean inBounds(int column, int row) {
        return column >= 0 && row >= 0 && column < maxColumns && row < maxRows;
    }

    /**
     * Walks every node; subclasses decide what happens to references and ranges.
     */
    private abstract static class Rewriter implements ExprVisitor<Expr> {

        @Override
        public Expr visitLiteral(Expr.Literal literal) {
            return literal;
        }

        @Override
        public Expr visitReference(Expr.Reference reference) {
            return reference.isLocal() ? rewriteReference(reference) : reference;
        }

        @Override
        public Expr visitRange(Expr.Range range) {
            return range.isLocal() ? rewriteRange(range) : range;
        }

        @Override
        public Expr visitFunctionCall(Expr.FunctionCall call) {
            List<Expr> args = new ArrayList<>(call.getArgs().size());
            for (Expr arg : call.getArgs()) {
                args.add(arg.accept(this));
            }
            return new Expr.FunctionCall(call.getName(), args);
        }

        @Override
        public Expr visitUnaryOp(Expr.UnaryOp unary) {
            return new Expr.UnaryOp(unary.getOp(), unary.getOperand().accept(this));
        }

        @Override
        public Expr visitBinaryOp(Expr.BinaryOp binary) {
            return new Expr.BinaryOp(binary.getOp(), binary.getLeft().accept(this), binary.getRight().accept(this));
        }

        abstract Expr rewriteReference(Expr.Reference reference);

        abstract Expr rewriteRange(Expr.Range range);
    }

    private final class AxisEdit extends Rewriter {
        private final boolean rows;
        private final int index;
        private final boolean insert;

        AxisEdit(boolean rows, int index, boolean insert) {
            this.rows = rows;
            this.index = index;
            this.insert = insert;
        }

        @Override
        Expr rewriteReference(Expr.Reference reference) {
            CellAddress address = reference.getAddress();
            int coordinate = coordinateOf(address);
            if (insert) {
                if (coordinate < index) {
                    return reference;
                }
                CellAddress moved = withCoordinate(address, coordinate + 1);
                return moved == null ? invalidRef(FormulaFormatter.format(reference)) : reference.withAddress(moved);
            }
            if (coordinate == index) {
                return invalidRef(FormulaFormatter.format(reference));
            }
            if (coordinate < index) {
                return reference;
            }
            return reference.withAddress(withCoordinate(address, coordinate - 1));
        }

        @Override
        Expr rewriteRange(Expr.Range range) {
            CellRange rectangle = range.toCellRange();
            int low = coordinateOf(rectangle.getStart());
            int high = coordinateOf(rectangle.getEnd());
            int newLow;
            int newHigh;
            if (insert) {
                newLow = low >= index ? low + 1 : low;
                newHigh = high >= index ? high + 1 : high;
            } else {
                newLow = low > index ? low - 1 : low;
                newHigh = high >= index ? high - 1 : high;
                if (newHigh < newLow) {
                    // every row (or column) of the range was removed
                    return invalidRef(FormulaFormatter.format(range));
                }
            }
            if (newLow == low && newHigh == high) {
                return range;
            }
            CellAddress start = withCoordinate(rectangle.getStart(), newLow);
            CellAddress end = withCoordinate(rectangle.getEnd(), newHigh);
            if (start == null || end == null) {
                return invalidRef(FormulaFormatter.format(range));
            }
            return range.withCorners(start, end);
        }

        private int coordinateOf(CellAddress address) {
            return rows ? address.getRow() : address.getColumn();
        }

        private CellAddress withCoordinate(CellAddress address, int coordinate) {
            int column = rows ? address.getColumn() : coordinate;
            int row = rows ? coordinate : address.getRow();
            return inBounds(column, row) ? new CellAddress(column, row) : null;
        }
    }

    private final class Move extends Rewriter {
        private final CellRange source;
        private final int columnDelta;
        private final int rowDelta;
        private final CellRange destination;

        Move(CellRange source, CellAddress targetTopLeft) {
            this.source = source;
            this.columnDelta = targetTopLeft.getColumn() - source.getStart().getColumn();
            this.rowDelta = targetTopLeft.getRow() - source.getStart().getRow();
            CellAddress bottomRight = shift(source.getEnd());
            this.destination = bottomRight == null ? null : new CellRange(targetTopLeft, bottomRight);
        }

        @Override
        Expr rewriteReference(Expr.Reference reference) {
            if (!source.contains(reference.getAddress())) {
                // the cell it pointed at was overwritten by the moved block
                return destination != null && destination.contains(reference.getAddress())
                        ? invalidRef(FormulaFormatter.format(reference))
                        : reference;
            }
            CellAddress moved = shift(reference.getAddress());
            return moved == null ? invalidRef(FormulaFormatter.format(reference)) : reference.withAddress(moved);
        }

        @Override
        Expr rewriteRange(Expr.Range range) {
            if (!source.contains(range.getStart()) || !source.contains(range.getEnd())) {
                CellRange rectangle = range.toCellRange();
                boolean overwritten = destination != null
                        && destination.contains(rectangle.getStart()) && destination.contains(rectangle.getEnd());
                return overwritten ? invalidRef(FormulaFormatter.format(range)) : range;
            }
            CellAddress start = shift(range.getStart());
            CellAddress end = shift(range.getEnd());
            if (start == null || end == null) {
                return invalidRef(FormulaFormatter.format(range));
            }
            return range.withCorners(start, end);
        }

        private CellAddress shift(CellAddress address) {
            int column = address.getColumn() + columnDelta;
            int row = address.getRow() + rowDelta;
            return inBounds(column, row) ? new CellAddress(column, row) : null;
        }
    }

    private static final class Localize extends Rewriter {
        private final String sheetName;

        Localize(String sheetName) {
            this.sheetName = sheetName;
        }

        @Override
        public Expr visitReference(Expr.Reference reference) {
            if (!isOwnSheet(reference.getSheet())) {
                return reference;
            }
            return new Expr.Reference(null, reference.getAddress(),
                    reference.isAbsoluteColumn(), reference.isAbsoluteRow());
        }

        @Override
        public Expr visitRange(Expr.Range range) {
            if (!isOwnSheet(range.getSheet())) {
                return range;
            }
            return new Expr.Range(null, range.getStart(), range.getEnd(),
                    range.isAbsoluteStartColumn(), range.isAbsoluteStartRow(),
                    range.isAbsoluteEndColumn(), range.isAbsoluteEndRow());
        }

        @Override
        Expr rewriteReference(Expr.Reference reference) {
            return reference;
        }

        @Override
        Expr rewriteRange(Expr.Range range) {
            return range;
        }

        private boolean isOwnSheet(String sheet) {
            return sheet != null && sheet.equalsIgnoreCase(sheetName);
        }
    }
}
