package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellRange;
import com.spreadsheet.calc.models.CellValue;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Parsed formula tree. Nodes are immutable; rewriting a formula builds a new tree.
 */
public abstract class Expr {

    Expr() {
    }

    public abstract <R> R accept(ExprVisitor<R> visitor);

    public static Literal literal(CellValue value) {
        return new Literal(value);
    }

    public static Reference reference(CellAddress address) {
        return new Reference(null, address, false, false);
    }

    public static FunctionCall call(String name, List<Expr> args) {
        return new FunctionCall(name, args);
    }

    public static BinaryOp binary(BinaryOperator op, Expr left, Expr right) {
        return new BinaryOp(op, left, right);
    }

    public static UnaryOp unary(UnaryOperator op, Expr operand) {
        return new UnaryOp(op, operand);
    }

    @Override
    public String toString() {
        return FormulaFormatter.format(this);
    }

    public static final class Literal extends Expr {
        private final CellValue value;

        public Literal(CellValue value) {
            this.value = Objects.requireNonNull(value);
        }

        public CellValue getValue() {
            return value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteral(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Literal && value.equals(((Literal) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }
    }

    /**
     * Single cell reference. A null sheet means the sheet that owns the formula.
     */
    public static final class Reference extends Expr {
        private final String sheet;
        private final CellAddress address;
        private final boolean absoluteColumn;
        private final boolean absoluteRow;

        public Reference(String sheet, CellAddress address, boolean absoluteColumn, boolean absoluteRow) {
            this.sheet = sheet;
            this.address = Objects.requireNonNull(address);
            this.absoluteColumn = absoluteColumn;
            this.absoluteRow = absoluteRow;
        }

        public String getSheet() {
            return sheet;
        }

        public boolean isLocal() {
            return sheet == null;
        }

        public CellAddress getAddress() {
            return address;
        }

        public boolean isAbsoluteColumn() {
            return absoluteColumn;
        }

        public boolean isAbsoluteRow() {
            return absoluteRow;
        }

        public Reference withAddress(CellAddress newAddress) {
            return new Reference(sheet, newAddress, absoluteColumn, absoluteRow);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitReference(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Reference)) {
                return false;
            }
            Reference that = (Reference) o;
            return Objects.equals(sheet, that.sheet)
                    && address.equals(that.address)
                    && absoluteColumn == that.absoluteColumn
                    && absoluteRow == that.absoluteRow;
        }

        @Override
        public int hashCode() {
            return Objects.hash(sheet, address, absoluteColumn, absoluteRow);
        }
    }

    /**
     * Rectangular range "A1:B2". Corners are kept as written, each with its own
     * absolute markers; {@link #toCellRange()} gives the normalised rectangle.
     */
    public static final class Range extends Expr {
        private final String sheet;
        private final CellAddress start;
        private final CellAddress end;
        private final boolean absoluteStartColumn;
        private final boolean absoluteStartRow;
        private final boolean absoluteEndColumn;
        private final boolean absoluteEndRow;

        public Range(String sheet, CellAddress start, CellAddress end,
                     boolean absoluteStartColumn, boolean absoluteStartRow,
                     boolean absoluteEndColumn, boolean absoluteEndRow) {
            this.sheet = sheet;
            this.start = Objects.requireNonNull(start);
            this.end = Objects.requireNonNull(end);
            this.absoluteStartColumn = absoluteStartColumn;
            this.absoluteStartRow = absoluteStartRow;
            this.absoluteEndColumn = absoluteEndColumn;
            this.absoluteEndRow = absoluteEndRow;
        }

        public String getSheet() {
            return sheet;
        }

        public boolean isLocal() {
            return sheet == null;
        }

        public CellAddress getStart() {
            return start;
        }

        public CellAddress getEnd() {
            return end;
        }

        public boolean isAbsoluteStartColumn() {
            return absoluteStartColumn;
        }

        public boolean isAbsoluteStartRow() {
            return absoluteStartRow;
        }

        public boolean isAbsoluteEndColumn() {
            return absoluteEndColumn;
        }

        public boolean isAbsoluteEndRow() {
            return absoluteEndRow;
        }

        public CellRange toCellRange() {
            return new CellRange(start, end);
        }

        public Range withCorners(CellAddress newStart, CellAddress newEnd) {
            return new Range(sheet, newStart, newEnd, absoluteStartColumn, absoluteStartRow,
                    absoluteEndColumn, absoluteEndRow);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitRange(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Range)) {
                return false;
            }
            Range that = (Range) o;
            return Objects.equals(sheet, that.sheet)
                    && start.equals(that.start)
                    && end.equals(that.end)
                    && absoluteStartColumn == that.absoluteStartColumn
                    && absoluteStartRow == that.absoluteStartRow
                    && absoluteEndColumn == that.absoluteEndColumn
                    && absoluteEndRow == that.absoluteEndRow;
        }

        @Override
        public int hashCode() {
            return Objects.hash(sheet, start, end, absoluteStartColumn, absoluteStartRow,
                    absoluteEndColumn, absoluteEndRow);
        }
    }

    /**
     * Call of a built-in function. The name is stored upper-cased.
     */
    public static final class FunctionCall extends Expr {
        private final String name;
        private final List<Expr> args;

        public FunctionCall(String name, List<Expr> args) {
            this.name = name.toUpperCase(Locale.ROOT);
            this.args = List.copyOf(args);
        }

        public String getName() {
            return name;
        }

        public List<Expr> getArgs() {
            return args;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof FunctionCall)) {
                return false;
            }
            FunctionCall that = (FunctionCall) o;
            return name.equals(that.name) && args.equals(that.args);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, args);
        }
    }

    public static final class UnaryOp extends Expr {
        private final UnaryOperator op;
        private final Expr operand;

        public UnaryOp(UnaryOperator op, Expr operand) {
            this.op = Objects.requireNonNull(op);
            this.operand = Objects.requireNonNull(operand);
        }

        public UnaryOperator getOp() {
            return op;
        }

        public Expr getOperand() {
            return operand;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof UnaryOp)) {
                return false;
            }
            UnaryOp that = (UnaryOp) o;
            return op == that.op && operand.equals(that.operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, operand);
        }
    }

    public static final class BinaryOp extends Expr {
        private final BinaryOperator op;
        private final Expr left;
        private final Expr right;

        public BinaryOp(BinaryOperator op, Expr left, Expr right) {
            this.op = Objects.requireNonNull(op);
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        public BinaryOperator getOp() {
            return op;
        }

        public Expr getLeft() {
            return left;
        }

        public Expr getRight() {
            return right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryOp(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof BinaryOp)) {
                return false;
            }
            BinaryOp that = (BinaryOp) o;
            return op == that.op && left.equals(that.left) && right.equals(that.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, left, right);
        }
    }
}
