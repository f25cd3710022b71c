package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellValue;

import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Prints an expression back to formula text (without the leading "=").
 * Parentheses are only emitted where precedence or associativity needs them,
 * so parse(format(e)) gives back e.
 */
public final class FormulaFormatter implements ExprVisitor<String> {

    private static final FormulaFormatter INSTANCE = new FormulaFormatter();
    private static final Pattern PLAIN_SHEET_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.]*$");

    // literals, references and calls never need wrapping
    private static final int ATOM = 100;

    private FormulaFormatter() {
    }

    public static String format(Expr expr) {
        return expr.accept(INSTANCE);
    }

    @Override
    public String visitLiteral(Expr.Literal literal) {
        CellValue value = literal.getValue();
        switch (value.getType()) {
            case NUMBER:
                return CellValue.formatNumber(value.getNumber());
            case STRING:
                return "\"" + value.getText().replace("\"", "\"\"") + "\"";
            case BOOLEAN:
                return value.getBoolean() ? "TRUE" : "FALSE";
            case ERROR:
                return value.getError().getCode();
            case EMPTY:
                return "\"\"";
            default:
                return value.toDisplayString();
        }
    }

    @Override
    public String visitReference(Expr.Reference reference) {
        return sheetPrefix(reference.getSheet())
                + corner(reference.getAddress(), reference.isAbsoluteColumn(), reference.isAbsoluteRow());
    }

    @Override
    public String visitRange(Expr.Range range) {
        return sheetPrefix(range.getSheet())
                + corner(range.getStart(), range.isAbsoluteStartColumn(), range.isAbsoluteStartRow())
                + ":"
                + corner(range.getEnd(), range.isAbsoluteEndColumn(), range.isAbsoluteEndRow());
    }

    @Override
    public String visitFunctionCall(Expr.FunctionCall call) {
        return call.getName() + call.getArgs().stream()
                .map(FormulaFormatter::format)
                .collect(Collectors.joining(",", "(", ")"));
    }

    @Override
    public String visitUnaryOp(Expr.UnaryOp unary) {
        UnaryOperator op = unary.getOp();
        String operand = wrapIf(unary.getOperand(), precedenceOf(unary.getOperand()) < op.getPrecedence());
        return op == UnaryOperator.NEGATE ? "-" + operand : operand + "%";
    }

    @Override
    public String visitBinaryOp(Expr.BinaryOp binary) {
        BinaryOperator op = binary.getOp();
        int leftPrecedence = precedenceOf(binary.getLeft());
        int rightPrecedence = precedenceOf(binary.getRight());
        boolean wrapLeft = leftPrecedence < op.getPrecedence()
                || (leftPrecedence == op.getPrecedence() && op.isRightAssociative());
        boolean wrapRight = rightPrecedence < op.getPrecedence()
                || (rightPrecedence == op.getPrecedence() && !op.isRightAssociative());
        return wrapIf(binary.getLeft(), wrapLeft) + op.getSymbol() + wrapIf(binary.getRight(), wrapRight);
    }

    private static String wrapIf(Expr expr, boolean wrap) {
        String text = format(expr);
        return wrap ? "(" + text + ")" : text;
    }

    private static int precedenceOf(Expr expr) {
        if (expr instanceof Expr.BinaryOp) {
            return ((Expr.BinaryOp) expr).getOp().getPrecedence();
        }
        if (expr instanceof Expr.UnaryOp) {
            return ((Expr.UnaryOp) expr).getOp().getPrecedence();
        }
        if (expr instanceof Expr.Literal) {
            CellValue value = ((Expr.Literal) expr).getValue();
            // a negative constant prints with a leading "-"
            if (value.isNumber() && value.getNumber() < 0) {
                return UnaryOperator.NEGATE.getPrecedence();
            }
        }
        return ATOM;
    }

    private static String sheetPrefix(String sheet) {
        if (sheet == null) {
            return "";
        }
        if (PLAIN_SHEET_NAME.matcher(sheet).matches()) {
            return sheet + "!";
        }
        return "'" + sheet.replace("'", "''") + "'!";
    }

    private static String corner(CellAddress address, boolean absoluteColumn, boolean absoluteRow) {
        return (absoluteColumn ? "$" : "") + CellAddress.columnIndexToLabel(address.getColumn())
                + (absoluteRow ? "$" : "") + (address.getRow() + 1);
    }
}
