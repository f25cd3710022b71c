package com.spreadsheet.calc.evaluator;

import com.spreadsheet.calc.formula.BinaryOperator;
import com.spreadsheet.calc.formula.UnaryOperator;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorKind;

/**
 * Operator semantics. Results are always values: type mismatches and
 * arithmetic failures come back as error values, never as exceptions.
 */
public final class Operators {

    private static final double EQUALITY_TOLERANCE = Math.ulp(1d);

    private Operators() {
    }

    public static CellValue applyUnary(UnaryOperator op, CellValue operand) {
        if (operand.isError()) {
            return operand;
        }
        try {
            double number = Coercion.toNumber(operand);
            return op == UnaryOperator.NEGATE
                    ? CellValue.number(-number)
                    : CellValue.number(number / 100d);
        } catch (CoercionException e) {
            return e.toValue();
        }
    }

    public static CellValue applyBinary(BinaryOperator op, CellValue left, CellValue right) {
        // errors win before any coercion, left first
        if (left.isError()) {
            return left;
        }
        if (right.isError()) {
            return right;
        }
        try {
            switch (op) {
                case ADD:
                    return add(left, right);
                case SUBTRACT:
                    return CellValue.number(Coercion.toNumber(left) - Coercion.toNumber(right));
                case MULTIPLY:
                    return CellValue.number(Coercion.toNumber(left) * Coercion.toNumber(right));
                case DIVIDE:
                    return divide(left, right);
                case POWER:
                    return power(left, right);
                case CONCAT:
                    return CellValue.string(Coercion.toText(left) + Coercion.toText(right));
                case EQUAL:
                    return CellValue.bool(valuesEqual(left, right));
                case NOT_EQUAL:
                    return CellValue.bool(!valuesEqual(left, right));
                case LESS_THAN:
                    return CellValue.bool(left.compareTo(right) < 0);
                case LESS_THAN_OR_EQUAL:
                    return CellValue.bool(left.compareTo(right) <= 0);
                case GREATER_THAN:
                    return CellValue.bool(left.compareTo(right) > 0);
                case GREATER_THAN_OR_EQUAL:
                    return CellValue.bool(left.compareTo(right) >= 0);
                default:
                    throw new IllegalArgumentException("Unsupported operator: " + op);
            }
        } catch (CoercionException e) {
            return e.toValue();
        }
    }

    private static CellValue add(CellValue left, CellValue right) throws CoercionException {
        try {
            return CellValue.number(Coercion.toNumber(left) + Coercion.toNumber(right));
        } catch (CoercionException e) {
            if (left.isString() || right.isString()) {
                return CellValue.string(Coercion.toText(left) + Coercion.toText(right));
            }
            throw e;
        }
    }

    private static CellValue divide(CellValue left, CellValue right) throws CoercionException {
        double numerator = Coercion.toNumber(left);
        double denominator = Coercion.toNumber(right);
        if (denominator == 0d) {
            return CellValue.error(ErrorKind.divideByZero());
        }
        return CellValue.number(numerator / denominator);
    }

    private static CellValue power(CellValue left, CellValue right) throws CoercionException {
        double result = Math.pow(Coercion.toNumber(left), Coercion.toNumber(right));
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            return CellValue.error(ErrorKind.numError());
        }
        return CellValue.number(result);
    }

    /**
     * Equality only holds between values of the same type; "1" does not equal 1.
     */
    static boolean valuesEqual(CellValue left, CellValue right) {
        if (left.getType() != right.getType()) {
            return false;
        }
        if (left.isNumber()) {
            return Math.abs(left.getNumber() - right.getNumber()) < EQUALITY_TOLERANCE;
        }
        return left.equals(right);
    }
}
