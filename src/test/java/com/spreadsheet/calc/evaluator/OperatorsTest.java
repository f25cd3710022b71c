package com.spreadsheet.calc.evaluator;

import com.spreadsheet.calc.formula.BinaryOperator;
import com.spreadsheet.calc.formula.UnaryOperator;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OperatorsTest {

    private static final CellValue DIV0 = CellValue.error(ErrorKind.divideByZero());

    @Test
    void testArithmeticWithCoercion() {
        assertEquals(CellValue.number(5), Operators.applyBinary(BinaryOperator.ADD, CellValue.number(2), CellValue.string("3")));
        assertEquals(CellValue.number(2), Operators.applyBinary(BinaryOperator.MULTIPLY, CellValue.TRUE, CellValue.number(2)));
        assertEquals(CellValue.number(-4), Operators.applyBinary(BinaryOperator.SUBTRACT, CellValue.EMPTY, CellValue.number(4)));
        assertEquals(CellValue.number(8), Operators.applyBinary(BinaryOperator.POWER, CellValue.number(2), CellValue.number(3)));
    }

    /**
     * "+" with a non-numeric string falls back to concatenation.
     */
    @Test
    void testAddConcatenatesText() {
        assertEquals(CellValue.string("a1"), Operators.applyBinary(BinaryOperator.ADD, CellValue.string("a"), CellValue.number(1)));
    }

    @Test
    void testDivideByZero() {
        assertEquals(DIV0, Operators.applyBinary(BinaryOperator.DIVIDE, CellValue.number(1), CellValue.number(0)));
        assertEquals(DIV0, Operators.applyBinary(BinaryOperator.DIVIDE, CellValue.number(1), CellValue.EMPTY));
    }

    @Test
    void testErrorsPropagateLeftFirst() {
        CellValue ref = CellValue.error(ErrorKind.invalidRef("A1"));
        assertEquals(ref, Operators.applyBinary(BinaryOperator.ADD, ref, DIV0));
        assertEquals(DIV0, Operators.applyBinary(BinaryOperator.CONCAT, CellValue.string("x"), DIV0));
        assertEquals(DIV0, Operators.applyUnary(UnaryOperator.NEGATE, DIV0));
    }

    @Test
    void testTypeMismatchIsValueError() {
        CellValue result = Operators.applyBinary(BinaryOperator.MULTIPLY, CellValue.string("abc"), CellValue.number(2));
        assertTrue(result.isError());
        assertEquals("#VALUE!", result.toDisplayString());
        assertEquals("#NUM!", Operators.applyBinary(BinaryOperator.POWER, CellValue.number(-1), CellValue.number(0.5))
                .toDisplayString());
    }

    @Test
    void testUnary() {
        assertEquals(CellValue.number(-3), Operators.applyUnary(UnaryOperator.NEGATE, CellValue.number(3)));
        assertEquals(CellValue.number(0.5), Operators.applyUnary(UnaryOperator.PERCENT, CellValue.number(50)));
    }

    /**
     * Equality requires matching types; ordering uses the value comparison.
     */
    @Test
    void testComparisons() {
        assertEquals(CellValue.TRUE, Operators.applyBinary(BinaryOperator.EQUAL, CellValue.number(0.1 + 0.2), CellValue.number(0.3)));
        assertEquals(CellValue.FALSE, Operators.applyBinary(BinaryOperator.EQUAL, CellValue.string("1"), CellValue.number(1)));
        assertEquals(CellValue.TRUE, Operators.applyBinary(BinaryOperator.NOT_EQUAL, CellValue.string("a"), CellValue.string("b")));
        assertEquals(CellValue.TRUE, Operators.applyBinary(BinaryOperator.LESS_THAN, CellValue.number(2), CellValue.number(10)));
        assertEquals(CellValue.TRUE, Operators.applyBinary(BinaryOperator.GREATER_THAN_OR_EQUAL, CellValue.string("b"), CellValue.string("a")));
    }

    @Test
    void testConcat() {
        assertEquals(CellValue.string("x1TRUE"), Operators.applyBinary(BinaryOperator.CONCAT,
                Operators.applyBinary(BinaryOperator.CONCAT, CellValue.string("x"), CellValue.number(1)), CellValue.TRUE));
    }
}
