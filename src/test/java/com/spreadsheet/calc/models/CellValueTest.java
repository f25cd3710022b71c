package com.spreadsheet.calc.models;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CellValueTest {

    /**
     * Literal input: numbers, booleans in any case, text, and empty.
     */
    @Test
    void testFromLiteralText() {
        assertEquals(CellValue.number(42), CellValue.fromLiteralText("42"));
        assertEquals(CellValue.number(-1.5), CellValue.fromLiteralText(" -1.5 "));
        assertEquals(CellValue.TRUE, CellValue.fromLiteralText("true"));
        assertEquals(CellValue.FALSE, CellValue.fromLiteralText("FALSE"));
        assertEquals(CellValue.string("hello"), CellValue.fromLiteralText("hello"));
        assertEquals(CellValue.EMPTY, CellValue.fromLiteralText(""));
    }

    @Test
    void testDisplayStrings() {
        assertEquals("30", CellValue.number(30).toDisplayString());
        assertEquals("0.5", CellValue.number(0.5).toDisplayString());
        assertEquals("TRUE", CellValue.TRUE.toDisplayString());
        assertEquals("", CellValue.EMPTY.toDisplayString());
        assertEquals("#DIV/0!", CellValue.error(ErrorKind.divideByZero()).toDisplayString());
        assertEquals("{1,a}", CellValue.array(List.of(CellValue.number(1), CellValue.string("a"))).toDisplayString());
    }

    @Test
    void testTypedAccessorsRejectOtherTypes() {
        assertThrows(IllegalStateException.class, () -> CellValue.string("x").getNumber());
        assertThrows(IllegalStateException.class, () -> CellValue.number(1).getError());
    }

    /**
     * Empty sorts first; numeric text compares as a number against numbers.
     */
    @Test
    void testComparison() {
        assertTrue(CellValue.EMPTY.compareTo(CellValue.number(-100)) < 0);
        assertTrue(CellValue.number(2).compareTo(CellValue.number(10)) < 0);
        assertTrue(CellValue.string("10").compareTo(CellValue.number(9)) > 0);
        assertTrue(CellValue.string("apple").compareTo(CellValue.string("banana")) < 0);
        assertEquals(0, CellValue.TRUE.compareTo(CellValue.bool(true)));
    }

    @Test
    void testErrorCodes() {
        assertEquals("#REF!", ErrorKind.invalidRef("A5").getCode());
        assertEquals("#NAME?", ErrorKind.fromCode("#name?").getCode());
        assertNull(ErrorKind.fromCode("#NOPE"));
    }
}
