package com.spreadsheet.calc.models;

import com.spreadsheet.calc.exceptions.InvalidAddressException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CellAddressTest {

    /**
     * A1 notation maps to 0-based column/row and back.
     */
    @Test
    void testA1RoundTrip() {
        CellAddress b7 = CellAddress.fromA1("B7");
        assertEquals(1, b7.getColumn());
        assertEquals(6, b7.getRow());
        assertEquals("B7", b7.toA1());

        assertEquals(CellAddress.of(26, 0), CellAddress.fromA1("aa1"));
        assertEquals(CellAddress.of(1, 6), CellAddress.fromA1("$B$7"));
    }

    @Test
    void testColumnLabels() {
        assertEquals(0, CellAddress.columnLabelToIndex("A"));
        assertEquals(25, CellAddress.columnLabelToIndex("Z"));
        assertEquals(26, CellAddress.columnLabelToIndex("AA"));
        assertEquals(701, CellAddress.columnLabelToIndex("ZZ"));
        assertEquals("AAA", CellAddress.columnIndexToLabel(702));
        assertEquals("XFD", CellAddress.columnIndexToLabel(16383));
    }

    @Test
    void testInvalidAddresses() {
        assertThrows(InvalidAddressException.class, () -> CellAddress.fromA1("A0"));
        assertThrows(InvalidAddressException.class, () -> CellAddress.fromA1("1A"));
        assertThrows(InvalidAddressException.class, () -> CellAddress.fromA1(""));
        assertThrows(InvalidAddressException.class, () -> CellAddress.fromA1(null));
        assertThrows(InvalidAddressException.class, () -> CellAddress.columnIndexToLabel(-1));
    }

    /**
     * Row-major: everything in row 1 sorts before row 2.
     */
    @Test
    void testRowMajorOrdering() {
        List<CellAddress> cells = new ArrayList<>(List.of(
                CellAddress.fromA1("A2"), CellAddress.fromA1("B1"), CellAddress.fromA1("A1")));
        Collections.sort(cells);
        assertEquals(List.of(CellAddress.fromA1("A1"), CellAddress.fromA1("B1"), CellAddress.fromA1("A2")), cells);
    }

    @Test
    void testRangeNormalisesCorners() {
        CellRange range = CellRange.fromA1("B3:A1");
        assertEquals(CellAddress.fromA1("A1"), range.getStart());
        assertEquals(CellAddress.fromA1("B3"), range.getEnd());
        assertEquals(6, range.size());
        assertTrue(range.contains(CellAddress.fromA1("B2")));
        assertFalse(range.contains(CellAddress.fromA1("C2")));
        assertEquals(CellAddress.fromA1("B1"), range.cells().get(1));
    }
}
