package com.spreadsheet.calc.formula;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormulaFormatterTest {

    private FormulaParser parser;

    @BeforeEach
    void setUp() {
        parser = new FormulaParser();
    }

    private String normalise(String formula) {
        return FormulaFormatter.format(parser.parse(formula));
    }

    /**
     * Redundant parentheses are dropped, required ones kept.
     */
    @Test
    void testMinimalParentheses() {
        assertEquals("1+2*3", normalise("=1+(2*3)"));
        assertEquals("(1+2)*3", normalise("=(1+2)*3"));
        assertEquals("1-2-3", normalise("=(1-2)-3"));
        assertEquals("1-(2-3)", normalise("=1-(2-3)"));
        assertEquals("2^3^2", normalise("=2^(3^2)"));
        assertEquals("(2^3)^2", normalise("=(2^3)^2"));
    }

    @Test
    void testReferencesAndCalls() {
        assertEquals("SUM(A1:B2,$C$3)", normalise("=SUM(A1:B2, $C$3)"));
        assertEquals("Sheet2!A1+'My Sheet'!B2", normalise("=Sheet2!A1+'My Sheet'!B2"));
        assertEquals("\"total: \"&A1", normalise("=\"total: \" & A1"));
        assertEquals("-A1%", normalise("=-A1%"));
        assertEquals("A1>=TRUE", normalise("=A1>=true"));
    }

    /**
     * Formatting then parsing again gives the same tree.
     */
    @Test
    void testReparseGivesSameTree() {
        for (String formula : List.of("=1-(2-3)*4", "=IF(A1>0,\"pos\",-A1)", "=-(1+2)^2",
                "=SUM(A1:A10)/COUNT(A1:A10)", "=(A1&B1)=\"ab\"", "=2^-1")) {
            Expr expr = parser.parse(formula);
            assertEquals(expr, parser.parse(FormulaFormatter.format(expr)), formula);
        }
    }
}
