package com.spreadsheet.calc.models;

import com.spreadsheet.calc.formula.Expr;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - rawValue (exactly what was typed, e.g. "42" or "=SUM(A1:A3)")
 * - formula (the parsed expression, only for "=" input)
 * - evaluatedValue (the last computed result)
 * The address is the key under which the cell is stored, not part of the cell.
 */
public class Cell {
    private String rawValue;
    private Expr formula;
    private CellValue evaluatedValue;

    public Cell(String rawValue, Expr formula, CellValue evaluatedValue) {
        this.rawValue = rawValue;
        this.formula = formula;
        this.evaluatedValue = evaluatedValue == null ? CellValue.EMPTY : evaluatedValue;
    }

    public static Cell literal(String rawValue) {
        return new Cell(rawValue, null, CellValue.fromLiteralText(rawValue));
    }

    public String getRawValue() {
        return rawValue;
    }

    public Expr getFormula() {
        return formula;
    }

    public boolean hasFormula() {
        return formula != null;
    }

    // Structural edits rewrite the formula and its text together
    public void setFormula(Expr formula, String rawValue) {
        this.formula = formula;
        this.rawValue = rawValue;
    }

    public CellValue getEvaluatedValue() {
        return evaluatedValue;
    }

    public void setEvaluatedValue(CellValue evaluatedValue) {
        this.evaluatedValue = evaluatedValue == null ? CellValue.EMPTY : evaluatedValue;
    }

    /**
     * Snapshot used by undo. Expressions are immutable, so sharing the tree is safe.
     */
    public Cell copy() {
        return new Cell(rawValue, formula, evaluatedValue);
    }

    @Override
    public String toString() {
        return "Cell{" + rawValue + " -> " + evaluatedValue.toDisplayString() + "}";
    }
}
