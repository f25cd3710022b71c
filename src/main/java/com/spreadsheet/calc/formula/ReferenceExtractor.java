package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.models.CellAddress;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Collects the same-sheet cells an expression reads. Ranges contribute every
 * cell of their rectangle. References into other sheets are not collected;
 * those are resolved through the workbook at evaluation time only.
 */
public final class ReferenceExtractor implements ExprVisitor<Set<CellAddress>> {

    private static final ReferenceExtractor INSTANCE = new ReferenceExtractor();

    private ReferenceExtractor() {
    }

    public static SortedSet<CellAddress> extract(Expr expr) {
        SortedSet<CellAddress> result = new TreeSet<>();
        result.addAll(expr.accept(INSTANCE));
        return result;
    }

    @Override
    public Set<CellAddress> visitLiteral(Expr.Literal literal) {
        return Collections.emptySet();
    }

    @Override
    public Set<CellAddress> visitReference(Expr.Reference reference) {
        if (!reference.isLocal()) {
            return Collections.emptySet();
        }
        return Collections.singleton(reference.getAddress());
    }

    @Override
    public Set<CellAddress> visitRange(Expr.Range range) {
        if (!range.isLocal()) {
            return Collections.emptySet();
        }
        return new TreeSet<>(range.toCellRange().cells());
    }

    @Override
    public Set<CellAddress> visitFunctionCall(Expr.FunctionCall call) {
        Set<CellAddress> result = new TreeSet<>();
        for (Expr arg : call.getArgs()) {
            result.addAll(arg.accept(this));
        }
        return result;
    }

    @Override
    public Set<CellAddress> visitUnaryOp(Expr.UnaryOp unary) {
        return unary.getOperand().accept(this);
    }

    @Override
    public Set<CellAddress> visitBinaryOp(Expr.BinaryOp binary) {
        Set<CellAddress> result = new TreeSet<>(binary.getLeft().accept(this));
        result.addAll(binary.getRight().accept(this));
        return result;
    }
}
