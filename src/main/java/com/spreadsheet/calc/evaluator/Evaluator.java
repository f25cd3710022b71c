package com.spreadsheet.calc.evaluator;

import com.spreadsheet.calc.exceptions.SheetNotFoundException;
import com.spreadsheet.calc.formula.Expr;
import com.spreadsheet.calc.formula.ExprVisitor;
import com.spreadsheet.calc.formula.FormulaFormatter;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the value of an expression against an {@link EvaluationContext}.
 * Stateless; every call gets its own visitor.
 */
public class Evaluator {

    private final FunctionLibrary functions;

    public Evaluator(FunctionLibrary functions) {
        this.functions = functions;
    }

    public Evaluator() {
        this(new FunctionLibrary());
    }

    public CellValue evaluate(Expr expr, EvaluationContext context) {
        return expr.accept(new Visitor(context));
    }

    /**
     * Evaluates the formula of {@code cell}, keeping it on the context's stack meanwhile.
     */
    public CellValue evaluateCell(CellAddress cell, Expr expr, EvaluationContext context) {
        context.push(cell);
        try {
            return evaluate(expr, context);
        } finally {
            context.pop(cell);
        }
    }

    private final class Visitor implements ExprVisitor<CellValue> {
        private final EvaluationContext context;

        Visitor(EvaluationContext context) {
            this.context = context;
        }

        @Override
        public CellValue visitLiteral(Expr.Literal literal) {
            return literal.getValue();
        }

        @Override
        public CellValue visitReference(Expr.Reference reference) {
            if (reference.isLocal()) {
                return localValue(reference.getAddress());
            }
            try {
                return context.getSheetCellValue(reference.getSheet(), reference.getAddress());
            } catch (SheetNotFoundException e) {
                return CellValue.error(ErrorKind.invalidRef(FormulaFormatter.format(reference)));
            }
        }

        @Override
        public CellValue visitRange(Expr.Range range) {
            List<CellAddress> cells = range.toCellRange().cells();
            List<CellValue> values = new ArrayList<>(cells.size());
            if (range.isLocal()) {
                for (CellAddress address : cells) {
                    values.add(localValue(address));
                }
                return CellValue.array(values);
            }
            try {
                for (CellAddress address : cells) {
                    values.add(context.getSheetCellValue(range.getSheet(), address));
                }
            } catch (SheetNotFoundException e) {
                return CellValue.error(ErrorKind.invalidRef(FormulaFormatter.format(range)));
            }
            return CellValue.array(values);
        }

        @Override
        public CellValue visitFunctionCall(Expr.FunctionCall call) {
            // every argument is evaluated, IF included
            List<CellValue> args = new ArrayList<>(call.getArgs().size());
            for (Expr arg : call.getArgs()) {
                args.add(arg.accept(this));
            }
            return functions.call(call.getName(), args);
        }

        @Override
        public CellValue visitUnaryOp(Expr.UnaryOp unary) {
            return Operators.applyUnary(unary.getOp(), unary.getOperand().accept(this));
        }

        @Override
        public CellValue visitBinaryOp(Expr.BinaryOp binary) {
            CellValue left = binary.getLeft().accept(this);
            CellValue right = binary.getRight().accept(this);
            return Operators.applyBinary(binary.getOp(), left, right);
        }

        private CellValue localValue(CellAddress address) {
            if (context.isEvaluating(address)) {
                return CellValue.error(ErrorKind.circularDependency(List.of(address)));
            }
            return context.getCellValue(address);
        }
    }
}
