package com.spreadsheet.calc.formula;

/**
 * One method per expression node kind. Implemented by the evaluator,
 * the reference extractor, the transformer and the formatter.
 */
public interface ExprVisitor<R> {

    R visitLiteral(Expr.Literal literal);

    R visitReference(Expr.Reference reference);

    R visitRange(Expr.Range range);

    R visitFunctionCall(Expr.FunctionCall call);

    R visitUnaryOp(Expr.UnaryOp unary);

    R visitBinaryOp(Expr.BinaryOp binary);
}
