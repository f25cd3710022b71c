package com.spreadsheet.calc.formula;

/**
 * Prefix negation and postfix percent.
 * Negation binds looser than power (-2^2 is -4), percent tighter than everything.
 */
public enum UnaryOperator {
    NEGATE("-", 5),
    PERCENT("%", 7);

    private final String symbol;
    private final int precedence;

    UnaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }
}
