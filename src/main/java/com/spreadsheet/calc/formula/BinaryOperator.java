package com.spreadsheet.calc.formula;

/**
 * Infix operators, with their formula symbol and binding strength
 * (higher binds tighter).
 */
public enum BinaryOperator {
    EQUAL("=", 1),
    NOT_EQUAL("<>", 1),
    LESS_THAN("<", 1),
    LESS_THAN_OR_EQUAL("<=", 1),
    GREATER_THAN(">", 1),
    GREATER_THAN_OR_EQUAL(">=", 1),
    CONCAT("&", 2),
    ADD("+", 3),
    SUBTRACT("-", 3),
    MULTIPLY("*", 4),
    DIVIDE("/", 4),
    POWER("^", 6);

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isRightAssociative() {
        return this == POWER;
    }

    public boolean isComparison() {
        return precedence == 1;
    }
}
