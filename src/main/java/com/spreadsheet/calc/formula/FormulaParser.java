package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.exceptions.FormulaParseException;
import com.spreadsheet.calc.formula.FormulaTokenizer.Token;
import com.spreadsheet.calc.formula.FormulaTokenizer.TokenType;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser from formula text to {@link Expr}.
 *
 * <p>A leading "=" is optional and has no effect. Precedence, lowest first:
 * comparison, concatenation (&amp;), additive, multiplicative, negation,
 * power (right-associative), postfix percent.
 *
 * <p>Instances are immutable and can be shared between threads.
 */
public class FormulaParser {

    private static final Pattern REFERENCE_PATTERN = Pattern.compile("^(\\$?)([A-Za-z]+)(\\$?)([0-9]+)$");
    private static final Pattern FUNCTION_NAME_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.]*$");

    private final int maxColumns;
    private final int maxRows;

    public FormulaParser() {
        this(16384, 1048576);
    }

    public FormulaParser(int maxColumns, int maxRows) {
        this.maxColumns = maxColumns;
        this.maxRows = maxRows;
    }

    public int getMaxColumns() {
        return maxColumns;
    }

    public int getMaxRows() {
        return maxRows;
    }

    public Expr parse(String text) {
        if (text == null) {
            throw new FormulaParseException("Empty formula", 0);
        }
        String body = text.trim();
        if (body.startsWith("=")) {
            body = body.substring(1);
        }
        if (body.isBlank()) {
            throw new FormulaParseException("Empty formula", 0);
        }
        return new Parser(FormulaTokenizer.tokenize(body)).parseFormula();
    }

    /**
     * Formula input is anything whose first character is "=".
     */
    public static boolean isFormula(String raw) {
        return raw != null && raw.startsWith("=");
    }

    private final class Parser {
        private final List<Token> tokens;
        private int index;

        Parser(List<Token> tokens) {
            this.tokens = tokens;
        }

        Expr parseFormula() {
            Expr expr = parseComparison();
            Token trailing = current();
            if (trailing.is(TokenType.RIGHT_PAREN)) {
                throw new FormulaParseException("Unbalanced parentheses: unexpected ')'", trailing.position);
            }
            if (!trailing.is(TokenType.END)) {
                throw new FormulaParseException("Unexpected '" + trailing.text + "'", trailing.position);
            }
            return expr;
        }

        private Expr parseComparison() {
            Expr left = parseConcat();
            while (true) {
                BinaryOperator op = comparisonOperator(current());
                if (op == null) {
                    return left;
                }
                advance();
                left = Expr.binary(op, left, parseConcat());
            }
        }

        private Expr parseConcat() {
            Expr left = parseAdditive();
            while (current().isOperator("&")) {
                advance();
                left = Expr.binary(BinaryOperator.CONCAT, left, parseAdditive());
            }
            return left;
        }

        private Expr parseAdditive() {
            Expr left = parseMultiplicative();
            while (true) {
                if (current().isOperator("+")) {
                    advance();
                    left = Expr.binary(BinaryOperator.ADD, left, parseMultiplicative());
                } else if (current().isOperator("-")) {
                    advance();
                    left = Expr.binary(BinaryOperator.SUBTRACT, left, parseMultiplicative());
                } else {
                    return left;
                }
            }
        }

        private Expr parseMultiplicative() {
            Expr left = parseUnary();
            while (true) {
                if (current().isOperator("*")) {
                    advance();
                    left = Expr.binary(BinaryOperator.MULTIPLY, left, parseUnary());
                } else if (current().isOperator("/")) {
                    advance();
                    left = Expr.binary(BinaryOperator.DIVIDE, left, parseUnary());
                } else {
                    return left;
                }
            }
        }

        private Expr parseUnary() {
            if (current().isOperator("-")) {
                advance();
                return Expr.unary(UnaryOperator.NEGATE, parseUnary());
            }
            if (current().isOperator("+")) {
                advance();
                return parseUnary();
            }
            return parsePower();
        }

        private Expr parsePower() {
            Expr base = parsePostfix();
            if (current().isOperator("^")) {
                advance();
                return Expr.binary(BinaryOperator.POWER, base, parseExponent());
            }
            return base;
        }

        // 2^-1 is legal; 2^3^2 is 2^(3^2)
        private Expr parseExponent() {
            if (current().isOperator("-")) {
                advance();
                return Expr.unary(UnaryOperator.NEGATE, parseExponent());
            }
            if (current().isOperator("+")) {
                advance();
                return parseExponent();
            }
            return parsePower();
        }

        private Expr parsePostfix() {
            Expr expr = parsePrimary();
            while (current().isOperator("%")) {
                advance();
                expr = Expr.unary(UnaryOperator.PERCENT, expr);
            }
            return expr;
        }

        private Expr parsePrimary() {
            Token token = current();
            switch (token.type) {
                case NUMBER:
                    advance();
                    return Expr.literal(CellValue.number(Double.parseDouble(token.text)));
                case STRING:
                    advance();
                    return Expr.literal(CellValue.string(token.text));
                case ERROR:
                    advance();
                    return Expr.literal(CellValue.error(ErrorKind.fromCode(token.text)));
                case LEFT_PAREN:
                    advance();
                    Expr inner = parseComparison();
                    expectClosingParen(token);
                    return inner;
                case QUOTED_SHEET:
                    advance();
                    expect(TokenType.BANG, "'!' after sheet name");
                    return parseReferenceOrRange(token.text);
                case WORD:
                    return parseWord(token);
                case RIGHT_PAREN:
                    throw new FormulaParseException("Unbalanced parentheses: unexpected ')'", token.position);
                case END:
                    throw new FormulaParseException("Unexpected end of formula", token.position);
                default:
                    throw new FormulaParseException("Unexpected '" + token.text + "'", token.position);
            }
        }

        private Expr parseWord(Token word) {
            Token following = peek(1);
            if (following.is(TokenType.LEFT_PAREN)) {
                return parseFunctionCall(word);
            }
            if (following.is(TokenType.BANG)) {
                advance();
                advance();
                return parseReferenceOrRange(word.text);
            }
            if ("TRUE".equalsIgnoreCase(word.text)) {
                advance();
                return Expr.literal(CellValue.TRUE);
            }
            if ("FALSE".equalsIgnoreCase(word.text)) {
                advance();
                return Expr.literal(CellValue.FALSE);
            }
            if (REFERENCE_PATTERN.matcher(word.text).matches()) {
                return parseReferenceOrRange(null);
            }
            throw new FormulaParseException("Unknown identifier '" + word.text + "'", word.position);
        }

        private Expr parseFunctionCall(Token name) {
            if (!FUNCTION_NAME_PATTERN.matcher(name.text).matches()) {
                throw new FormulaParseException("Invalid function name '" + name.text + "'", name.position);
            }
            String functionName = name.text.toUpperCase(Locale.ROOT);
            advance();
            Token open = current();
            advance();
            List<Expr> args = new ArrayList<>();
            if (current().is(TokenType.RIGHT_PAREN)) {
                advance();
                return Expr.call(functionName, args);
            }
            while (true) {
                args.add(parseComparison());
                if (current().is(TokenType.COMMA)) {
                    advance();
                } else {
                    break;
                }
            }
            expectClosingParen(open);
            return Expr.call(functionName, args);
        }

        private Expr parseReferenceOrRange(String sheet) {
            Token first = expect(TokenType.WORD, "cell reference");
            RefParts start = toRefParts(first);
            if (!current().is(TokenType.COLON)) {
                return new Expr.Reference(sheet, start.address, start.absoluteColumn, start.absoluteRow);
            }
            advance();
            RefParts end = toRefParts(expect(TokenType.WORD, "cell reference after ':'"));
            return new Expr.Range(sheet, start.address, end.address,
                    start.absoluteColumn, start.absoluteRow, end.absoluteColumn, end.absoluteRow);
        }

        private RefParts toRefParts(Token token) {
            Matcher matcher = REFERENCE_PATTERN.matcher(token.text);
            if (!matcher.matches()) {
                throw new FormulaParseException("Invalid cell reference '" + token.text + "'", token.position);
            }
            String letters = matcher.group(2);
            String digits = matcher.group(4);
            // a label longer than 6 letters is past any supported column
            if (letters.length() > 6) {
                throw new FormulaParseException("Column " + letters.toUpperCase(Locale.ROOT) + " is beyond the maximum column",
                        token.position);
            }
            int column = CellAddress.columnLabelToIndex(letters);
            if (column >= maxColumns) {
                throw new FormulaParseException("Column " + letters.toUpperCase(Locale.ROOT) + " is beyond the maximum column "
                        + CellAddress.columnIndexToLabel(maxColumns - 1), token.position);
            }
            long rowNumber = digits.length() > 10 ? Long.MAX_VALUE : Long.parseLong(digits);
            if (rowNumber < 1) {
                throw new FormulaParseException("Row number must be greater than 0 in '" + token.text + "'",
                        token.position);
            }
            if (rowNumber > maxRows) {
                throw new FormulaParseException("Row " + digits + " is beyond the maximum row " + maxRows,
                        token.position);
            }
            return new RefParts(new CellAddress(column, (int) rowNumber - 1),
                    !matcher.group(1).isEmpty(), !matcher.group(3).isEmpty());
        }

        private BinaryOperator comparisonOperator(Token token) {
            if (!token.is(TokenType.OPERATOR)) {
                return null;
            }
            switch (token.text) {
                case "=":
                    return BinaryOperator.EQUAL;
                case "<>":
                    return BinaryOperator.NOT_EQUAL;
                case "<":
                    return BinaryOperator.LESS_THAN;
                case "<=":
                    return BinaryOperator.LESS_THAN_OR_EQUAL;
                case ">":
                    return BinaryOperator.GREATER_THAN;
                case ">=":
                    return BinaryOperator.GREATER_THAN_OR_EQUAL;
                default:
                    return null;
            }
        }

        private void expectClosingParen(Token open) {
            Token token = current();
            if (!token.is(TokenType.RIGHT_PAREN)) {
                throw new FormulaParseException("Unbalanced parentheses: '(' is never closed", open.position);
            }
            advance();
        }

        private Token expect(TokenType type, String what) {
            Token token = current();
            if (!token.is(type)) {
                throw new FormulaParseException("Expected " + what + " but found '" + token.text + "'",
                        token.position);
            }
            advance();
            return token;
        }

        private Token current() {
            return tokens.get(index);
        }

        private Token peek(int ahead) {
            return tokens.get(Math.min(index + ahead, tokens.size() - 1));
        }

        private void advance() {
            if (index < tokens.size() - 1) {
                index++;
            }
        }
    }

    private static final class RefParts {
        final CellAddress address;
        final boolean absoluteColumn;
        final boolean absoluteRow;

        RefParts(CellAddress address, boolean absoluteColumn, boolean absoluteRow) {
            this.address = address;
            this.absoluteColumn = absoluteColumn;
            this.absoluteRow = absoluteRow;
        }
    }
}
