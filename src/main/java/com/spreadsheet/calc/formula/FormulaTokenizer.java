package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.exceptions.FormulaParseException;
import com.spreadsheet.calc.models.ErrorKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits formula text into tokens. Words ("A1", "$B$2", "SUM", "Sheet1") are not
 * classified here; the parser decides from what follows them.
 */
final class FormulaTokenizer {

    enum TokenType {
        NUMBER,
        STRING,
        ERROR,
        WORD,
        QUOTED_SHEET,
        OPERATOR,
        LEFT_PAREN,
        RIGHT_PAREN,
        COMMA,
        COLON,
        BANG,
        END
    }

    static final class Token {
        final TokenType type;
        final String text;
        final int position;

        Token(TokenType type, String text, int position) {
            this.type = type;
            this.text = text;
            this.position = position;
        }

        boolean is(TokenType expected) {
            return type == expected;
        }

        boolean isOperator(String symbol) {
            return type == TokenType.OPERATOR && text.equals(symbol);
        }

        @Override
        public String toString() {
            return type + "(" + text + ")";
        }
    }

    private static final String[] ERROR_CODES = {
            "#DIV/0!", "#VALUE!", "#NUM!", "#REF!", "#NAME?", "#CIRC!", "#ERROR!"
    };

    private final String source;
    private int pos;

    private FormulaTokenizer(String source) {
        this.source = source;
    }

    static List<Token> tokenize(String source) {
        return new FormulaTokenizer(source).run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.END, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        char c = source.charAt(pos);
        int start = pos;

        if (isAsciiDigit(c) || (c == '.' && pos + 1 < source.length()
                && isAsciiDigit(source.charAt(pos + 1)))) {
            return readNumber();
        }
        if (c == '"') {
            return readString();
        }
        if (c == '\'') {
            return readQuotedSheet();
        }
        if (c == '#') {
            return readError();
        }
        if (Character.isLetter(c) || c == '_' || c == '$') {
            return readWord();
        }

        pos++;
        switch (c) {
            case '(':
                return new Token(TokenType.LEFT_PAREN, "(", start);
            case ')':
                return new Token(TokenType.RIGHT_PAREN, ")", start);
            case ',':
                return new Token(TokenType.COMMA, ",", start);
            case ':':
                return new Token(TokenType.COLON, ":", start);
            case '!':
                return new Token(TokenType.BANG, "!", start);
            case '+':
            case '-':
            case '*':
            case '/':
            case '^':
            case '&':
            case '%':
            case '=':
                return new Token(TokenType.OPERATOR, String.valueOf(c), start);
            case '<':
                if (peek('>') || peek('=')) {
                    return new Token(TokenType.OPERATOR, "<" + source.charAt(pos++), start);
                }
                return new Token(TokenType.OPERATOR, "<", start);
            case '>':
                if (peek('=')) {
                    pos++;
                    return new Token(TokenType.OPERATOR, ">=", start);
                }
                return new Token(TokenType.OPERATOR, ">", start);
            default:
                throw new FormulaParseException("Unexpected character '" + c + "'", start);
        }
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean peek(char expected) {
        return pos < source.length() && source.charAt(pos) == expected;
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private Token readNumber() {
        int start = pos;
        while (pos < source.length() && isAsciiDigit(source.charAt(pos))) {
            pos++;
        }
        if (peek('.')) {
            pos++;
            while (pos < source.length() && isAsciiDigit(source.charAt(pos))) {
                pos++;
            }
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (peek('+') || peek('-')) {
                pos++;
            }
            if (pos < source.length() && isAsciiDigit(source.charAt(pos))) {
                while (pos < source.length() && isAsciiDigit(source.charAt(pos))) {
                    pos++;
                }
            } else {
                // "2E" without digits: leave the letter for the next token
                pos = mark;
            }
        }
        return new Token(TokenType.NUMBER, source.substring(start, pos), start);
    }

    private Token readString() {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == '"') {
                if (peek('"')) {
                    sb.append('"');
                    pos++;
                } else {
                    return new Token(TokenType.STRING, sb.toString(), start);
                }
            } else {
                sb.append(c);
            }
        }
        throw new FormulaParseException("Unterminated string literal", start);
    }

    private Token readQuotedSheet() {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == '\'') {
                if (peek('\'')) {
                    sb.append('\'');
                    pos++;
                } else {
                    return new Token(TokenType.QUOTED_SHEET, sb.toString(), start);
                }
            } else {
                sb.append(c);
            }
        }
        throw new FormulaParseException("Unterminated sheet name", start);
    }

    private Token readError() {
        int start = pos;
        for (String code : ERROR_CODES) {
            if (source.regionMatches(true, pos, code, 0, code.length())) {
                pos += code.length();
                return new Token(TokenType.ERROR, ErrorKind.Type.fromCode(code).getCode(), start);
            }
        }
        throw new FormulaParseException("Unknown error literal", start);
    }

    private Token readWord() {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '.') {
                pos++;
            } else {
                break;
            }
        }
        return new Token(TokenType.WORD, source.substring(start, pos), start);
    }
}
