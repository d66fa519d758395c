package com.tinysql.parser;

import com.tinysql.exception.LexException;

import java.util.Objects;

/**
 * Turns query text into tokens, one at a time, on demand.
 *
 * <p>Whitespace is not skipped: each maximal run of blanks becomes a single
 * {@link TokenType#WHITESPACE} token, and the grammar decides where it is allowed.
 * Once the input is exhausted every call to {@link #next()} returns an
 * {@link TokenType#EOF} token.
 *
 * <p>Not thread-safe; create one lexer per input.
 */
public final class Lexer {

    private final String input;
    private int cursor;

    public Lexer(String input) {
        this.input = Objects.requireNonNull(input, "input must not be null");
    }

    /**
     * Returns the source text being tokenized.
     *
     * @return the input
     */
    public String input() {
        return input;
    }

    /**
     * Produces the next token and advances past it.
     *
     * @return the next token
     * @throws LexException if no token rule matches at the current position
     */
    public Token next() {
        if (cursor >= input.length()) {
            return new Token(TokenType.EOF, "", input.length());
        }

        int start = cursor;
        char c = input.charAt(cursor);

        if (isBlank(c)) {
            while (cursor < input.length() && isBlank(input.charAt(cursor))) {
                cursor++;
            }
            return new Token(TokenType.WHITESPACE, input.substring(start, cursor), start);
        }

        if (isWordChar(c)) {
            return word(start);
        }

        if (c == '+' || c == '-') {
            return signedInteger(start);
        }

        if (c == '\'') {
            return string(start);
        }

        TokenType punctuation = switch (c) {
            case ',' -> TokenType.COMMA;
            case '(' -> TokenType.LEFT_PAREN;
            case ')' -> TokenType.RIGHT_PAREN;
            case ';' -> TokenType.SEMICOLON;
            case '.' -> TokenType.DOT;
            default -> null;
        };
        if (punctuation == null) {
            throw new LexException("Unexpected character '" + c + "'", start, input.substring(start));
        }
        cursor++;
        return new Token(punctuation, String.valueOf(c), start);
    }

    private Token word(int start) {
        boolean allDigits = true;
        while (cursor < input.length() && isWordChar(input.charAt(cursor))) {
            allDigits &= isDigit(input.charAt(cursor));
            cursor++;
        }
        String text = input.substring(start, cursor);
        if (allDigits) {
            return new Token(TokenType.INTEGER, text, start);
        }
        TokenType keyword = TokenType.keyword(text);
        return new Token(keyword != null ? keyword : TokenType.IDENTIFIER, text, start);
    }

    private Token signedInteger(int start) {
        int digits = start + 1;
        int end = digits;
        while (end < input.length() && isDigit(input.charAt(end))) {
            end++;
        }
        if (end == digits || (end < input.length() && isWordChar(input.charAt(end)))) {
            throw new LexException("Sign must be followed by digits", start, input.substring(start));
        }
        cursor = end;
        return new Token(TokenType.INTEGER, input.substring(start, end), start);
    }

    private Token string(int start) {
        int close = input.indexOf('\'', start + 1);
        if (close < 0) {
            throw new LexException("Unterminated string literal", start, input.substring(start));
        }
        cursor = close + 1;
        return new Token(TokenType.STRING, input.substring(start + 1, close), start);
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWordChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || isDigit(c) || c == '_';
    }
}
