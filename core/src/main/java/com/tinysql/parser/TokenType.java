package com.tinysql.parser;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Classification of lexical units.
 */
public enum TokenType {
    // Statement keywords
    SELECT("select"),
    FROM("from"),
    INSERT("insert"),
    INTO("into"),
    VALUES("values"),

    // Punctuation
    COMMA(","),
    LEFT_PAREN("("),
    RIGHT_PAREN(")"),
    SEMICOLON(";"),
    DOT("."),

    // Values
    IDENTIFIER(null),
    INTEGER(null),
    STRING(null),

    WHITESPACE(null),
    EOF(null);

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (TokenType type : values()) {
            if (type.isKeyword()) {
                KEYWORDS.put(type.text, type);
                KEYWORDS.put(type.text.toUpperCase(Locale.ROOT), type);
            }
        }
    }

    private final String text;

    TokenType(String text) {
        this.text = text;
    }

    /**
     * Returns the fixed spelling of a keyword or punctuation token.
     *
     * @return the lower-case spelling, or null for value tokens
     */
    public String text() {
        return text;
    }

    public boolean isKeyword() {
        return text != null && Character.isLetter(text.charAt(0));
    }

    /**
     * Looks up a keyword by spelling. Only the all-lower-case and all-upper-case
     * spellings match; {@code Select} is not a keyword.
     *
     * @param word the word to look up
     * @return the keyword type, or null if the word is not a keyword
     */
    public static TokenType keyword(String word) {
        return KEYWORDS.get(word);
    }

    /**
     * Returns a description of this token type for error messages.
     *
     * @return the description
     */
    public String describe() {
        return switch (this) {
            case IDENTIFIER -> "identifier";
            case INTEGER -> "integer";
            case STRING -> "string";
            case WHITESPACE -> "whitespace";
            case EOF -> "end of input";
            default -> "'" + text + "'";
        };
    }
}
