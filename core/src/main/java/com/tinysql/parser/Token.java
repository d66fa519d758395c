package com.tinysql.parser;

import java.util.Objects;

/**
 * A classified lexical unit.
 *
 * <p>For {@link TokenType#STRING} tokens, {@code text} is the content between the quotes.
 * For all other types it is the source text as written.
 *
 * @param type the token type
 * @param text the token text
 * @param position 0-based character offset of the token in the source
 */
public record Token(TokenType type, String text, int position) {

    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    public boolean is(TokenType candidate) {
        return type == candidate;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
