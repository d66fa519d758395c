package com.tinysql.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable position in a lazily lexed token stream.
 *
 * <p>Cursors over the same input share one token buffer, which pulls tokens from the
 * {@link Lexer} only when a grammar rule looks at them. Advancing returns a new cursor,
 * so a rule that fails leaves its caller's cursor untouched and ordered choice can
 * retry from the same place.
 */
public final class TokenCursor {

    private final TokenBuffer buffer;
    private final int index;

    private TokenCursor(TokenBuffer buffer, int index) {
        this.buffer = buffer;
        this.index = index;
    }

    /**
     * Creates a cursor at the start of the given input.
     *
     * @param input the query text
     * @return the starting cursor
     */
    public static TokenCursor of(String input) {
        return new TokenCursor(new TokenBuffer(new Lexer(input)), 0);
    }

    /**
     * Returns the token under the cursor, lexing it if needed.
     *
     * @return the current token
     * @throws com.tinysql.exception.LexException if the input at this point cannot be tokenized
     */
    public Token peek() {
        return buffer.get(index);
    }

    /**
     * Returns a cursor one token further along. Advancing past EOF stays at EOF.
     *
     * @return the advanced cursor
     */
    public TokenCursor advance() {
        if (peek().is(TokenType.EOF)) {
            return this;
        }
        return new TokenCursor(buffer, index + 1);
    }

    /**
     * Returns the index of the current token in the stream.
     *
     * @return the 0-based token index
     */
    public int index() {
        return index;
    }

    /**
     * Returns the character offset of the current token.
     *
     * @return the 0-based character position
     */
    public int position() {
        return peek().position();
    }

    /**
     * Returns the source text from the current token to the end of input.
     *
     * @return the unconsumed input
     */
    public String remainingInput() {
        return buffer.source().substring(position());
    }

    public boolean atEnd() {
        return peek().is(TokenType.EOF);
    }

    @Override
    public String toString() {
        return "TokenCursor(" + index + ", " + peek() + ")";
    }

    /** Tokens lexed so far for one input. */
    private static final class TokenBuffer {

        private final Lexer lexer;
        private final List<Token> tokens = new ArrayList<>();

        TokenBuffer(Lexer lexer) {
            this.lexer = lexer;
        }

        String source() {
            return lexer.input();
        }

        Token get(int index) {
            while (tokens.size() <= index) {
                if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
                    return tokens.get(tokens.size() - 1);
                }
                tokens.add(lexer.next());
            }
            return tokens.get(index);
        }
    }
}
