package com.tinysql.exception;

/**
 * Exception thrown when no token rule matches at the lexer's current position.
 *
 * <p>Common causes:
 * <ul>
 *   <li>Characters outside the query language (for example {@code *} or {@code =})</li>
 *   <li>A string literal missing its closing quote</li>
 *   <li>A sign ({@code +} or {@code -}) not followed by digits</li>
 * </ul>
 */
public class LexException extends QueryProcessingException {

    private final int position;
    private final String remainingInput;

    /**
     * Creates a lex exception.
     *
     * @param message the error message
     * @param position the 0-based character offset where lexing failed
     * @param remainingInput the unconsumed input starting at {@code position}
     */
    public LexException(String message, int position, String remainingInput) {
        super(ErrorKind.LEX, message + " at position " + position);
        this.position = position;
        this.remainingInput = remainingInput;
    }

    /**
     * Returns the character offset where lexing failed.
     *
     * @return the 0-based position
     */
    public int getPosition() {
        return position;
    }

    /**
     * Returns the input that was not consumed.
     *
     * @return the remaining input, never null
     */
    public String getRemainingInput() {
        return remainingInput;
    }

    @Override
    public String getUserMessage() {
        return "Unrecognized input near '" + ErrorSnippets.abbreviate(remainingInput) + "'. " +
               "Only identifiers, integers, quoted strings and , ( ) ; . are allowed.";
    }
}
