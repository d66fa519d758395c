package com.tinysql.exception;

import java.util.List;

/**
 * Exception thrown when query text does not match the grammar.
 *
 * <p>The reported failure is the one that reached furthest into the input among all
 * alternatives tried, together with what the parser expected there and the input
 * it could not consume.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       AstNode ast = parser.parse("select a from");
 *   } catch (SqlParseException e) {
 *       System.err.println(e.getUserMessage());      // Expected identifier ...
 *       System.err.println(e.getRemainingInput());   // ""
 *   }
 * </pre>
 */
public class SqlParseException extends QueryProcessingException {

    private final int position;
    private final List<String> expected;
    private final String remainingInput;

    /**
     * Creates a parse exception.
     *
     * @param position the 0-based character offset of the failure
     * @param expected descriptions of the tokens that would have been accepted
     * @param remainingInput the unconsumed input starting at {@code position}
     * @param message the error message
     */
    public SqlParseException(int position, List<String> expected, String remainingInput, String message) {
        super(ErrorKind.PARSE, message);
        this.position = position;
        this.expected = List.copyOf(expected);
        this.remainingInput = remainingInput;
    }

    /**
     * Returns the character offset of the failure.
     *
     * @return the 0-based position
     */
    public int getPosition() {
        return position;
    }

    /**
     * Returns what the parser expected at the failure position.
     *
     * @return an unmodifiable list of token descriptions, possibly empty
     */
    public List<String> getExpected() {
        return expected;
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
        String near = remainingInput.isEmpty()
            ? "at end of input"
            : "near '" + ErrorSnippets.abbreviate(remainingInput) + "'";
        if (expected.isEmpty()) {
            return "Syntax error " + near + ".";
        }
        return "Syntax error " + near + ": expected " + String.join(" or ", expected) + ".";
    }
}
