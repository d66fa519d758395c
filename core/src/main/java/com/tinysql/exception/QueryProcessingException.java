package com.tinysql.exception;

/**
 * Base class for all failures raised while turning query text into a logical plan.
 *
 * <p>Every failure is tagged with the {@link ErrorKind} of the stage that produced it,
 * so callers can decide whether to report, retry with different input, or give up
 * without inspecting the concrete exception class.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       LogicalPlan plan = frontend.plan(sql);
 *   } catch (QueryProcessingException e) {
 *       System.err.println(e.getKind() + ": " + e.getUserMessage());
 *   }
 * </pre>
 */
public abstract class QueryProcessingException extends RuntimeException {

    private final ErrorKind kind;

    protected QueryProcessingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Returns the pipeline stage that failed.
     *
     * @return the error kind
     */
    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Returns a short, user-facing description of the failure.
     *
     * @return user-friendly error message
     */
    public abstract String getUserMessage();
}
