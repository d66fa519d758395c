package com.tinysql.exception;

/**
 * Stage of the query pipeline that produced a {@link QueryProcessingException}.
 */
public enum ErrorKind {
    /** No token rule matched at the current input position. */
    LEX,
    /** No grammar alternative matched at the current rule. */
    PARSE,
    /** The AST has a shape the lowering rules do not recognize. */
    ANALYSIS
}
