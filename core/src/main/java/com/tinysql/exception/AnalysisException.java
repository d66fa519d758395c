package com.tinysql.exception;

import com.tinysql.ast.AstNode;

/**
 * Exception thrown when an AST cannot be lowered into a logical plan.
 *
 * <p>Common causes:
 * <ul>
 *   <li>The root is not a SELECT statement</li>
 *   <li>A list contains something other than comma nodes and leaves</li>
 *   <li>A projected column is a literal or a function call</li>
 *   <li>An INSERT names a different number of columns than values</li>
 * </ul>
 */
public class AnalysisException extends QueryProcessingException {

    private final AstNode failedNode;

    /**
     * Creates an analysis exception.
     *
     * @param message the error message
     * @param node the AST node that could not be lowered
     */
    public AnalysisException(String message, AstNode node) {
        super(ErrorKind.ANALYSIS, message + " (node: " + describe(node) + ")");
        this.failedNode = node;
    }

    /**
     * Returns the AST node that could not be lowered.
     *
     * @return the failed node, or null if not available
     */
    public AstNode getFailedNode() {
        return failedNode;
    }

    @Override
    public String getUserMessage() {
        if (failedNode == null) {
            return "Query shape is not supported.";
        }
        if (failedNode.isLeaf()) {
            return "Unsupported item '" + failedNode.terminal() + "'. Only plain column and table names are supported here.";
        }
        return "Unsupported " + failedNode.op() + " construct. Only SELECT ... FROM ... can be planned.";
    }

    private static String describe(AstNode node) {
        if (node == null) {
            return "null";
        }
        return node.isLeaf() ? "leaf " + node.terminal() : node.op().name();
    }
}
