package com.tinysql.logical;

import java.util.List;
import java.util.Objects;

/**
 * Node in a logical query plan: one {@link Operator} plus the nodes it consumes.
 *
 * <p>Nodes are immutable and compare structurally. Nodes whose operator is a scan
 * ({@link Operator.Read}) must not have children.
 */
public final class LogicalNode {

    private final Operator operator;
    private final List<LogicalNode> children;

    /**
     * Creates a plan node.
     *
     * @param operator the relational operator
     * @param children the input nodes, in order
     * @throws IllegalArgumentException if a scan is given children
     */
    public LogicalNode(Operator operator, List<LogicalNode> children) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.children = List.copyOf(Objects.requireNonNull(children, "children must not be null"));
        if (operator.isLeafOperator() && !this.children.isEmpty()) {
            throw new IllegalArgumentException(operator + " must not have children");
        }
    }

    /**
     * Creates a leaf node.
     *
     * @param operator the relational operator
     */
    public LogicalNode(Operator operator) {
        this(operator, List.of());
    }

    public static LogicalNode read(Table table) {
        return new LogicalNode(new Operator.Read(table));
    }

    public static LogicalNode projection(List<Column> columns, List<LogicalNode> children) {
        return new LogicalNode(new Operator.Projection(columns), children);
    }

    public Operator operator() {
        return operator;
    }

    /**
     * Returns the child nodes.
     *
     * @return an unmodifiable list of children
     */
    public List<LogicalNode> children() {
        return children;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof LogicalNode other)) {
            return false;
        }
        return operator.equals(other.operator) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, children);
    }

    @Override
    public String toString() {
        return isLeaf() ? operator.toString() : operator + " " + children;
    }
}
