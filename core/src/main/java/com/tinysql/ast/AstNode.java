package com.tinysql.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Node of the abstract syntax tree produced by the parser.
 *
 * <p>A node is either an operator node (an {@link Op} tag plus ordered children) or a
 * leaf holding a {@link Terminal}; never both and never neither. Operator nodes with a
 * fixed-arity tag must have exactly {@link Op#arity()} children.
 *
 * <p>Lists are not flat: {@code a, b, c} is encoded as the comma-chain
 * {@code COMMA(COMMA(a, b), c)}, and a one-element list is the bare leaf.
 *
 * <p>Nodes are immutable and compare structurally. The hash is computed once at
 * construction from the children's hashes, and {@link #equals(Object)} and
 * {@link #toString()} walk the tree with an explicit stack, so long comma-chains do not
 * grow the call stack.
 */
public final class AstNode {

    private final Op op;
    private final List<AstNode> children;
    private final Terminal terminal;
    private final int hash;

    private AstNode(Op op, List<AstNode> children, Terminal terminal) {
        this.op = op;
        this.children = children;
        this.terminal = terminal;
        this.hash = computeHash(op, children, terminal);
    }

    private static int computeHash(Op op, List<AstNode> children, Terminal terminal) {
        int result = Objects.hash(op, terminal);
        for (AstNode child : children) {
            result = 31 * result + child.hash;
        }
        return result;
    }

    /**
     * Creates a leaf node.
     *
     * @param terminal the terminal value
     * @return the leaf
     */
    public static AstNode leaf(Terminal terminal) {
        return new AstNode(null, Collections.emptyList(),
            Objects.requireNonNull(terminal, "terminal must not be null"));
    }

    /**
     * Creates an operator node.
     *
     * @param op the operator tag
     * @param children the ordered children
     * @return the node
     * @throws IllegalArgumentException if the child count does not match the tag's arity
     */
    public static AstNode of(Op op, List<AstNode> children) {
        Objects.requireNonNull(op, "op must not be null");
        Objects.requireNonNull(children, "children must not be null");
        if (op.hasFixedArity() && children.size() != op.arity()) {
            throw new IllegalArgumentException(
                op + " requires " + op.arity() + " children, got " + children.size());
        }
        for (AstNode child : children) {
            Objects.requireNonNull(child, "children must not contain null");
        }
        return new AstNode(op, Collections.unmodifiableList(new ArrayList<>(children)), null);
    }

    public static AstNode of(Op op, AstNode... children) {
        return of(op, List.of(children));
    }

    /**
     * Creates a comma node joining two list items.
     *
     * @param left the left item or chain
     * @param right the right item or chain
     * @return the comma node
     */
    public static AstNode comma(AstNode left, AstNode right) {
        return of(Op.COMMA, left, right);
    }

    public boolean isLeaf() {
        return terminal != null;
    }

    /**
     * Returns the operator tag.
     *
     * @return the tag, or null for leaves
     */
    public Op op() {
        return op;
    }

    /**
     * Returns whether this is an operator node with the given tag.
     *
     * @param candidate the tag to test
     * @return true if {@code op() == candidate}
     */
    public boolean is(Op candidate) {
        return op == candidate;
    }

    /**
     * Returns the children of an operator node.
     *
     * @return an unmodifiable list, empty for leaves
     */
    public List<AstNode> children() {
        return children;
    }

    public AstNode child(int index) {
        return children.get(index);
    }

    public AstNode lastChild() {
        return children.get(children.size() - 1);
    }

    /**
     * Returns the terminal of a leaf.
     *
     * @return the terminal, or null for operator nodes
     */
    public Terminal terminal() {
        return terminal;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof AstNode other)) {
            return false;
        }
        Deque<AstNode[]> pending = new ArrayDeque<>();
        pending.push(new AstNode[] {this, other});
        while (!pending.isEmpty()) {
            AstNode[] pair = pending.pop();
            AstNode left = pair[0];
            AstNode right = pair[1];
            if (left == right) {
                continue;
            }
            if (left.hash != right.hash
                || left.op != right.op
                || !Objects.equals(left.terminal, right.terminal)
                || left.children.size() != right.children.size()) {
                return false;
            }
            for (int i = 0; i < left.children.size(); i++) {
                pending.push(new AstNode[] {left.children.get(i), right.children.get(i)});
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /**
     * Renders the node as a nested term, for example
     * {@code SELECT(COMMA(a, b), FROM(t))}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        // Holds nodes still to render and the punctuation between them.
        Deque<Object> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Object next = pending.pop();
            if (next instanceof String text) {
                sb.append(text);
            } else {
                AstNode node = (AstNode) next;
                if (node.isLeaf()) {
                    sb.append(node.terminal);
                    continue;
                }
                sb.append(node.op.name()).append('(');
                pending.push(")");
                for (int i = node.children.size() - 1; i >= 0; i--) {
                    pending.push(node.children.get(i));
                    if (i > 0) {
                        pending.push(", ");
                    }
                }
            }
        }
        return sb.toString();
    }
}
