package com.tinysql.logical;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * A complete logical query plan, rooted at a single {@link LogicalNode}.
 *
 * <p>The plan describes what to compute, not how. For
 * {@code SELECT col1 FROM table1, table2} it is:
 * <pre>
 *   Projection [col1]
 *     Read table1
 *     Read table2
 * </pre>
 *
 * @see com.tinysql.analyzer.Analyzer
 */
public final class LogicalPlan {

    private final LogicalNode root;

    public LogicalPlan(LogicalNode root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
    }

    public LogicalNode root() {
        return root;
    }

    /**
     * Renders the plan as an indented tree, one node per line, children indented by
     * two spaces under their parent.
     *
     * @return the tree rendering, without a trailing newline
     */
    public String treeString() {
        StringBuilder sb = new StringBuilder();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, 0));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append("  ".repeat(frame.depth)).append(frame.node.operator());
            for (int i = frame.node.children().size() - 1; i >= 0; i--) {
                stack.push(new Frame(frame.node.children().get(i), frame.depth + 1));
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof LogicalPlan other && root.equals(other.root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return "LogicalPlan(" + root + ")";
    }

    private record Frame(LogicalNode node, int depth) {}
}
