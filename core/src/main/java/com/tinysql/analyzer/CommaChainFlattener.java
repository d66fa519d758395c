package com.tinysql.analyzer;

import com.tinysql.ast.AstNode;
import com.tinysql.ast.Op;
import com.tinysql.exception.AnalysisException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Turns a comma-chain back into the flat list it encodes.
 *
 * <p>The parser encodes {@code a, b, c} as nested binary {@link Op#COMMA} nodes. This
 * class visits the leaves left before right, whatever the nesting direction, and
 * converts each one with {@link #convertLeaf(AstNode)}. For a chain with N leaves the
 * result has N elements in source order.
 *
 * <p>The traversal uses an explicit stack, so deeply nested chains do not grow the call
 * stack. Implementations are stateless and can be shared.
 *
 * @param <T> the element type of the flattened list
 */
public abstract class CommaChainFlattener<T> {

    /**
     * Flattens a chain (or a single leaf) into a list.
     *
     * @param chain the comma-chain root
     * @return an unmodifiable list of converted leaves, in source order
     * @throws AnalysisException if the chain contains a node that is neither a comma nor a leaf,
     *                           or a leaf {@link #convertLeaf(AstNode)} rejects
     */
    public List<T> flatten(AstNode chain) {
        Objects.requireNonNull(chain, "chain must not be null");

        List<T> items = new ArrayList<>();
        Deque<AstNode> pending = new ArrayDeque<>();
        pending.push(chain);
        while (!pending.isEmpty()) {
            AstNode node = pending.pop();
            if (node.isLeaf()) {
                items.add(convertLeaf(node));
            } else if (node.is(Op.COMMA)) {
                pending.push(node.child(1));
                pending.push(node.child(0));
            } else {
                throw new AnalysisException("Unexpected " + node.op() + " in " + listName(), node);
            }
        }
        return Collections.unmodifiableList(items);
    }

    /**
     * Converts one leaf of the chain.
     *
     * @param leaf a leaf node
     * @return the converted element
     * @throws AnalysisException if the leaf's terminal is not allowed in this list
     */
    protected abstract T convertLeaf(AstNode leaf);

    /**
     * Names the kind of list, for error messages.
     */
    protected abstract String listName();
}
