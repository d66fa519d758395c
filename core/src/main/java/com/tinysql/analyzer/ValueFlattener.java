package com.tinysql.analyzer;

import com.tinysql.ast.AstNode;
import com.tinysql.ast.Literal;
import com.tinysql.exception.AnalysisException;

/**
 * Flattens an INSERT value list into {@link Literal}s.
 */
public final class ValueFlattener extends CommaChainFlattener<Literal> {

    @Override
    protected Literal convertLeaf(AstNode leaf) {
        if (leaf.terminal() instanceof Literal literal) {
            return literal;
        }
        throw new AnalysisException("Expected a value but found " + leaf.terminal(), leaf);
    }

    @Override
    protected String listName() {
        return "value list";
    }
}
