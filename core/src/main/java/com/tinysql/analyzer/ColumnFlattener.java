package com.tinysql.analyzer;

import com.tinysql.ast.AstNode;
import com.tinysql.ast.Identifier;
import com.tinysql.exception.AnalysisException;
import com.tinysql.logical.Column;

/**
 * Flattens a column list into {@link Column}s. Qualifiers ({@code t.col}) are dropped.
 */
public final class ColumnFlattener extends CommaChainFlattener<Column> {

    @Override
    protected Column convertLeaf(AstNode leaf) {
        if (leaf.terminal() instanceof Identifier identifier) {
            return new Column(identifier.name());
        }
        throw new AnalysisException("Expected a column name but found " + leaf.terminal(), leaf);
    }

    @Override
    protected String listName() {
        return "column list";
    }
}
