package com.tinysql.analyzer;

import com.tinysql.ast.AstNode;
import com.tinysql.ast.Identifier;
import com.tinysql.exception.AnalysisException;
import com.tinysql.logical.Table;

/**
 * Flattens a table list into {@link Table}s.
 */
public final class TableFlattener extends CommaChainFlattener<Table> {

    @Override
    protected Table convertLeaf(AstNode leaf) {
        if (leaf.terminal() instanceof Identifier identifier) {
            return new Table(identifier.name());
        }
        throw new AnalysisException("Expected a table name but found " + leaf.terminal(), leaf);
    }

    @Override
    protected String listName() {
        return "table list";
    }
}
