package com.tinysql.analyzer;

import com.tinysql.ast.Literal;
import com.tinysql.logical.Column;

import java.util.List;
import java.util.Objects;

/**
 * Bound form of {@code insert into t (c1, c2) values (v1, v2)}.
 *
 * @param tableName the target table
 * @param columns the target columns, in source order
 * @param values the values, one per column, in source order
 */
public record InsertStatement(String tableName, List<Column> columns, List<Literal> values) {

    public InsertStatement {
        Objects.requireNonNull(tableName, "tableName must not be null");
        columns = List.copyOf(Objects.requireNonNull(columns, "columns must not be null"));
        values = List.copyOf(Objects.requireNonNull(values, "values must not be null"));
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("columns must not be empty");
        }
        if (columns.size() != values.size()) {
            throw new IllegalArgumentException(
                "Column/value count mismatch: " + columns.size() + " vs " + values.size());
        }
    }
}
