package com.tinysql.logical;

import java.util.List;
import java.util.Objects;

/**
 * Relational operator held by a {@link LogicalNode}.
 *
 * <p>Only {@link Projection} and {@link Read} are produced by the analyzer today.
 * {@link Filter}, {@link Join}, {@link Group}, {@link Sort}, {@link Limit} and
 * {@link Distinct} are reserved tags for WHERE, JOIN, GROUP BY, ORDER BY, LIMIT and
 * DISTINCT and carry no fields yet.
 */
public sealed interface Operator
    permits Operator.Projection, Operator.Filter, Operator.Read, Operator.Join,
            Operator.Group, Operator.Sort, Operator.Limit, Operator.Distinct {

    /**
     * Returns whether nodes with this operator must be leaves.
     *
     * @return true for scans
     */
    default boolean isLeafOperator() {
        return false;
    }

    /**
     * Outputs the given columns, in order, from the rows of its children.
     *
     * @param columns the projected columns
     */
    record Projection(List<Column> columns) implements Operator {

        public Projection {
            columns = List.copyOf(Objects.requireNonNull(columns, "columns must not be null"));
            if (columns.isEmpty()) {
                throw new IllegalArgumentException("columns must not be empty");
            }
        }

        @Override
        public String toString() {
            return "Projection " + columns;
        }
    }

    /**
     * Scans every row of a table.
     *
     * @param table the table to read
     */
    record Read(Table table) implements Operator {

        public Read {
            Objects.requireNonNull(table, "table must not be null");
        }

        @Override
        public boolean isLeafOperator() {
            return true;
        }

        @Override
        public String toString() {
            return "Read " + table;
        }
    }

    record Filter() implements Operator {
        @Override
        public String toString() {
            return "Filter";
        }
    }

    record Join() implements Operator {
        @Override
        public String toString() {
            return "Join";
        }
    }

    record Group() implements Operator {
        @Override
        public String toString() {
            return "Group";
        }
    }

    record Sort() implements Operator {
        @Override
        public String toString() {
            return "Sort";
        }
    }

    record Limit() implements Operator {
        @Override
        public String toString() {
            return "Limit";
        }
    }

    record Distinct() implements Operator {
        @Override
        public String toString() {
            return "Distinct";
        }
    }
}
