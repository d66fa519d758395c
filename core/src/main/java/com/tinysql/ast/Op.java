package com.tinysql.ast;

/**
 * Operator tags of interior AST nodes.
 *
 * <p>Each tag fixes the number of children a node must have. Tags built by the grammar:
 * <pre>
 *   SELECT   (columnList, FROM)
 *   FROM     (tableList)
 *   COMMA    (left, right)
 *   INSERT   (table, columnList, VALUES)
 *   VALUES   (valueList)
 *   FUNCTION (name, argumentList)
 * </pre>
 *
 * <p>The remaining tags name clauses the query language reserves but does not parse yet
 * (WHERE, JOIN, GROUP BY, ORDER BY, HAVING, LIMIT, DISTINCT, table aliases). No grammar
 * rule produces them and their arity is not checked.
 */
public enum Op {
    SELECT(2),
    FROM(1),
    COMMA(2),
    INSERT(3),
    VALUES(1),
    FUNCTION(2),

    WHERE(-1),
    JOIN(-1),
    GROUP_BY(-1),
    ORDER_BY(-1),
    HAVING(-1),
    LIMIT(-1),
    DISTINCT(-1),
    ALIAS(-1);

    private final int arity;

    Op(int arity) {
        this.arity = arity;
    }

    /**
     * Returns the required number of children, or -1 when unchecked.
     *
     * @return the arity
     */
    public int arity() {
        return arity;
    }

    /**
     * Returns whether nodes with this tag have a fixed number of children.
     *
     * @return true if the arity is enforced
     */
    public boolean hasFixedArity() {
        return arity >= 0;
    }
}
