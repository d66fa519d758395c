package com.tinysql.analyzer;

import com.tinysql.ast.AstNode;
import com.tinysql.ast.Identifier;
import com.tinysql.ast.Literal;
import com.tinysql.ast.Op;
import com.tinysql.exception.AnalysisException;
import com.tinysql.logical.Column;
import com.tinysql.logical.LogicalNode;
import com.tinysql.logical.LogicalPlan;
import com.tinysql.logical.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lowers an AST into a {@link LogicalPlan}.
 *
 * <p>Lowering rules:
 * <ul>
 *   <li>SELECT: a single Projection over the lowered source, with the column list
 *       flattened in source order</li>
 *   <li>FROM: one Read leaf per table in the table list, in source order. Several tables
 *       become several Read children of the Projection, not a join</li>
 * </ul>
 * Any other root shape is rejected with {@link AnalysisException}; the analyzer never
 * returns an empty or partial plan.
 *
 * <p>The input AST is not modified and the analyzer keeps no state between calls, so
 * analyzing the same AST twice yields equal plans.
 */
public class Analyzer {

    private static final Logger logger = LoggerFactory.getLogger(Analyzer.class);

    private final ColumnFlattener columnFlattener = new ColumnFlattener();
    private final TableFlattener tableFlattener = new TableFlattener();
    private final ValueFlattener valueFlattener = new ValueFlattener();

    /**
     * Lowers a SELECT statement into a logical plan.
     *
     * @param ast the statement AST
     * @return the logical plan
     * @throws AnalysisException if the AST is not a SELECT over a FROM clause of plain names
     */
    public LogicalPlan analyze(AstNode ast) {
        Objects.requireNonNull(ast, "ast must not be null");
        if (!ast.is(Op.SELECT)) {
            throw new AnalysisException("Only SELECT statements can be planned", ast);
        }

        List<LogicalNode> roots = lower(ast);
        LogicalPlan plan = new LogicalPlan(roots.get(0));

        if (logger.isDebugEnabled()) {
            logger.debug("Logical plan for {}:\n{}", ast, plan.treeString());
        }
        return plan;
    }

    /**
     * Binds an INSERT statement's table, columns and values.
     *
     * @param ast the statement AST
     * @return the bound statement
     * @throws AnalysisException if the AST is not an INSERT or its column and value counts differ
     */
    public InsertStatement analyzeInsert(AstNode ast) {
        Objects.requireNonNull(ast, "ast must not be null");
        if (!ast.is(Op.INSERT)) {
            throw new AnalysisException("Expected an INSERT statement", ast);
        }

        AstNode tableNode = ast.child(0);
        if (!(tableNode.terminal() instanceof Identifier table)) {
            throw new AnalysisException("Expected a table name", tableNode);
        }
        AstNode valuesNode = ast.child(2);
        if (!valuesNode.is(Op.VALUES)) {
            throw new AnalysisException("Expected a VALUES clause", valuesNode);
        }

        List<Column> columns = columnFlattener.flatten(ast.child(1));
        List<Literal> values = valueFlattener.flatten(valuesNode.child(0));
        if (columns.size() != values.size()) {
            throw new AnalysisException(
                "INSERT names " + columns.size() + " columns but supplies " + values.size() + " values", ast);
        }
        return new InsertStatement(table.name(), columns, values);
    }

    /**
     * Lowers a node into the plan nodes it stands for. A FROM clause with several tables
     * stands for several nodes.
     */
    private List<LogicalNode> lower(AstNode node) {
        if (node.isLeaf()) {
            throw new AnalysisException("Expected a SELECT or FROM clause", node);
        }
        return switch (node.op()) {
            case SELECT -> List.of(lowerSelect(node));
            case FROM -> lowerFrom(node);
            default -> throw new AnalysisException("Unsupported " + node.op() + " clause", node);
        };
    }

    private LogicalNode lowerSelect(AstNode select) {
        List<Column> columns = columnFlattener.flatten(select.child(0));
        AstNode source = select.lastChild();
        if (!source.is(Op.FROM)) {
            throw new AnalysisException("SELECT requires a FROM clause", source);
        }
        return LogicalNode.projection(columns, lower(source));
    }

    private List<LogicalNode> lowerFrom(AstNode from) {
        List<Table> tables = tableFlattener.flatten(from.child(0));
        List<LogicalNode> reads = new ArrayList<>(tables.size());
        for (Table table : tables) {
            reads.add(LogicalNode.read(table));
        }
        return reads;
    }
}
