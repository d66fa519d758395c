package com.tinysql;

import com.tinysql.analyzer.Analyzer;
import com.tinysql.analyzer.InsertStatement;
import com.tinysql.ast.AstNode;
import com.tinysql.logical.LogicalPlan;
import com.tinysql.parser.ParserConfig;
import com.tinysql.parser.QueryParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns query text into logical plans in one call.
 *
 * <p>Usage:
 * <pre>
 *   QueryFrontend frontend = new QueryFrontend();
 *   LogicalPlan plan = frontend.plan("SELECT col1, col2 FROM table1");
 *   System.out.println(plan.treeString());
 *   // Projection [col1, col2]
 *   //   Read table1
 * </pre>
 *
 * <p>Every failure surfaces as a {@link com.tinysql.exception.QueryProcessingException}
 * subclass. Instances are thread-safe.
 */
public class QueryFrontend {

    private static final Logger logger = LoggerFactory.getLogger(QueryFrontend.class);

    private final QueryParser parser;
    private final Analyzer analyzer;

    public QueryFrontend() {
        this(new QueryParser(), new Analyzer());
    }

    public QueryFrontend(ParserConfig config) {
        this(new QueryParser(config), new Analyzer());
    }

    public QueryFrontend(QueryParser parser, Analyzer analyzer) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
    }

    /**
     * Parses and plans a single SELECT statement.
     *
     * @param sql the query text
     * @return the logical plan
     * @throws com.tinysql.exception.LexException if the text cannot be tokenized
     * @throws com.tinysql.exception.SqlParseException if the text does not match the grammar
     * @throws com.tinysql.exception.AnalysisException if the statement is not a plannable SELECT
     */
    public LogicalPlan plan(String sql) {
        return analyzer.analyze(parser.parse(sql));
    }

    /**
     * Parses and plans every statement of a {@code ;}-separated script.
     *
     * @param sql the script text
     * @return one plan per statement, in source order
     * @throws com.tinysql.exception.AnalysisException at the first statement that is not a SELECT
     */
    public List<LogicalPlan> planAll(String sql) {
        List<AstNode> statements = parser.parseAll(sql);
        List<LogicalPlan> plans = new ArrayList<>(statements.size());
        for (AstNode statement : statements) {
            plans.add(analyzer.analyze(statement));
        }
        logger.debug("Planned {} statement(s)", plans.size());
        return plans;
    }

    /**
     * Parses and binds a single INSERT statement.
     *
     * @param sql the statement text
     * @return the bound statement
     * @throws com.tinysql.exception.AnalysisException if the statement is not an INSERT or its
     *                                                 column and value counts differ
     */
    public InsertStatement insert(String sql) {
        InsertStatement statement = analyzer.analyzeInsert(parser.parse(sql));
        logger.debug("Bound {}", statement);
        return statement;
    }
}
