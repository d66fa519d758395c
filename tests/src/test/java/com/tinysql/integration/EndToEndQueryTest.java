package com.tinysql.integration;

import com.tinysql.QueryFrontend;
import com.tinysql.analyzer.InsertStatement;
import com.tinysql.ast.Literal;
import com.tinysql.exception.AnalysisException;
import com.tinysql.exception.LexException;
import com.tinysql.exception.QueryProcessingException;
import com.tinysql.exception.SqlParseException;
import com.tinysql.logical.Column;
import com.tinysql.logical.LogicalNode;
import com.tinysql.logical.LogicalPlan;
import com.tinysql.logical.Operator;
import com.tinysql.logical.Table;
import com.tinysql.parser.ParserConfig;
import com.tinysql.test.TestBase;
import com.tinysql.test.TestCategories;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import static org.assertj.core.api.Assertions.*;

import java.util.List;

/**
 * End-to-end tests running query text through {@link QueryFrontend}: lexing, parsing
 * and analysis together.
 */
@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("End-to-End Query Tests")
public class EndToEndQueryTest extends TestBase {

    private QueryFrontend frontend;

    @Override
    protected void doSetUp() {
        frontend = new QueryFrontend(ParserConfig.defaults());
    }

    @Nested
    @DisplayName("Planning SELECT")
    class PlanTests {

        @Test
        @DisplayName("SELECT col1 FROM table1")
        void testSingleColumnSingleTable() {
            logStep("When: Planning a single-column query");
            LogicalPlan plan = frontend.plan("SELECT col1 FROM table1");
            logData("Plan", "\n" + plan.treeString());

            logStep("Then: One projection over one read");
            assertThat(plan.treeString()).isEqualTo("Projection [col1]\n  Read table1");
        }

        @Test
        @DisplayName("SELECT col1, col2, col3 FROM table1")
        void testThreeColumns() {
            LogicalPlan plan = frontend.plan("SELECT col1, col2, col3 FROM table1");

            assertThat(plan.root().operator()).isEqualTo(new Operator.Projection(List.of(
                new Column("col1"), new Column("col2"), new Column("col3"))));
            assertThat(plan.root().children()).hasSize(1);
        }

        @Test
        @DisplayName("SELECT col1 FROM table1, table2")
        void testTwoTables() {
            LogicalPlan plan = frontend.plan("SELECT col1 FROM table1, table2");

            assertThat(plan.root().children()).containsExactly(
                LogicalNode.read(new Table("table1")),
                LogicalNode.read(new Table("table2")));
        }

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
            "select a from t;           | Projection [a]\\n  Read t",
            "SELECT a, b FROM t         | Projection [a, b]\\n  Read t",
            "select x.a from x, y, z;   | Projection [a]\\n  Read x\\n  Read y\\n  Read z"
        })
        @DisplayName("Plan trees for common query shapes")
        void testPlanShapes(String sql, String expectedTree) {
            assertThat(frontend.plan(sql.trim()).treeString()).isEqualTo(expectedTree.replace("\\n", "\n"));
        }

        @Test
        @DisplayName("Planning the same text twice yields equal plans")
        void testRepeatable() {
            String sql = "select a, b from t1, t2";

            assertThat(frontend.plan(sql)).isEqualTo(frontend.plan(sql));
        }

        @Test
        @DisplayName("planAll plans every statement of a script")
        void testPlanAll() {
            List<LogicalPlan> plans = frontend.planAll("select a from t; SELECT b, c FROM u, v;");

            assertThat(plans).hasSize(2);
            assertThat(plans.get(1).treeString()).isEqualTo("Projection [b, c]\n  Read u\n  Read v");
        }

        @Test
        @DisplayName("planAll stops at the first INSERT")
        void testPlanAllRejectsInsert() {
            assertThatThrownBy(() -> frontend.planAll("select a from t; insert into t (a) values (1)"))
                .isInstanceOf(AnalysisException.class);
        }
    }

    @Nested
    @DisplayName("Binding INSERT")
    class InsertTests {

        @Test
        @DisplayName("insert into table1 (col1, col2) values (1, valStr);")
        void testInsert() {
            InsertStatement statement = frontend.insert("insert into table1 (col1, col2) values (1, valStr);");

            assertThat(statement).isEqualTo(new InsertStatement("table1",
                List.of(new Column("col1"), new Column("col2")),
                List.of(Literal.ofInt(1), Literal.ofString("valStr"))));
        }

        @Test
        @DisplayName("SELECT text is not accepted as INSERT")
        void testSelectAsInsert() {
            assertThatThrownBy(() -> frontend.insert("select a from t"))
                .isInstanceOf(AnalysisException.class);
        }
    }

    @Nested
    @DisplayName("Malformed Input")
    class MalformedInputTests {

        @ParameterizedTest
        @ValueSource(strings = {
            "select",
            "select a",
            "select a from",
            "select a from t extra",
            "select a,, b from t",
            "insert into t",
            "insert into t (a) values",
            "insert into t (a) values (1",
            "select a from t;;",
            "from t select a",
            "select f( from t",
            "select t. from t"
        })
        @DisplayName("Grammar mismatches raise SqlParseException with the remainder")
        void testParseErrors(String sql) {
            SqlParseException e = catchThrowableOfType(() -> frontend.plan(sql), SqlParseException.class);

            assertThat(e).isNotNull();
            assertThat(sql).endsWith(e.getRemainingInput());
            assertThat(e.getPosition()).isEqualTo(sql.length() - e.getRemainingInput().length());
        }

        @ParameterizedTest
        @ValueSource(strings = {"select * from t", "select a from t = 1", "select 'a from t", "select a from t -"})
        @DisplayName("Unlexable input raises LexException with the remainder")
        void testLexErrors(String sql) {
            LexException e = catchThrowableOfType(() -> frontend.plan(sql), LexException.class);

            assertThat(e).isNotNull();
            assertThat(sql).endsWith(e.getRemainingInput());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "select 1 from t", "select a(b) from t", "insert into t (a) values (1)",
            "select a from t,", "select ( from t", "select a from t ; select"})
        @DisplayName("Every failure is a QueryProcessingException")
        void testFailureTaxonomy(String sql) {
            assertThatThrownBy(() -> frontend.plan(sql))
                .isInstanceOf(QueryProcessingException.class);
        }
    }
}
