package com.tinysql.exception;

import com.tinysql.QueryFrontend;
import com.tinysql.ast.AstNode;
import com.tinysql.ast.Identifier;
import com.tinysql.ast.Literal;
import com.tinysql.ast.Op;
import com.tinysql.parser.ParserConfig;

import org.junit.jupiter.api.*;
import static org.assertj.core.api.Assertions.*;

import java.util.List;

/**
 * Tests for error handling and user-friendly error messages.
 *
 * <p>These tests verify that:
 * <ul>
 *   <li>Each pipeline stage reports its own exception type and {@link ErrorKind}</li>
 *   <li>Exceptions carry the position, remainder or AST node that failed</li>
 *   <li>User messages are short and actionable</li>
 * </ul>
 */
@DisplayName("Error Handling Tests")
public class ErrorHandlingTest {

    private QueryFrontend frontend;

    @BeforeEach
    void setup() {
        frontend = new QueryFrontend(ParserConfig.defaults());
    }

    @Nested
    @DisplayName("Lex Exception Tests")
    class LexExceptionTests {

        @Test
        @DisplayName("Unknown character is reported with its position")
        void testUnknownCharacter() {
            LexException e = catchThrowableOfType(() -> frontend.plan("select a from t *"), LexException.class);

            assertThat(e.getKind()).isEqualTo(ErrorKind.LEX);
            assertThat(e.getPosition()).isEqualTo(16);
            assertThat(e).hasMessage("Unexpected character '*' at position 16");
            assertThat(e.getUserMessage()).startsWith("Unrecognized input near '*'.");
        }

        @Test
        @DisplayName("Long remainder is abbreviated in the user message")
        void testAbbreviatedRemainder() {
            LexException e = new LexException("Unexpected character '#'", 0, "#abcdefghijklmnopqrstuvwxyz");

            assertThat(e.getUserMessage()).contains("near '#abcdefghijklmnopqrs...'");
            assertThat(e.getRemainingInput()).isEqualTo("#abcdefghijklmnopqrstuvwxyz");
        }
    }

    @Nested
    @DisplayName("Parse Exception Tests")
    class ParseExceptionTests {

        @Test
        @DisplayName("Failure at end of input")
        void testEndOfInput() {
            SqlParseException e = catchThrowableOfType(() -> frontend.plan("select a from"), SqlParseException.class);

            assertThat(e.getKind()).isEqualTo(ErrorKind.PARSE);
            assertThat(e.getUserMessage()).isEqualTo("Syntax error at end of input: expected whitespace.");
        }

        @Test
        @DisplayName("Failure in the middle of the input names what was expected")
        void testMidInput() {
            SqlParseException e = catchThrowableOfType(() -> frontend.plan("select a from (t)"), SqlParseException.class);

            assertThat(e.getUserMessage()).isEqualTo("Syntax error near '(t)': expected identifier.");
            assertThat(e).hasMessage("Parse error at position 14: expected identifier, found '('");
        }

        @Test
        @DisplayName("Failure without expectations uses the short form")
        void testNoExpectations() {
            SqlParseException e = new SqlParseException(3, List.of(), "xyz", "list exceeds 1 items");

            assertThat(e.getUserMessage()).isEqualTo("Syntax error near 'xyz'.");
            assertThat(e.getExpected()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Analysis Exception Tests")
    class AnalysisExceptionTests {

        @Test
        @DisplayName("Message names the failed operator node")
        void testOperatorNode() {
            AnalysisException e = catchThrowableOfType(
                () -> frontend.plan("insert into t (a) values (1)"), AnalysisException.class);

            assertThat(e.getKind()).isEqualTo(ErrorKind.ANALYSIS);
            assertThat(e).hasMessage("Only SELECT statements can be planned (node: INSERT)");
            assertThat(e.getFailedNode().op()).isEqualTo(Op.INSERT);
            assertThat(e.getUserMessage()).isEqualTo(
                "Unsupported INSERT construct. Only SELECT ... FROM ... can be planned.");
        }

        @Test
        @DisplayName("Message names the failed leaf")
        void testLeafNode() {
            AnalysisException e = catchThrowableOfType(
                () -> frontend.plan("select 'lit' from t"), AnalysisException.class);

            assertThat(e.getFailedNode()).isEqualTo(AstNode.leaf(Literal.ofString("lit")));
            assertThat(e.getUserMessage()).startsWith("Unsupported item ''lit''.");
        }

        @Test
        @DisplayName("Exception without a node still has a user message")
        void testNullNode() {
            AnalysisException e = new AnalysisException("Nothing to plan", null);

            assertThat(e).hasMessage("Nothing to plan (node: null)");
            assertThat(e.getUserMessage()).isEqualTo("Query shape is not supported.");
        }
    }

    @Test
    @DisplayName("All stages share one base type")
    void testCommonBaseType() {
        List<QueryProcessingException> failures = List.of(
            new LexException("x", 0, "x"),
            new SqlParseException(0, List.of("identifier"), "", "y"),
            new AnalysisException("z", AstNode.leaf(new Identifier("a"))));

        assertThat(failures).extracting(QueryProcessingException::getKind)
            .containsExactly(ErrorKind.LEX, ErrorKind.PARSE, ErrorKind.ANALYSIS);
        assertThat(failures).allSatisfy(e -> assertThat(e).isInstanceOf(RuntimeException.class));
    }
}
