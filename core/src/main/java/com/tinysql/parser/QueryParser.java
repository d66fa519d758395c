package com.tinysql.parser;

import com.tinysql.ast.AstNode;
import com.tinysql.ast.Identifier;
import com.tinysql.ast.Literal;
import com.tinysql.ast.Op;
import com.tinysql.exception.SqlParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.tinysql.parser.Parsers.chainLeft;
import static com.tinysql.parser.Parsers.choice;
import static com.tinysql.parser.Parsers.optional;
import static com.tinysql.parser.Parsers.token;

/**
 * Entry point for parsing query text into an {@link AstNode} tree.
 *
 * <p>Grammar (ordered choice, first matching alternative wins):
 * <pre>
 *   Script     := Statement (WS? ";" WS? Statement)* (WS? ";")? WS? EOF
 *   Statement  := Select | Insert
 *   Select     := "select" WS ColumnList WS "from" WS TableList
 *   Insert     := "insert" WS "into" WS Ident WS "(" IdentList ")" WS "values" WS "(" ValueList ")"
 *   ColumnList := ColumnItem ("," WS ColumnItem)*
 *   ColumnItem := FunctionCall | ColumnRef | Literal
 *   FunctionCall := Ident "(" ColumnList ")"
 *   ColumnRef  := Ident ("." Ident)?
 *   Literal    := Integer | String
 *   TableList  := Ident ("," WS Ident)*
 *   IdentList  := Ident ("," WS Ident)*
 *   ValueList  := Value ("," WS Value)*
 *   Value      := Integer | BareWord | String
 * </pre>
 *
 * <p>Lists become left-nested {@link Op#COMMA} chains. A statement keyword, a list
 * separator and a function call's opening parenthesis are commit points: once matched,
 * a later mismatch is reported as is instead of trying another alternative. In
 * particular a query starting with {@code select} is never retried as an INSERT.
 *
 * <p>Function calls may nest up to {@link ParserConfig#maxNestingDepth()} levels; deeper
 * nesting is a syntax error rather than unbounded recursion.
 *
 * <p>A bare word in an INSERT value list is read as a string, so {@code valStr} and
 * {@code 'valStr'} produce the same literal.
 *
 * <p>Instances are immutable and thread-safe.
 *
 * <p>Usage:
 * <pre>
 *   QueryParser parser = new QueryParser();
 *   AstNode ast = parser.parse("select col1, col2 from table1;");
 * </pre>
 */
public class QueryParser {

    private static final Logger logger = LoggerFactory.getLogger(QueryParser.class);

    private final ParserConfig config;

    private final Parser<Token> whitespace = token(TokenType.WHITESPACE);
    private final Parser<Token> listSeparator = token(TokenType.COMMA).commitTo(comma -> whitespace);

    private final Parser<AstNode> identifier =
        token(TokenType.IDENTIFIER).map(name -> AstNode.leaf(new Identifier(name.text())));

    private final Parser<AstNode> integerLiteral = QueryParser::integerLiteral;

    private final Parser<AstNode> stringLiteral =
        token(TokenType.STRING).map(text -> AstNode.leaf(Literal.ofString(text.text())));

    private final Parser<AstNode> bareWord =
        token(TokenType.IDENTIFIER).map(word -> AstNode.leaf(Literal.ofString(word.text())));

    private final Parser<AstNode> literal = choice(integerLiteral, stringLiteral);

    private final int maxListItems;
    private final int maxNestingDepth;
    private final Parser<AstNode> statement;
    private final Parser<List<AstNode>> singleStatement;
    private final Parser<List<AstNode>> script;

    /**
     * Creates a parser configured from system properties.
     */
    public QueryParser() {
        this(ParserConfig.fromSystemProperties());
    }

    /**
     * Creates a parser with explicit limits.
     *
     * @param config the parser limits
     */
    public QueryParser(ParserConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.maxListItems = config.maxListItems();
        this.maxNestingDepth = config.maxNestingDepth();

        Parser<AstNode> columnList = columnList(0);
        Parser<AstNode> tableList = chainLeft(identifier, listSeparator, AstNode::comma, maxListItems);
        Parser<AstNode> identifierList = chainLeft(identifier, listSeparator, AstNode::comma, maxListItems);
        Parser<AstNode> valueList =
            chainLeft(choice(integerLiteral, bareWord, stringLiteral), listSeparator, AstNode::comma, maxListItems);

        Parser<AstNode> select = token(TokenType.SELECT).commitTo(keyword ->
            whitespace.then(columnList).bind(columns ->
                whitespace.then(token(TokenType.FROM)).then(whitespace).then(tableList)
                    .map(tables -> AstNode.of(Op.SELECT, columns, AstNode.of(Op.FROM, tables)))));

        Parser<AstNode> insert = token(TokenType.INSERT).commitTo(keyword ->
            whitespace.then(token(TokenType.INTO)).then(whitespace).then(identifier).bind(table ->
                whitespace.then(token(TokenType.LEFT_PAREN)).then(identifierList).skip(token(TokenType.RIGHT_PAREN))
                    .bind(columns ->
                        whitespace.then(token(TokenType.VALUES)).then(whitespace)
                            .then(token(TokenType.LEFT_PAREN)).then(valueList).skip(token(TokenType.RIGHT_PAREN))
                            .map(values -> AstNode.of(Op.INSERT, table, columns, AstNode.of(Op.VALUES, values))))));

        this.statement = choice(select, insert);
        this.singleStatement = input -> statements(input, true);
        this.script = input -> statements(input, false);
    }

    /**
     * Parses exactly one statement. The trailing {@code ;} is optional.
     *
     * @param sql the query text
     * @return the statement's AST
     * @throws SqlParseException if the text does not match the grammar
     * @throws com.tinysql.exception.LexException if the text contains characters no token rule accepts
     */
    public AstNode parse(String sql) {
        return run(sql, singleStatement).get(0);
    }

    /**
     * Parses a script of {@code ;}-separated statements.
     *
     * @param sql the script text
     * @return one AST per statement, in source order
     * @throws SqlParseException if the text does not match the grammar
     * @throws com.tinysql.exception.LexException if the text contains characters no token rule accepts
     */
    public List<AstNode> parseAll(String sql) {
        return run(sql, script);
    }

    /**
     * Parses exactly one statement, returning grammar mismatches as a failure value
     * instead of throwing.
     *
     * @param sql the query text
     * @return the parse result
     * @throws SqlParseException if the text is empty or longer than the configured limit
     * @throws com.tinysql.exception.LexException if the text contains characters no token rule accepts
     */
    public ParseResult<AstNode> tryParse(String sql) {
        checkInput(sql);
        return singleStatement.parse(TokenCursor.of(sql)).map(statements -> statements.get(0));
    }

    /**
     * Tests whether the given text is a single valid statement.
     *
     * @param sql the query text
     * @return true if {@link #parse(String)} would succeed
     */
    public boolean canParse(String sql) {
        try {
            parse(sql);
            return true;
        } catch (RuntimeException e) {
            logger.debug("Query does not parse: {}", e.getMessage());
            return false;
        }
    }

    public ParserConfig config() {
        return config;
    }

    private List<AstNode> run(String sql, Parser<List<AstNode>> rule) {
        checkInput(sql);
        logger.debug("Parsing query: {}", sql);

        ParseResult<List<AstNode>> result = rule.parse(TokenCursor.of(sql));
        if (result instanceof ParseResult.Failure<List<AstNode>> failure) {
            throw toException(failure);
        }
        List<AstNode> statements = ((ParseResult.Success<List<AstNode>>) result).value();
        logger.debug("Parsed {} statement(s): {}", statements.size(), statements);
        return statements;
    }

    private void checkInput(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new SqlParseException(0, List.of(), "", "Query must not be null or empty");
        }
        if (sql.length() > config.maxQueryLength()) {
            throw new SqlParseException(config.maxQueryLength(), List.of(),
                sql.substring(config.maxQueryLength()),
                "Query length " + sql.length() + " exceeds limit of " + config.maxQueryLength() + " characters");
        }
    }

    private ParseResult<List<AstNode>> statements(TokenCursor input, boolean single) {
        List<AstNode> parsed = new ArrayList<>();
        TokenCursor cursor = input;
        while (true) {
            ParseResult<AstNode> next = statement.parse(cursor);
            if (next instanceof ParseResult.Failure<AstNode> failure) {
                return failure.cast();
            }
            ParseResult.Success<AstNode> success = (ParseResult.Success<AstNode>) next;
            parsed.add(success.value());

            cursor = skipWhitespace(success.rest());
            boolean terminated = cursor.peek().is(TokenType.SEMICOLON);
            if (terminated) {
                cursor = skipWhitespace(cursor.advance());
            }
            if (cursor.atEnd()) {
                return ParseResult.success(parsed, cursor);
            }
            if (single || !terminated) {
                List<String> expected = terminated
                    ? List.of(TokenType.EOF.describe())
                    : List.of(TokenType.SEMICOLON.describe(), TokenType.EOF.describe());
                return new ParseResult.Failure<>(cursor, expected, null, false);
            }
        }
    }

    private TokenCursor skipWhitespace(TokenCursor cursor) {
        return cursor.peek().is(TokenType.WHITESPACE) ? cursor.advance() : cursor;
    }

    /**
     * Builds the column list rule for the given function nesting depth. The rule for the
     * next depth is built only once a function call's {@code (} has matched.
     */
    private Parser<AstNode> columnList(int depth) {
        Parser<AstNode> functionCall = token(TokenType.IDENTIFIER).bind(name ->
            token(TokenType.LEFT_PAREN).commitTo(paren -> functionArguments(name, depth + 1)));
        Parser<AstNode> columnItem = choice(functionCall, columnRef(), literal);
        return chainLeft(columnItem, listSeparator, AstNode::comma, maxListItems);
    }

    private Parser<AstNode> functionArguments(Token name, int depth) {
        if (depth > maxNestingDepth) {
            return input -> new ParseResult.Failure<>(input, List.of(),
                "function nesting exceeds " + maxNestingDepth + " levels", true);
        }
        return columnList(depth).skip(token(TokenType.RIGHT_PAREN))
            .map(args -> AstNode.of(Op.FUNCTION, AstNode.leaf(new Identifier(name.text())), args));
    }

    private Parser<AstNode> columnRef() {
        return token(TokenType.IDENTIFIER).bind(first ->
            optional(token(TokenType.DOT).commitTo(dot -> token(TokenType.IDENTIFIER))).map(second ->
                AstNode.leaf(second.isPresent()
                    ? new Identifier(second.get().text(), first.text())
                    : new Identifier(first.text()))));
    }

    private static ParseResult<AstNode> integerLiteral(TokenCursor input) {
        Token token = input.peek();
        if (!token.is(TokenType.INTEGER)) {
            return ParseResult.failure(input, TokenType.INTEGER.describe());
        }
        try {
            return ParseResult.success(AstNode.leaf(Literal.ofInt(Integer.parseInt(token.text()))), input.advance());
        } catch (NumberFormatException e) {
            return ParseResult.error(input, "integer " + token.text() + " is out of range");
        }
    }

    private static SqlParseException toException(ParseResult.Failure<?> failure) {
        TokenCursor at = failure.at();
        StringBuilder message = new StringBuilder("Parse error at position ").append(at.position()).append(": ");
        if (failure.message() != null) {
            message.append(failure.message());
        } else {
            message.append("expected ").append(String.join(" or ", failure.expected()))
                .append(", found ").append(describe(at.peek()));
        }
        return new SqlParseException(at.position(), failure.expected(), at.remainingInput(), message.toString());
    }

    private static String describe(Token token) {
        return switch (token.type()) {
            case EOF -> "end of input";
            case WHITESPACE -> "whitespace";
            default -> "'" + token.text() + "'";
        };
    }
}
