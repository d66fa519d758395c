package com.tinysql.parser;

import java.util.List;
import java.util.Optional;
import java.util.function.BinaryOperator;

/**
 * Basic grammar rules and combinators.
 *
 * <p>Example:
 * <pre>
 *   Parser&lt;Token&gt; name = Parsers.token(TokenType.IDENTIFIER);
 *   Parser&lt;Token&gt; nameOrNumber = Parsers.choice(name, Parsers.token(TokenType.INTEGER));
 * </pre>
 */
public final class Parsers {

    private Parsers() {}

    /**
     * Matches a single token of the given type.
     *
     * @param type the token type to accept
     * @return the rule
     */
    public static Parser<Token> token(TokenType type) {
        return input -> {
            Token token = input.peek();
            if (token.is(type)) {
                return ParseResult.success(token, input.advance());
            }
            return ParseResult.failure(input, type.describe());
        };
    }

    /**
     * Ordered choice: tries each alternative from the same position and returns the
     * first success. If all fail, returns the failure that reached furthest. A committed
     * failure stops the search immediately.
     *
     * @param alternatives the alternatives, in priority order
     * @return the rule
     */
    @SafeVarargs
    public static <T> Parser<T> choice(Parser<? extends T>... alternatives) {
        List<Parser<? extends T>> options = List.of(alternatives);
        if (options.isEmpty()) {
            throw new IllegalArgumentException("choice requires at least one alternative");
        }
        return input -> {
            ParseResult.Failure<T> furthest = null;
            for (Parser<? extends T> option : options) {
                ParseResult<T> result = option.parse(input).map(value -> value);
                if (result.isSuccess()) {
                    return result;
                }
                ParseResult.Failure<T> failure = (ParseResult.Failure<T>) result;
                if (failure.committed()) {
                    return failure;
                }
                furthest = furthest == null ? failure : furthest.furthest(failure);
            }
            return furthest;
        };
    }

    /**
     * Matches {@code parser} or nothing. An uncommitted failure becomes an empty match at
     * the starting position; a committed failure is propagated.
     *
     * @param parser the optional rule
     * @return the rule
     */
    public static <T> Parser<Optional<T>> optional(Parser<T> parser) {
        return input -> {
            ParseResult<T> result = parser.parse(input);
            if (result instanceof ParseResult.Success<T> success) {
                return ParseResult.success(Optional.ofNullable(success.value()), success.rest());
            }
            ParseResult.Failure<T> failure = (ParseResult.Failure<T>) result;
            if (failure.committed()) {
                return failure.cast();
            }
            return ParseResult.success(Optional.empty(), input);
        };
    }

    /**
     * Matches one or more items separated by {@code separator} and folds them left into
     * a binary tree: {@code a, b, c} becomes {@code combine(combine(a, b), c)}.
     *
     * <p>Matching a separator commits to another item: {@code a, } followed by something
     * that is not an item is a committed failure rather than a shorter list.
     *
     * @param item the rule for one item
     * @param separator the rule between items
     * @param combine joins the chain so far with the next item
     * @param maxItems the largest number of items accepted
     * @return the rule
     */
    public static <T> Parser<T> chainLeft(Parser<T> item, Parser<?> separator,
                                          BinaryOperator<T> combine, int maxItems) {
        return input -> {
            ParseResult<T> first = item.parse(input);
            if (!(first instanceof ParseResult.Success<T> head)) {
                return first;
            }
            T chain = head.value();
            TokenCursor cursor = head.rest();
            int count = 1;
            while (true) {
                ParseResult<?> sep = separator.parse(cursor);
                if (sep instanceof ParseResult.Failure<?> sepFailure) {
                    if (sepFailure.committed()) {
                        return sepFailure.cast();
                    }
                    return ParseResult.success(chain, cursor);
                }
                if (count >= maxItems) {
                    return new ParseResult.Failure<>(cursor, List.of(), "list exceeds " + maxItems + " items", true);
                }
                TokenCursor afterSeparator = ((ParseResult.Success<?>) sep).rest();
                ParseResult<T> next = item.parse(afterSeparator);
                if (next instanceof ParseResult.Failure<T> itemFailure) {
                    return itemFailure.commit();
                }
                ParseResult.Success<T> nextItem = (ParseResult.Success<T>) next;
                chain = combine.apply(chain, nextItem.value());
                cursor = nextItem.rest();
                count++;
            }
        };
    }
}
