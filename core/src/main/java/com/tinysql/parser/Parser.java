package com.tinysql.parser;

import java.util.function.Function;

/**
 * A grammar rule: a function from a token cursor to a {@link ParseResult}.
 *
 * <p>Rules never throw for input that does not match; they return a failure so that the
 * caller can try another alternative. Rules are stateless and can be shared.
 *
 * @param <T> the type of value the rule produces
 */
@FunctionalInterface
public interface Parser<T> {

    ParseResult<T> parse(TokenCursor input);

    /**
     * Transforms the value of a successful match.
     */
    default <R> Parser<R> map(Function<? super T, ? extends R> mapper) {
        return input -> parse(input).map(mapper);
    }

    /**
     * Runs this rule, then the rule chosen from its value, starting where this one stopped.
     */
    default <R> Parser<R> bind(Function<? super T, Parser<R>> next) {
        return input -> {
            ParseResult<T> result = parse(input);
            if (result instanceof ParseResult.Success<T> success) {
                return next.apply(success.value()).parse(success.rest());
            }
            return ((ParseResult.Failure<T>) result).cast();
        };
    }

    /**
     * Runs this rule and then {@code next}, keeping the value of {@code next}.
     */
    default <R> Parser<R> then(Parser<R> next) {
        return bind(ignored -> next);
    }

    /**
     * Runs this rule and then {@code next}, keeping the value of this rule.
     */
    default Parser<T> skip(Parser<?> next) {
        return bind(value -> next.map(ignored -> value));
    }

    /**
     * Marks every failure of this rule as committed, so that an enclosing ordered
     * choice reports it instead of trying the next alternative.
     */
    default Parser<T> committed() {
        return input -> {
            ParseResult<T> result = parse(input);
            if (result instanceof ParseResult.Failure<T> failure) {
                return failure.commit();
            }
            return result;
        };
    }

    /**
     * Runs this rule; once it matches, everything produced by {@code rest} is committed.
     * Used for rules whose first token decides that no other alternative can apply.
     */
    default <R> Parser<R> commitTo(Function<? super T, Parser<R>> rest) {
        return bind(value -> rest.apply(value).committed());
    }
}
