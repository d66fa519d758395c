package com.tinysql.parser;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Outcome of applying a grammar rule: either a value plus the cursor after it, or a
 * failure describing where the rule stopped and what it expected there.
 *
 * <p>A failure is <em>committed</em> when the rule had already matched a commit point
 * (such as a statement keyword or a list separator) before failing. Ordered choice does
 * not try further alternatives after a committed failure.
 *
 * @param <T> the type of the parsed value
 */
public sealed interface ParseResult<T> permits ParseResult.Success, ParseResult.Failure {

    static <T> ParseResult<T> success(T value, TokenCursor rest) {
        return new Success<>(value, rest);
    }

    static <T> ParseResult<T> failure(TokenCursor at, String expected) {
        return new Failure<>(at, List.of(expected), null, false);
    }

    static <T> ParseResult<T> error(TokenCursor at, String message) {
        return new Failure<>(at, List.of(), message, false);
    }

    boolean isSuccess();

    <R> ParseResult<R> map(Function<? super T, ? extends R> mapper);

    /**
     * A rule matched.
     *
     * @param value the parsed value
     * @param rest the cursor after the matched tokens
     */
    record Success<T>(T value, TokenCursor rest) implements ParseResult<T> {

        public Success {
            Objects.requireNonNull(rest, "rest must not be null");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value), rest);
        }
    }

    /**
     * A rule did not match.
     *
     * @param at the cursor at the token where matching stopped
     * @param expected descriptions of acceptable tokens at {@code at}
     * @param message an explanation when the failure is not a plain token mismatch, or null
     * @param committed whether alternatives must not be tried after this failure
     */
    record Failure<T>(TokenCursor at, List<String> expected, String message, boolean committed)
            implements ParseResult<T> {

        public Failure {
            Objects.requireNonNull(at, "at must not be null");
            expected = List.copyOf(expected);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return cast();
        }

        /**
         * Re-types this failure; failures carry no value.
         */
        @SuppressWarnings("unchecked")
        public <R> Failure<R> cast() {
            return (Failure<R>) this;
        }

        public Failure<T> commit() {
            return committed ? this : new Failure<>(at, expected, message, true);
        }

        /**
         * Returns whichever of two failures got further into the input. Failures at the
         * same token merge their expectations.
         *
         * @param other the other failure, may be null
         * @return the furthest failure
         */
        public Failure<T> furthest(Failure<?> other) {
            if (other == null || other.at.index() < at.index()) {
                return this;
            }
            if (other.at.index() > at.index()) {
                return other.cast();
            }
            Set<String> merged = new LinkedHashSet<>(expected);
            merged.addAll(other.expected);
            String mergedMessage = message != null ? message : other.message;
            return new Failure<>(at, new ArrayList<>(merged), mergedMessage, committed || other.committed);
        }
    }
}
