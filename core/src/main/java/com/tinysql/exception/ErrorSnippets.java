package com.tinysql.exception;

/**
 * Formatting helpers shared by the exception messages.
 */
final class ErrorSnippets {

    private static final int MAX_SNIPPET = 20;

    private ErrorSnippets() {}

    static String abbreviate(String input) {
        if (input.length() <= MAX_SNIPPET) {
            return input;
        }
        return input.substring(0, MAX_SNIPPET) + "...";
    }
}
