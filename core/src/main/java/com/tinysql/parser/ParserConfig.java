package com.tinysql.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Limits applied by {@link QueryParser}.
 *
 * <p>Values can be overridden with system properties:
 * <ul>
 *   <li>{@code tinysql.parser.maxQueryLength}: longest accepted query text, in characters</li>
 *   <li>{@code tinysql.parser.maxListItems}: most items accepted in one comma-separated list</li>
 *   <li>{@code tinysql.parser.maxNestingDepth}: deepest accepted nesting of function calls</li>
 * </ul>
 * Non-numeric or non-positive property values are logged and ignored.
 */
public final class ParserConfig {

    private static final Logger logger = LoggerFactory.getLogger(ParserConfig.class);

    /** Default maximum query length in characters */
    public static final int DEFAULT_MAX_QUERY_LENGTH = 64 * 1024;

    /** Default maximum number of items in a column, table or value list */
    public static final int DEFAULT_MAX_LIST_ITEMS = 4096;

    /** Default maximum nesting of function calls, {@code f(g(x))} being two levels */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 64;

    static final String PROP_MAX_QUERY_LENGTH = "tinysql.parser.maxQueryLength";
    static final String PROP_MAX_LIST_ITEMS = "tinysql.parser.maxListItems";
    static final String PROP_MAX_NESTING_DEPTH = "tinysql.parser.maxNestingDepth";

    private static final ParserConfig DEFAULTS =
        new ParserConfig(DEFAULT_MAX_QUERY_LENGTH, DEFAULT_MAX_LIST_ITEMS, DEFAULT_MAX_NESTING_DEPTH);

    private final int maxQueryLength;
    private final int maxListItems;
    private final int maxNestingDepth;

    /**
     * Creates a configuration with explicit length limits and the default nesting limit.
     *
     * @param maxQueryLength the longest accepted query, in characters
     * @param maxListItems the most items accepted in one list
     */
    public ParserConfig(int maxQueryLength, int maxListItems) {
        this(maxQueryLength, maxListItems, DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * Creates a configuration with explicit limits.
     *
     * @param maxQueryLength the longest accepted query, in characters
     * @param maxListItems the most items accepted in one list
     * @param maxNestingDepth the deepest accepted nesting of function calls
     */
    public ParserConfig(int maxQueryLength, int maxListItems, int maxNestingDepth) {
        if (maxQueryLength <= 0) {
            throw new IllegalArgumentException("maxQueryLength must be positive");
        }
        if (maxListItems <= 0) {
            throw new IllegalArgumentException("maxListItems must be positive");
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive");
        }
        this.maxQueryLength = maxQueryLength;
        this.maxListItems = maxListItems;
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Returns the built-in defaults, ignoring system properties.
     *
     * @return the default configuration
     */
    public static ParserConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Returns a configuration built from system properties, falling back to the defaults.
     *
     * @return the configuration
     */
    public static ParserConfig fromSystemProperties() {
        return new ParserConfig(
            getConfiguredInt(PROP_MAX_QUERY_LENGTH, DEFAULT_MAX_QUERY_LENGTH),
            getConfiguredInt(PROP_MAX_LIST_ITEMS, DEFAULT_MAX_LIST_ITEMS),
            getConfiguredInt(PROP_MAX_NESTING_DEPTH, DEFAULT_MAX_NESTING_DEPTH));
    }

    public int maxQueryLength() {
        return maxQueryLength;
    }

    public int maxListItems() {
        return maxListItems;
    }

    public int maxNestingDepth() {
        return maxNestingDepth;
    }

    private static int getConfiguredInt(String property, int defaultValue) {
        String value = System.getProperty(property);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed > 0) {
                return parsed;
            }
            logger.warn("Ignoring non-positive value '{}' for {}, using {}", value, property, defaultValue);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid value '{}' for {}, using {}", value, property, defaultValue);
        }
        return defaultValue;
    }

    @Override
    public String toString() {
        return "ParserConfig(maxQueryLength=" + maxQueryLength + ", maxListItems=" + maxListItems
            + ", maxNestingDepth=" + maxNestingDepth + ")";
    }
}
