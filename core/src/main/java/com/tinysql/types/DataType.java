package com.tinysql.types;

/**
 * Sealed interface for the data types a literal can carry.
 *
 * <p>The query language only knows two literal shapes:
 * <ul>
 *   <li>{@link IntegerType}: signed 32-bit integers such as {@code 42} or {@code -7}</li>
 *   <li>{@link StringType}: quoted strings ({@code 'abc'}) and bare words in INSERT values</li>
 * </ul>
 */
public sealed interface DataType permits IntegerType, StringType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns the Java class used to hold values of this type.
     *
     * @return the value class
     */
    Class<?> javaClass();
}
