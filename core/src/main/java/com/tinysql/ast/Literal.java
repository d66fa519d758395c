package com.tinysql.ast;

import com.tinysql.types.DataType;
import com.tinysql.types.IntegerType;
import com.tinysql.types.StringType;

import java.util.Objects;

/**
 * A constant value in query text.
 *
 * <p>Examples:
 * <pre>
 *   42       -- Literal(42, integer)
 *   -7       -- Literal(-7, integer)
 *   'abc'    -- Literal("abc", string)
 *   abc      -- Literal("abc", string), only as an INSERT value
 * </pre>
 *
 * @param value the value, an instance of {@code dataType.javaClass()}
 * @param dataType the data type of the value
 */
public record Literal(Object value, DataType dataType) implements Terminal {

    public Literal {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
        if (!dataType.javaClass().isInstance(value)) {
            throw new IllegalArgumentException(
                "value " + value + " is not a " + dataType.typeName());
        }
    }

    public static Literal ofInt(int value) {
        return new Literal(value, IntegerType.get());
    }

    public static Literal ofString(String value) {
        return new Literal(value, StringType.get());
    }

    @Override
    public String toString() {
        return dataType instanceof StringType ? "'" + value + "'" : String.valueOf(value);
    }
}
