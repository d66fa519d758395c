package com.tinysql.logical;

import java.util.Objects;

/**
 * A projected column, identified by name only.
 *
 * @param name the column name
 */
public record Column(String name) {

    public Column {
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public String toString() {
        return name;
    }
}
