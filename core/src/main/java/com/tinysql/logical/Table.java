package com.tinysql.logical;

import java.util.Objects;

/**
 * A scanned table, identified by name only.
 *
 * @param name the table name
 */
public record Table(String name) {

    public Table {
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public String toString() {
        return name;
    }
}
