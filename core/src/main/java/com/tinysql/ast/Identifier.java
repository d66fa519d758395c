package com.tinysql.ast;

import java.util.Objects;

/**
 * A column, table or function name, optionally qualified ({@code orders.id}).
 *
 * @param name the unqualified name
 * @param qualifier the table qualifier, or null
 */
public record Identifier(String name, String qualifier) implements Terminal {

    public Identifier {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
    }

    /**
     * Creates an unqualified identifier.
     *
     * @param name the name
     */
    public Identifier(String name) {
        this(name, null);
    }

    public boolean isQualified() {
        return qualifier != null;
    }

    @Override
    public String toString() {
        return isQualified() ? qualifier + "." + name : name;
    }
}
