package com.lhcz.pgcdc.model;

import java.util.Objects;

/**
 * 源表标识 schema.name
 */
public record TableId(String schema, String name) {

    public TableId {
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(name, "name");
    }

    /**
     * "public.users" 或 "users" (默认 schema)
     */
    public static TableId parse(String text, String defaultSchema) {
        int dot = text.indexOf('.');
        if (dot < 0) {
            return new TableId(defaultSchema, text);
        }
        return new TableId(text.substring(0, dot), text.substring(dot + 1));
    }

    @Override
    public String toString() {
        return schema + "." + name;
    }
}
