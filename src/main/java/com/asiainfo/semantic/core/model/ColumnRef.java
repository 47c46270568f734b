package com.asiainfo.semantic.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * 列引用，文本形式为 Table[Column]，表名含空格时写作 'Table Name'[Column]
 */
public record ColumnRef(String table, String column) {

    public ColumnRef {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(column, "column");
    }

    public static ColumnRef of(String table, String column) {
        return new ColumnRef(table, column);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ColumnRef parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Column reference must not be null");
        }
        String s = text.trim();
        int open = s.lastIndexOf('[');
        if (open <= 0 || !s.endsWith("]")) {
            throw new IllegalArgumentException("Invalid column reference, expected Table[Column]: " + text);
        }
        String table = s.substring(0, open).trim();
        if (table.length() >= 2 && table.startsWith("'") && table.endsWith("'")) {
            table = table.substring(1, table.length() - 1);
        }
        String column = s.substring(open + 1, s.length() - 1).trim();
        if (table.isEmpty() || column.isEmpty()) {
            throw new IllegalArgumentException("Invalid column reference, expected Table[Column]: " + text);
        }
        return new ColumnRef(table, column);
    }

    @JsonValue
    @Override
    public String toString() {
        boolean quote = !table.matches("[A-Za-z_][A-Za-z0-9_]*");
        return (quote ? "'" + table + "'" : table) + "[" + column + "]";
    }
}
