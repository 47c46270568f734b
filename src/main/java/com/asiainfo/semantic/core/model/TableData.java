package com.asiainfo.semantic.core.model;

import com.asiainfo.semantic.core.exception.SchemaException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 表数据（行存），加载时按列类型转换并校验非空/唯一约束，之后只读
 */
public final class TableData {

    private final TableSchema schema;
    private final List<Object[]> rows;
    // 键列索引：value -> 行号，懒加载，并发读安全
    private final Map<String, Map<Object, Integer>> keyIndexes = new ConcurrentHashMap<>();

    private TableData(TableSchema schema, List<Object[]> rows) {
        this.schema = schema;
        this.rows = rows;
    }

    public static TableData empty(TableSchema schema) {
        return new TableData(schema, Collections.emptyList());
    }

    /**
     * 由原始行构造表数据
     *
     * @param schema  表结构
     * @param rawRows 原始行，列顺序与 schema 一致
     * @throws SchemaException 列数不符、类型无法转换、违反非空或唯一约束
     */
    public static TableData of(TableSchema schema, List<? extends List<?>> rawRows) {
        List<ColumnDef> cols = schema.columns();
        List<Object[]> rows = new ArrayList<>(rawRows.size());
        for (int r = 0; r < rawRows.size(); r++) {
            List<?> raw = rawRows.get(r);
            if (raw.size() != cols.size()) {
                throw new SchemaException(String.format("%s row %d has %d values, expected %d",
                        schema.name(), r, raw.size(), cols.size()));
            }
            Object[] row = new Object[cols.size()];
            for (int c = 0; c < cols.size(); c++) {
                ColumnDef col = cols.get(c);
                try {
                    row[c] = col.type().coerce(raw.get(c));
                } catch (IllegalArgumentException e) {
                    throw new SchemaException(String.format("%s[%s] row %d: %s",
                            schema.name(), col.name(), r, e.getMessage()), e);
                }
                if (row[c] == null && !col.nullable()) {
                    throw new SchemaException(String.format("%s[%s] is declared non-null but row %d is null",
                            schema.name(), col.name(), r));
                }
            }
            rows.add(row);
        }
        validateUnique(schema, rows);
        return new TableData(schema, Collections.unmodifiableList(rows));
    }

    private static void validateUnique(TableSchema schema, List<Object[]> rows) {
        List<ColumnDef> cols = schema.columns();
        for (int c = 0; c < cols.size(); c++) {
            if (!cols.get(c).unique()) continue;
            Set<Object> seen = new HashSet<>();
            for (Object[] row : rows) {
                if (row[c] != null && !seen.add(row[c])) {
                    throw new SchemaException(String.format("%s[%s] is declared unique but value %s repeats",
                            schema.name(), cols.get(c).name(), row[c]));
                }
            }
        }
    }

    public TableSchema schema() {
        return schema;
    }

    public String name() {
        return schema.name();
    }

    public int rowCount() {
        return rows.size();
    }

    public Object value(int row, int column) {
        return rows.get(row)[column];
    }

    public int columnIndex(String column) {
        int idx = schema.indexOf(column);
        if (idx < 0) {
            throw new SchemaException("Unknown column " + ColumnRef.of(schema.name(), column));
        }
        return idx;
    }

    /**
     * 键列索引：归一化后的键值 -> 行号。键列在 schema 校验阶段已保证唯一。
     */
    public Map<Object, Integer> keyIndex(String column) {
        return keyIndexes.computeIfAbsent(column, this::buildKeyIndex);
    }

    private Map<Object, Integer> buildKeyIndex(String column) {
        int c = columnIndex(column);
        Map<Object, Integer> index = new HashMap<>(rows.size() * 2);
        for (int r = 0; r < rows.size(); r++) {
            Object key = rows.get(r)[c];
            if (key != null) {
                index.putIfAbsent(Values.normalize(key), r);
            }
        }
        return Collections.unmodifiableMap(index);
    }
}
