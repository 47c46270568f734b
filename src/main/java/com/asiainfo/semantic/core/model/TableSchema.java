package com.asiainfo.semantic.core.model;

import java.util.List;
import java.util.Optional;

/**
 * 表结构（维度表与事实表的公共部分）
 */
public interface TableSchema {

    String name();

    List<ColumnDef> columns();

    default Optional<ColumnDef> column(String columnName) {
        return columns().stream().filter(c -> c.name().equals(columnName)).findFirst();
    }

    default int indexOf(String columnName) {
        List<ColumnDef> cols = columns();
        for (int i = 0; i < cols.size(); i++) {
            if (cols.get(i).name().equals(columnName)) {
                return i;
            }
        }
        return -1;
    }
}
