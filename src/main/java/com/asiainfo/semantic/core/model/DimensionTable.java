package com.asiainfo.semantic.core.model;

import java.util.List;

/**
 * 维度表定义，加载后不可变，被所有关联到它的事实表共享
 */
public record DimensionTable(
    String name,
    List<ColumnDef> columns,
    String primaryKey   // 主键列（唯一且非空）
) implements TableSchema {

    public DimensionTable {
        columns = List.copyOf(columns);
    }
}
