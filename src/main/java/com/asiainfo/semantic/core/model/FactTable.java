package com.asiainfo.semantic.core.model;

import java.util.List;

/**
 * 事实表定义，不要求主键（允许重复粒度）
 */
public record FactTable(
    String name,
    List<ColumnDef> columns,
    List<ForeignKey> foreignKeys,
    ColumnRef anchorColumn   // 锚点日期列，可为事实表自身的日期列或经键关联的维度日期列，可空
) implements TableSchema {

    public FactTable {
        columns = List.copyOf(columns);
        foreignKeys = List.copyOf(foreignKeys);
    }
}
