package com.asiainfo.semantic.core.model;

/**
 * 列定义
 */
public record ColumnDef(
    String name,       // 列名
    ColumnType type,   // 语义类型
    boolean nullable,  // 是否允许空值
    boolean unique     // 是否声明唯一
) {
    public static ColumnDef key(String name) {
        return new ColumnDef(name, ColumnType.KEY, false, true);
    }

    public static ColumnDef of(String name, ColumnType type) {
        return new ColumnDef(name, type, true, false);
    }
}
