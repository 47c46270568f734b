package com.asiainfo.semantic.core.model;

/**
 * 关系：事实表列 -> 维度表键列，基数恒为多对一，筛选方向仅维度到事实
 */
public record Relationship(
    String id,
    String factTable,
    String factColumn,
    String dimensionTable,
    String dimensionColumn,
    boolean active
) {
    public static String defaultId(String factTable, String factColumn, String dimensionTable, String dimensionColumn) {
        return factTable + "[" + factColumn + "]->" + dimensionTable + "[" + dimensionColumn + "]";
    }

    public ColumnRef from() {
        return ColumnRef.of(factTable, factColumn);
    }

    public ColumnRef to() {
        return ColumnRef.of(dimensionTable, dimensionColumn);
    }

    public JoinKey joinKey() {
        return new JoinKey(factTable, dimensionTable);
    }
}
