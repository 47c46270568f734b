package com.asiainfo.semantic.core.model;

/**
 * 事实表外键声明，每个外键对应关系图中的一条边
 */
public record ForeignKey(
    String column,          // 事实表列
    String targetTable,     // 目标维度表
    String targetColumn,    // 目标维度键列
    String relationshipId,  // 关系标识，为空时按列自动生成
    boolean active          // 是否为默认激活关系
) {
    public static ForeignKey of(String column, String targetTable, String targetColumn) {
        return new ForeignKey(column, targetTable, targetColumn, null, true);
    }
}
