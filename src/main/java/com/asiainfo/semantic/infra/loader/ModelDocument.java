package com.asiainfo.semantic.infra.loader;

import com.asiainfo.semantic.core.measure.MeasureDefinition;
import com.asiainfo.semantic.core.model.ColumnType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * 模型文档（JSON）：维度表、事实表、已物化的行数据与度量定义
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelDocument(
    String name,
    List<TableDocument> dimensions,
    List<TableDocument> facts,
    List<MeasureDefinition> measures
) {

    /**
     * 表声明
     *
     * @param primaryKey   维度表主键，事实表为空
     * @param foreignKeys  事实表外键，维度表为空
     * @param anchorColumn 事实表锚点日期列，形如 DimDate[Date]
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TableDocument(
        String name,
        String primaryKey,
        List<ColumnDocument> columns,
        List<ForeignKeyDocument> foreignKeys,
        String anchorColumn,
        List<List<Object>> rows
    ) {}

    /**
     * 列声明，nullable 默认 true（主键除外），unique 默认 false
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ColumnDocument(
        String name,
        ColumnType type,
        Boolean nullable,
        Boolean unique
    ) {}

    /**
     * 外键声明
     *
     * @param references 目标列，形如 DimQueue[QueueKey]
     * @param id         关系标识，为空时自动生成
     * @param active     是否为默认关系，默认 true
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ForeignKeyDocument(
        String column,
        String references,
        String id,
        Boolean active
    ) {}
}
