package com.asiainfo.semantic.infra.cache;

import com.asiainfo.semantic.core.filter.FilterContext;
import com.asiainfo.semantic.core.model.ColumnRef;

import java.util.List;

/**
 * 查询缓存键
 * 包含模型版本，快照替换后旧键自然不再命中。
 *
 * @param groupBy 单值查询为空列表
 */
public record QueryCacheKey(
    long modelVersion,
    String measure,
    List<ColumnRef> groupBy,
    FilterContext context
) {
    public QueryCacheKey {
        groupBy = List.copyOf(groupBy);
    }

    public static QueryCacheKey scalar(long modelVersion, String measure, FilterContext context) {
        return new QueryCacheKey(modelVersion, measure, List.of(), context);
    }

    public static QueryCacheKey grouped(long modelVersion, String measure, List<ColumnRef> groupBy, FilterContext context) {
        return new QueryCacheKey(modelVersion, measure, groupBy, context);
    }

    @Override
    public String toString() {
        return "v" + modelVersion + ":" + measure + (groupBy.isEmpty() ? "" : " by " + groupBy) + " " + context;
    }
}
