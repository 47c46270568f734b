package com.asiainfo.semantic.core.measure;

import com.asiainfo.semantic.core.filter.ColumnPredicate;
import com.asiainfo.semantic.core.model.ColumnRef;

/**
 * FILTERED 节点上的单列筛选条件
 */
public record ColumnFilter(ColumnRef column, ColumnPredicate predicate) {

    @Override
    public String toString() {
        return column + " " + predicate;
    }
}
