package com.asiainfo.semantic.core.measure;

import com.asiainfo.semantic.core.engine.EvaluationSession;
import com.asiainfo.semantic.core.filter.FilterContext;
import com.asiainfo.semantic.core.model.MeasureValue;

import java.util.List;

/**
 * 度量表达式树节点
 * 节点本身无状态，求值所需的数据与缓存全部来自 {@link EvaluationSession}。
 */
public interface MeasureExpr {

    /**
     * 在给定筛选上下文下求值
     */
    MeasureValue evaluate(EvaluationSession session, FilterContext context);

    /**
     * 直接子节点（不展开度量引用）
     */
    default List<MeasureExpr> children() {
        return List.of();
    }
}
