package com.asiainfo.semantic.core.measure;

import com.asiainfo.semantic.core.engine.EvaluationSession;
import com.asiainfo.semantic.core.filter.FilterContext;
import com.asiainfo.semantic.core.model.MeasureValue;

/**
 * 引用已注册的度量，在当前上下文下求值，效果等同于内联展开
 */
public record MeasureRefExpr(String name) implements MeasureExpr {

    @Override
    public MeasureValue evaluate(EvaluationSession session, FilterContext context) {
        return session.evaluateMeasure(name, context);
    }

    @Override
    public String toString() {
        return "[" + name + "]";
    }
}
