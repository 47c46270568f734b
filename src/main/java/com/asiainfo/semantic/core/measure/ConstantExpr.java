package com.asiainfo.semantic.core.measure;

import com.asiainfo.semantic.core.engine.EvaluationSession;
import com.asiainfo.semantic.core.filter.FilterContext;
import com.asiainfo.semantic.core.model.MeasureValue;

public record ConstantExpr(double value) implements MeasureExpr {

    @Override
    public MeasureValue evaluate(EvaluationSession session, FilterContext context) {
        return MeasureValue.of(value);
    }

    @Override
    public String toString() {
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }
}
