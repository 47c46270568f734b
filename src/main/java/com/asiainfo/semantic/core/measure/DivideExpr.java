package com.asiainfo.semantic.core.measure;

import com.asiainfo.semantic.core.engine.EvaluationSession;
import com.asiainfo.semantic.core.filter.FilterContext;
import com.asiainfo.semantic.core.model.MeasureValue;

import java.util.List;

/**
 * 安全除法：分子分母在同一外层上下文下独立求值，分母为 0 或 NO_VALUE 时结果为 NO_VALUE
 */
public record DivideExpr(MeasureExpr numerator, MeasureExpr denominator) implements MeasureExpr {

    @Override
    public MeasureValue evaluate(EvaluationSession session, FilterContext context) {
        MeasureValue den = session.evaluate(denominator, context);
        if (den.isEmpty() || den.getAsDouble() == 0d) {
            return MeasureValue.NO_VALUE;
        }
        return session.evaluate(numerator, context).dividedBy(den);
    }

    @Override
    public List<MeasureExpr> children() {
        return List.of(numerator, denominator);
    }

    @Override
    public String toString() {
        return "DIVIDE(" + numerator + ", " + denominator + ")";
    }
}
