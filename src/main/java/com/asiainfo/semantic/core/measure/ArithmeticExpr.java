package com.asiainfo.semantic.core.measure;

import com.asiainfo.semantic.core.engine.EvaluationSession;
import com.asiainfo.semantic.core.filter.FilterContext;
import com.asiainfo.semantic.core.model.MeasureValue;

import java.util.List;

/**
 * 加、减、乘；任一操作数为 NO_VALUE 时结果为 NO_VALUE
 */
public record ArithmeticExpr(Operator operator, MeasureExpr left, MeasureExpr right) implements MeasureExpr {

    public enum Operator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    @Override
    public MeasureValue evaluate(EvaluationSession session, FilterContext context) {
        MeasureValue l = session.evaluate(left, context);
        MeasureValue r = session.evaluate(right, context);
        return switch (operator) {
            case ADD -> l.plus(r);
            case SUBTRACT -> l.minus(r);
            case MULTIPLY -> l.times(r);
        };
    }

    @Override
    public List<MeasureExpr> children() {
        return List.of(left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
