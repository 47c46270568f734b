package com.asiainfo.semantic.core.measure;

/**
 * 度量类型（描述性，用于目录展示与下钻时推断样本量）
 */
public enum MeasureType {
    COUNT,
    SUM,
    AVERAGE,
    RATIO,
    RATIO_OF_SUMS,
    PERCENTILE,
    NUMBER;

    /**
     * 定义中未声明类型时按表达式根节点推断
     */
    public static MeasureType infer(MeasureExpr expr) {
        if (expr instanceof FilteredExpr f) {
            return infer(f.child());
        }
        if (expr instanceof LastNDaysExpr l) {
            return infer(l.child());
        }
        if (expr instanceof AggregateExpr a) {
            switch (a.func()) {
                case SUM:
                    return SUM;
                case AVERAGE:
                    return AVERAGE;
                case MIN:
                case MAX:
                    return NUMBER;
                default:
                    return COUNT;
            }
        }
        if (expr instanceof PercentileExpr) {
            return PERCENTILE;
        }
        if (expr instanceof DivideExpr d) {
            return isSum(d.numerator()) && isSum(d.denominator()) ? RATIO_OF_SUMS : RATIO;
        }
        return NUMBER;
    }

    private static boolean isSum(MeasureExpr expr) {
        return expr instanceof AggregateExpr a && a.func() == AggFunc.SUM;
    }
}
