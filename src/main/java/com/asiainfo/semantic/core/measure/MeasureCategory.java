package com.asiainfo.semantic.core.measure;

import java.util.HashSet;
import java.util.Set;

/**
 * 度量分类（度量目录用）
 * 按表达式直接使用的函数归类，优先级从上到下。
 */
public enum MeasureCategory {
    AGGREGATION,
    COUNTING,
    STATISTICAL,
    FILTERED,
    TIME_INTELLIGENCE,
    CALCULATION,
    OTHER;

    public static MeasureCategory of(MeasureExpr expr) {
        Set<String> functions = new HashSet<>();
        collect(expr, functions);
        if (functions.contains("SUM")) return AGGREGATION;
        if (functions.contains("COUNT") || functions.contains("COUNTROWS") || functions.contains("DISTINCTCOUNT")) {
            return COUNTING;
        }
        for (String f : Set.of("AVERAGE", "MIN", "MAX", "PERCENTILE")) {
            if (functions.contains(f)) return STATISTICAL;
        }
        if (functions.contains("FILTERED")) return FILTERED;
        if (functions.contains("LASTNDAYS")) return TIME_INTELLIGENCE;
        if (functions.contains("DIVIDE") || functions.contains("ARITHMETIC")) return CALCULATION;
        return OTHER;
    }

    private static void collect(MeasureExpr expr, Set<String> functions) {
        if (expr instanceof AggregateExpr a) {
            functions.add(a.func().name());
        } else if (expr instanceof PercentileExpr) {
            functions.add("PERCENTILE");
        } else if (expr instanceof FilteredExpr) {
            functions.add("FILTERED");
        } else if (expr instanceof LastNDaysExpr) {
            functions.add("LASTNDAYS");
        } else if (expr instanceof DivideExpr) {
            functions.add("DIVIDE");
        } else if (expr instanceof ArithmeticExpr) {
            functions.add("ARITHMETIC");
        }
        for (MeasureExpr child : expr.children()) {
            collect(child, functions);
        }
    }
}
