package com.asiainfo.semantic.core.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * 单元格取值工具
 * 统一数字类型（Integer/Long/Double 视为同一个值域），提供稳定的比较顺序。
 */
public final class Values {

    private static final double MAX_EXACT_LONG = 9_007_199_254_740_992d; // 2^53

    /**
     * 比较器：空值排在最后
     */
    public static final Comparator<Object> NULLS_LAST = (a, b) -> {
        if (a == null && b == null) return 0;
        if (a == null) return 1;
        if (b == null) return -1;
        return compare(a, b);
    };

    /**
     * 分组键比较器：逐列比较
     */
    public static final Comparator<List<Object>> TUPLE_ORDER = (a, b) -> {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = NULLS_LAST.compare(a.get(i), b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    };

    private Values() {}

    /**
     * 归一化：整数值统一为 Long，非整数统一为 Double
     */
    public static Object normalize(Object value) {
        if (!(value instanceof Number)) {
            return value;
        }
        if (value instanceof Long) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        double d = value instanceof BigDecimal ? ((BigDecimal) value).doubleValue() : ((Number) value).doubleValue();
        if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < MAX_EXACT_LONG) {
            return (long) d;
        }
        return d;
    }

    public static boolean sameValue(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        return normalize(a).equals(normalize(b));
    }

    /**
     * 比较两个非空值；跨类型时按类型名排序，保证全序
     */
    public static int compare(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a instanceof LocalDate && b instanceof LocalDate) {
            return ((LocalDate) a).compareTo((LocalDate) b);
        }
        if (a instanceof String && b instanceof String) {
            return ((String) a).compareTo((String) b);
        }
        if (a instanceof Boolean && b instanceof Boolean) {
            return Boolean.compare((Boolean) a, (Boolean) b);
        }
        int byType = a.getClass().getName().compareTo(b.getClass().getName());
        return byType != 0 ? byType : a.toString().compareTo(b.toString());
    }

    public static double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw new IllegalArgumentException("Not a numeric value: " + value);
    }
}
