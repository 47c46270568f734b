package com.asiainfo.semantic.core.measure;

import com.asiainfo.semantic.core.model.MeasureValue;
import com.asiainfo.semantic.core.model.TableData;
import com.asiainfo.semantic.core.model.Values;

import java.util.BitSet;
import java.util.HashSet;
import java.util.Set;

/**
 * 基础聚合函数
 * 计数类在空集上返回 0；SUM/AVERAGE/MIN/MAX 在没有非空值时返回 NO_VALUE。
 */
public enum AggFunc {
    COUNT,
    COUNTROWS,
    DISTINCTCOUNT,
    SUM,
    AVERAGE,
    MIN,
    MAX;

    public boolean requiresNumeric() {
        return this == SUM || this == AVERAGE || this == MIN || this == MAX;
    }

    public boolean isCounting() {
        return this == COUNT || this == COUNTROWS || this == DISTINCTCOUNT;
    }

    /**
     * 对选中行的指定列做聚合
     *
     * @param column 列下标，COUNTROWS 时忽略
     */
    public MeasureValue aggregate(TableData data, BitSet rows, int column) {
        if (this == COUNTROWS) {
            return MeasureValue.of(rows.cardinality());
        }
        long count = 0;
        double sum = 0d;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        Set<Object> distinct = this == DISTINCTCOUNT ? new HashSet<>() : null;

        for (int r = rows.nextSetBit(0); r >= 0; r = rows.nextSetBit(r + 1)) {
            Object v = data.value(r, column);
            if (v == null) continue;
            count++;
            if (distinct != null) {
                distinct.add(Values.normalize(v));
            } else if (requiresNumeric()) {
                double d = Values.toDouble(v);
                sum += d;
                min = Math.min(min, d);
                max = Math.max(max, d);
            }
        }

        switch (this) {
            case COUNT:
                return MeasureValue.of(count);
            case DISTINCTCOUNT:
                return MeasureValue.of(distinct.size());
            case SUM:
                return count == 0 ? MeasureValue.NO_VALUE : MeasureValue.of(sum);
            case AVERAGE:
                return count == 0 ? MeasureValue.NO_VALUE : MeasureValue.of(sum / count);
            case MIN:
                return count == 0 ? MeasureValue.NO_VALUE : MeasureValue.of(min);
            case MAX:
                return count == 0 ? MeasureValue.NO_VALUE : MeasureValue.of(max);
            default:
                throw new IllegalStateException("Unhandled aggregation " + this);
        }
    }
}
