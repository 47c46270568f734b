package com.asiainfo.semantic.core.measure;

import com.asiainfo.semantic.core.engine.EvaluationSession;
import com.asiainfo.semantic.core.filter.FilterContext;
import com.asiainfo.semantic.core.model.ColumnRef;
import com.asiainfo.semantic.core.model.MeasureValue;
import com.asiainfo.semantic.core.model.TableData;
import com.asiainfo.semantic.core.model.Values;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.BitSet;

/**
 * PERCENTILE(column, fraction)：包含式百分位
 * 升序排序后取第 ceil(n × fraction) 个值（1 起始，限定在 [1, n]）；空集返回 NO_VALUE。
 */
public record PercentileExpr(String table, String column, double fraction) implements MeasureExpr {

    @Override
    public MeasureValue evaluate(EvaluationSession session, FilterContext context) {
        BitSet rows = session.rows(table, context);
        TableData data = session.model().data(table);
        int idx = data.columnIndex(column);

        double[] values = new double[rows.cardinality()];
        int n = 0;
        for (int r = rows.nextSetBit(0); r >= 0; r = rows.nextSetBit(r + 1)) {
            Object v = data.value(r, idx);
            if (v != null) values[n++] = Values.toDouble(v);
        }
        if (n == 0) {
            return MeasureValue.NO_VALUE;
        }
        Arrays.sort(values, 0, n);
        return MeasureValue.of(values[position(n, fraction) - 1]);
    }

    /**
     * 1 起始的取值位置。用 BigDecimal 计算，避免 0.7 × 10 这类浮点误差把位置推到下一位。
     */
    static int position(int n, double fraction) {
        int pos = BigDecimal.valueOf(n)
                .multiply(BigDecimal.valueOf(fraction))
                .setScale(0, RoundingMode.CEILING)
                .intValueExact();
        return Math.max(1, Math.min(n, pos));
    }

    public ColumnRef columnRef() {
        return ColumnRef.of(table, column);
    }

    @Override
    public String toString() {
        return "PERCENTILE(" + columnRef() + ", " + fraction + ")";
    }
}
