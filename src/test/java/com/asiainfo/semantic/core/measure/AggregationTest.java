package com.asiainfo.semantic.core.measure;

import com.asiainfo.semantic.core.model.ColumnDef;
import com.asiainfo.semantic.core.model.ColumnType;
import com.asiainfo.semantic.core.model.FactTable;
import com.asiainfo.semantic.core.model.MeasureValue;
import com.asiainfo.semantic.core.model.TableData;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 聚合函数与百分位位置
 */
public class AggregationTest {

    private static final FactTable FACT = new FactTable("FactX", List.of(
            ColumnDef.of("Value", ColumnType.NUMERIC),
            ColumnDef.of("Label", ColumnType.TEXT)), List.of(), null);

    private static TableData data() {
        return TableData.of(FACT, List.of(
                Arrays.asList(4, "a"),
                Arrays.asList(1, "b"),
                Arrays.asList(null, "a"),
                Arrays.asList(3, null),
                Arrays.asList(2, "c")));
    }

    private static BitSet all(int n) {
        BitSet rows = new BitSet(n);
        rows.set(0, n);
        return rows;
    }

    @Test
    public void testPercentilePosition() {
        // ceil(4 × 0.75) = 3
        assertEquals(3, PercentileExpr.position(4, 0.75));
        // 0.7 × 10 在浮点下为 7.000000000000001，位置仍应为 7
        assertEquals(7, PercentileExpr.position(10, 0.7));
        assertEquals(1, PercentileExpr.position(5, 0));
        assertEquals(5, PercentileExpr.position(5, 1));
        assertEquals(1, PercentileExpr.position(1, 0.5));
    }

    @Test
    public void testAggregations() {
        TableData data = data();
        BitSet rows = all(data.rowCount());

        assertEquals(MeasureValue.of(5), AggFunc.COUNTROWS.aggregate(data, rows, -1));
        assertEquals(MeasureValue.of(4), AggFunc.COUNT.aggregate(data, rows, 0));
        assertEquals(MeasureValue.of(3), AggFunc.DISTINCTCOUNT.aggregate(data, rows, 1));
        assertEquals(MeasureValue.of(10), AggFunc.SUM.aggregate(data, rows, 0));
        assertEquals(MeasureValue.of(2.5), AggFunc.AVERAGE.aggregate(data, rows, 0));
        assertEquals(MeasureValue.of(1), AggFunc.MIN.aggregate(data, rows, 0));
        assertEquals(MeasureValue.of(4), AggFunc.MAX.aggregate(data, rows, 0));
    }

    @Test
    public void testEmptySet() {
        TableData data = data();
        BitSet none = new BitSet();

        assertEquals(MeasureValue.of(0), AggFunc.COUNT.aggregate(data, none, 0));
        assertEquals(MeasureValue.of(0), AggFunc.COUNTROWS.aggregate(data, none, -1));
        assertEquals(MeasureValue.NO_VALUE, AggFunc.SUM.aggregate(data, none, 0));
        assertEquals(MeasureValue.NO_VALUE, AggFunc.AVERAGE.aggregate(data, none, 0));
        assertEquals(MeasureValue.NO_VALUE, AggFunc.MAX.aggregate(data, none, 0));
    }

    @Test
    public void testMeasureValueArithmetic() {
        assertEquals(MeasureValue.NO_VALUE, MeasureValue.of(1).dividedBy(MeasureValue.of(0)));
        assertEquals(MeasureValue.NO_VALUE, MeasureValue.of(1).plus(MeasureValue.NO_VALUE));
        assertEquals(MeasureValue.of(0.25), MeasureValue.of(1).dividedBy(MeasureValue.of(4)));
        assertNull(MeasureValue.NO_VALUE.toNullable());
        assertEquals(-1d, MeasureValue.NO_VALUE.orElse(-1d));
    }
}
