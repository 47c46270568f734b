package com.asiainfo.semantic.core.measure;

import com.asiainfo.semantic.core.engine.EvaluationSession;
import com.asiainfo.semantic.core.filter.FilterContext;
import com.asiainfo.semantic.core.model.ColumnRef;
import com.asiainfo.semantic.core.model.MeasureValue;
import com.asiainfo.semantic.core.model.TableData;

import java.util.BitSet;

/**
 * 基础聚合：扫描满足上下文的事实行并归约指定列
 *
 * @param column COUNTROWS 时为 null
 */
public record AggregateExpr(AggFunc func, String table, String column) implements MeasureExpr {

    @Override
    public MeasureValue evaluate(EvaluationSession session, FilterContext context) {
        BitSet rows = session.rows(table, context);
        TableData data = session.model().data(table);
        int idx = func == AggFunc.COUNTROWS ? -1 : data.columnIndex(column);
        return func.aggregate(data, rows, idx);
    }

    public ColumnRef columnRef() {
        return column == null ? null : ColumnRef.of(table, column);
    }

    @Override
    public String toString() {
        return func + "(" + (column == null ? table : columnRef().toString()) + ")";
    }
}
