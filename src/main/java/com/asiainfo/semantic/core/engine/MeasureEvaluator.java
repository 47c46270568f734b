package com.asiainfo.semantic.core.engine;

import com.asiainfo.semantic.core.SemanticModel;
import com.asiainfo.semantic.core.exception.UnreachableDimensionException;
import com.asiainfo.semantic.core.filter.FilterContext;
import com.asiainfo.semantic.core.filter.Predicates;
import com.asiainfo.semantic.core.model.ColumnRef;
import com.asiainfo.semantic.core.model.MeasureValue;
import com.asiainfo.semantic.core.model.ResultTable;
import com.asiainfo.semantic.core.model.Values;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 度量求值器
 * 单值求值与分组求值的入口，绑定一个不可变模型快照，可被多线程共享。
 */
public final class MeasureEvaluator {

    private final SemanticModel model;

    public MeasureEvaluator(SemanticModel model) {
        this.model = model;
    }

    public SemanticModel model() {
        return model;
    }

    public EvaluationSession newSession(CancellationToken token) {
        return new EvaluationSession(model, token);
    }

    public MeasureValue evaluate(String measureName, FilterContext context) {
        return evaluate(measureName, context, CancellationToken.NONE);
    }

    public MeasureValue evaluate(String measureName, FilterContext context, CancellationToken token) {
        return newSession(token).evaluateMeasure(measureName, context);
    }

    public ResultTable evaluateGrouped(String measureName, List<ColumnRef> groupBy, FilterContext context) {
        return evaluateGrouped(measureName, groupBy, context, CancellationToken.NONE);
    }

    /**
     * 分组求值
     * 分组键取自度量所用事实表中满足上下文的行（仅限能到达全部分组列的事实表），
     * 每个组合以"上下文 ∩ 分组列取值"独立求值。分组列取值为空（空外键或孤儿行）时以 IS NULL 承载，
     * 因此各组行数之和等于总行数。结果按分组键升序、空值在后。
     */
    public ResultTable evaluateGrouped(String measureName, List<ColumnRef> groupBy,
                                       FilterContext context, CancellationToken token) {
        EvaluationSession session = newSession(token);
        model.measures().require(measureName);
        for (ColumnRef col : groupBy) {
            model.schema().requireColumn(col);
        }

        List<String> facts = reachingFacts(model.measures().factsOf(measureName), groupBy);
        if (facts.isEmpty()) {
            throw new UnreachableDimensionException(String.format(
                    "Measure [%s] cannot be grouped by %s: no fact table reaches all group columns", measureName, groupBy));
        }

        Set<List<Object>> combos = new TreeSet<>(Values.TUPLE_ORDER);
        for (String fact : facts) {
            List<RowAccessor> accessors = new ArrayList<>(groupBy.size());
            for (ColumnRef col : groupBy) {
                accessors.add(accessorFor(fact, col, context));
            }
            BitSet rows = session.rows(fact, context);
            for (int r = rows.nextSetBit(0); r >= 0; r = rows.nextSetBit(r + 1)) {
                List<Object> tuple = new ArrayList<>(accessors.size());
                for (RowAccessor accessor : accessors) {
                    tuple.add(Values.normalize(accessor.get(r)));
                }
                combos.add(tuple);
            }
        }

        List<ResultTable.Row> result = new ArrayList<>(combos.size());
        for (List<Object> combo : combos) {
            FilterContext cell = context;
            for (int i = 0; i < groupBy.size(); i++) {
                Object v = combo.get(i);
                cell = cell.with(groupBy.get(i), v == null ? Predicates.isNull() : Predicates.eq(v));
            }
            result.add(new ResultTable.Row(combo, session.evaluateMeasure(measureName, cell)));
        }

        List<String> names = new ArrayList<>(groupBy.size());
        groupBy.forEach(c -> names.add(c.toString()));
        return new ResultTable(names, measureName, result);
    }

    /**
     * 某列在上下文内出现过的取值（下钻候选），空值排在最后
     */
    public List<Object> distinctValues(EvaluationSession session, Collection<String> measureFacts,
                                       ColumnRef column, FilterContext context) {
        Set<Object> values = new TreeSet<>(Values.NULLS_LAST);
        boolean sawNull = false;
        for (String fact : reachingFacts(measureFacts, List.of(column))) {
            RowAccessor accessor = accessorFor(fact, column, context);
            BitSet rows = session.rows(fact, context);
            for (int r = rows.nextSetBit(0); r >= 0; r = rows.nextSetBit(r + 1)) {
                Object v = accessor.get(r);
                if (v == null) {
                    sawNull = true;
                } else {
                    values.add(Values.normalize(v));
                }
            }
        }
        List<Object> result = new ArrayList<>(values);
        if (sawNull) {
            result.add(null);
        }
        return result;
    }

    public List<String> reachingFacts(Collection<String> facts, List<ColumnRef> columns) {
        List<String> result = new ArrayList<>();
        for (String fact : facts) {
            boolean all = true;
            for (ColumnRef col : columns) {
                all &= model.canReach(fact, col);
            }
            if (all) result.add(fact);
        }
        return result;
    }

    private RowAccessor accessorFor(String fact, ColumnRef column, FilterContext context) {
        String selector = column.table().equals(fact)
                ? null
                : context.selectedRelationship(fact, column.table()).orElse(null);
        return model.accessor(fact, column, selector);
    }
}
