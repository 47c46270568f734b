package com.asiainfo.semantic.core.measure;

import com.asiainfo.semantic.core.anchor.DateWindow;
import com.asiainfo.semantic.core.engine.EvaluationSession;
import com.asiainfo.semantic.core.filter.FilterContext;
import com.asiainfo.semantic.core.model.ColumnRef;
import com.asiainfo.semantic.core.model.MeasureValue;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * LASTNDAYS(base, dateColumn, N)：以事实表锚点日期为"今天"，把日期列收窄到 [anchor - N, anchor]
 * 锚点缺失时返回 NO_VALUE（空窗口），不抛异常。
 */
public record LastNDaysExpr(MeasureExpr child, ColumnRef dateColumn, int days) implements MeasureExpr {

    @Override
    public MeasureValue evaluate(EvaluationSession session, FilterContext context) {
        String fact = anchorFact(session);
        String selector = dateColumn.table().equals(fact)
                ? null
                : context.selectedRelationship(fact, dateColumn.table()).orElse(null);
        Optional<LocalDate> anchor = session.model().anchors().findAnchor(fact, dateColumn, selector);
        if (anchor.isEmpty()) {
            return MeasureValue.NO_VALUE;
        }
        DateWindow window = DateWindow.lastDays(anchor.get(), days);
        return session.evaluate(child, context.with(dateColumn, window.toPredicate()));
    }

    /**
     * 锚点所属事实表：日期列就在事实表上时取该表，否则取子表达式中第一个能关联到日期维度的事实表
     */
    private String anchorFact(EvaluationSession session) {
        if (session.model().schema().isFact(dateColumn.table())) {
            return dateColumn.table();
        }
        for (String fact : session.measures().factsOf(child)) {
            if (session.model().graph().reaches(fact, dateColumn.table())) {
                return fact;
            }
        }
        throw new IllegalStateException("No fact of " + child + " reaches " + dateColumn);
    }

    @Override
    public List<MeasureExpr> children() {
        return List.of(child);
    }

    @Override
    public String toString() {
        return "LASTNDAYS(" + child + ", " + dateColumn + ", " + days + ")";
    }
}
