package com.asiainfo.semantic.core.measure;

import com.asiainfo.semantic.core.engine.EvaluationSession;
import com.asiainfo.semantic.core.filter.FilterContext;
import com.asiainfo.semantic.core.model.MeasureValue;
import com.asiainfo.semantic.core.model.Relationship;

import java.util.List;

/**
 * FILTERED(base, predicate...)：上下文转换
 * 以"外层上下文 ∩ 本节点谓词"构造新的上下文求值子节点，新增条件不会泄漏到兄弟节点。
 */
public record FilteredExpr(MeasureExpr child, List<ColumnFilter> filters, List<String> relationshipIds)
        implements MeasureExpr {

    public FilteredExpr {
        filters = List.copyOf(filters);
        relationshipIds = List.copyOf(relationshipIds);
    }

    @Override
    public MeasureValue evaluate(EvaluationSession session, FilterContext context) {
        FilterContext narrowed = context;
        for (ColumnFilter f : filters) {
            narrowed = narrowed.with(f.column(), f.predicate());
        }
        for (String id : relationshipIds) {
            Relationship rel = session.model().graph().relationship(id)
                    .orElseThrow(() -> new IllegalStateException("Relationship vanished from graph: " + id));
            narrowed = narrowed.useRelationship(rel);
        }
        return session.evaluate(child, narrowed);
    }

    @Override
    public List<MeasureExpr> children() {
        return List.of(child);
    }

    @Override
    public String toString() {
        return "FILTERED(" + child + ", " + filters + (relationshipIds.isEmpty() ? "" : ", use " + relationshipIds) + ")";
    }
}
