package com.asiainfo.semantic.api.dto;

import com.asiainfo.semantic.core.SemanticModel;
import com.asiainfo.semantic.core.exception.SemanticModelException;
import com.asiainfo.semantic.core.filter.ColumnPredicate;
import com.asiainfo.semantic.core.filter.FilterContext;
import com.asiainfo.semantic.core.filter.Predicates;
import com.asiainfo.semantic.core.model.ColumnRef;
import com.asiainfo.semantic.core.model.ColumnType;
import com.asiainfo.semantic.core.model.Relationship;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 请求参数 -> 筛选上下文
 */
public final class FilterContextMapper {

    private FilterContextMapper() {}

    public static FilterContext toContext(SemanticModel model, List<FilterCondition> filters, List<String> relationships) {
        FilterContext context = FilterContext.empty();
        if (filters != null) {
            for (FilterCondition f : filters) {
                ColumnRef column = columnRef(f.column());
                ColumnType type = model.schema().requireColumn(column).type();
                context = context.with(column, predicate(f, type));
            }
        }
        if (relationships != null) {
            for (String id : relationships) {
                Relationship rel = model.graph().relationship(id)
                        .orElseThrow(() -> new SemanticModelException("Unknown relationship: " + id));
                context = context.useRelationship(rel);
            }
        }
        return context;
    }

    public static List<ColumnRef> columnRefs(List<String> columns) {
        List<ColumnRef> result = new ArrayList<>();
        if (columns != null) {
            for (String c : columns) {
                result.add(columnRef(c));
            }
        }
        return result;
    }

    public static ColumnRef columnRef(String text) {
        try {
            return ColumnRef.parse(text);
        } catch (IllegalArgumentException e) {
            throw new SemanticModelException(e.getMessage(), e);
        }
    }

    private static ColumnPredicate predicate(FilterCondition f, ColumnType type) {
        String op = f.op() == null ? "IN" : f.op().toUpperCase(Locale.ROOT);
        List<Object> values = f.values() == null ? List.of() : f.values();
        ColumnPredicate predicate;
        switch (op) {
            case "EQ":
            case "IN":
                predicate = Predicates.in(values);
                break;
            case "ISNULL":
                return Predicates.isNull();
            case "BETWEEN":
                requireArity(f, 2);
                predicate = Predicates.between(values.get(0), values.get(1));
                break;
            case "GE":
                requireArity(f, 1);
                predicate = Predicates.atLeast(values.get(0));
                break;
            case "GT":
                requireArity(f, 1);
                predicate = Predicates.greaterThan(values.get(0));
                break;
            case "LE":
                requireArity(f, 1);
                predicate = Predicates.atMost(values.get(0));
                break;
            case "LT":
                requireArity(f, 1);
                predicate = Predicates.lessThan(values.get(0));
                break;
            default:
                throw new SemanticModelException("Unsupported filter operator: " + f.op());
        }
        try {
            return predicate.coerce(type);
        } catch (IllegalArgumentException e) {
            throw new SemanticModelException(f.column() + ": " + e.getMessage(), e);
        }
    }

    private static void requireArity(FilterCondition f, int n) {
        if (f.values() == null || f.values().size() != n) {
            throw new SemanticModelException(String.format("%s %s expects %d value(s)", f.column(), f.op(), n));
        }
    }
}
