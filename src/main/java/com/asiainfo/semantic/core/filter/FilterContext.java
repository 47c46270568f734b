package com.asiainfo.semantic.core.filter;

import com.asiainfo.semantic.core.model.ColumnRef;
import com.asiainfo.semantic.core.model.JoinKey;
import com.asiainfo.semantic.core.model.Relationship;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 筛选上下文（不可变）
 * 由 (表, 列) -> 谓词 的映射，以及本次查询显式激活的关系组成。
 * 每次收窄都会返回新实例，兄弟节点之间不会互相泄漏筛选条件。
 */
public final class FilterContext {

    private static final FilterContext EMPTY = new FilterContext(Map.of(), Map.of());

    private final Map<ColumnRef, ColumnPredicate> predicates;
    private final Map<JoinKey, String> relationshipSelections;

    private FilterContext(Map<ColumnRef, ColumnPredicate> predicates, Map<JoinKey, String> relationshipSelections) {
        this.predicates = predicates;
        this.relationshipSelections = relationshipSelections;
    }

    public static FilterContext empty() {
        return EMPTY;
    }

    public static FilterContext of(ColumnRef column, ColumnPredicate predicate) {
        return EMPTY.with(column, predicate);
    }

    /**
     * 与单列谓词取交集
     */
    public FilterContext with(ColumnRef column, ColumnPredicate predicate) {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(predicate, "predicate");
        Map<ColumnRef, ColumnPredicate> next = new LinkedHashMap<>(predicates);
        next.merge(column, predicate, ColumnPredicate::intersect);
        return new FilterContext(Collections.unmodifiableMap(next), relationshipSelections);
    }

    /**
     * 与另一个上下文取交集；关系选择以 other 为准（内层覆盖外层）
     */
    public FilterContext intersect(FilterContext other) {
        if (other.predicates.isEmpty() && other.relationshipSelections.isEmpty()) {
            return this;
        }
        Map<ColumnRef, ColumnPredicate> next = new LinkedHashMap<>(predicates);
        other.predicates.forEach((col, p) -> next.merge(col, p, ColumnPredicate::intersect));
        Map<JoinKey, String> selections = new LinkedHashMap<>(relationshipSelections);
        selections.putAll(other.relationshipSelections);
        return new FilterContext(Collections.unmodifiableMap(next), Collections.unmodifiableMap(selections));
    }

    /**
     * 显式激活一条关系（用于歧义关联）
     */
    public FilterContext useRelationship(Relationship relationship) {
        return useRelationship(relationship.factTable(), relationship.dimensionTable(), relationship.id());
    }

    public FilterContext useRelationship(String fact, String dimension, String relationshipId) {
        Map<JoinKey, String> selections = new LinkedHashMap<>(relationshipSelections);
        selections.put(new JoinKey(fact, dimension), relationshipId);
        return new FilterContext(predicates, Collections.unmodifiableMap(selections));
    }

    public Optional<ColumnPredicate> predicate(ColumnRef column) {
        return Optional.ofNullable(predicates.get(column));
    }

    public Map<ColumnRef, ColumnPredicate> predicates() {
        return predicates;
    }

    public Optional<String> selectedRelationship(String fact, String dimension) {
        return Optional.ofNullable(relationshipSelections.get(new JoinKey(fact, dimension)));
    }

    public Map<JoinKey, String> relationshipSelections() {
        return relationshipSelections;
    }

    /**
     * 任一列谓词为空集
     */
    public boolean isUnsatisfiable() {
        return predicates.values().stream().anyMatch(ColumnPredicate::isUnsatisfiable);
    }

    public boolean isEmpty() {
        return predicates.isEmpty() && relationshipSelections.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterContext)) return false;
        FilterContext that = (FilterContext) o;
        return predicates.equals(that.predicates) && relationshipSelections.equals(that.relationshipSelections);
    }

    @Override
    public int hashCode() {
        return Objects.hash(predicates, relationshipSelections);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("FilterContext{");
        predicates.forEach((col, p) -> sb.append(col).append(' ').append(p).append("; "));
        if (!relationshipSelections.isEmpty()) {
            sb.append("use=").append(relationshipSelections.values());
        }
        return sb.append('}').toString();
    }
}
