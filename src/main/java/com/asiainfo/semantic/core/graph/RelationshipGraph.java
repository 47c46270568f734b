package com.asiainfo.semantic.core.graph;

import com.asiainfo.semantic.core.exception.AmbiguousJoinException;
import com.asiainfo.semantic.core.exception.SchemaException;
import com.asiainfo.semantic.core.exception.UnreachableDimensionException;
import com.asiainfo.semantic.core.filter.FilterContext;
import com.asiainfo.semantic.core.model.FactTable;
import com.asiainfo.semantic.core.model.ForeignKey;
import com.asiainfo.semantic.core.model.JoinKey;
import com.asiainfo.semantic.core.model.Relationship;
import com.asiainfo.semantic.core.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 关系图
 * 有向多对一边：事实表 -> 维度表，由 (事实列, 维度列) 唯一确定。
 * 同一 (事实表, 维度表) 存在多条边时标记为歧义，调用方必须显式选择关系，绝不静默挑选其中一条
 * （否则同一查询的结果会随加载顺序变化）。
 */
public final class RelationshipGraph {

    private static final Logger log = LoggerFactory.getLogger(RelationshipGraph.class);

    // 保持声明顺序，作为确定性的解析顺序
    private final Map<JoinKey, List<Relationship>> edges;
    private final Map<String, Relationship> byId;

    private RelationshipGraph(Map<JoinKey, List<Relationship>> edges, Map<String, Relationship> byId) {
        this.edges = edges;
        this.byId = byId;
    }

    /**
     * 从事实表外键声明构建关系图（模型加载时执行一次）
     */
    public static RelationshipGraph build(SchemaRegistry schema) {
        Map<JoinKey, List<Relationship>> edges = new LinkedHashMap<>();
        Map<String, Relationship> byId = new LinkedHashMap<>();

        for (FactTable fact : schema.facts()) {
            for (ForeignKey fk : fact.foreignKeys()) {
                String id = fk.relationshipId() == null || fk.relationshipId().isBlank()
                        ? Relationship.defaultId(fact.name(), fk.column(), fk.targetTable(), fk.targetColumn())
                        : fk.relationshipId();
                Relationship rel = new Relationship(id, fact.name(), fk.column(), fk.targetTable(),
                        fk.targetColumn(), fk.active());
                if (byId.putIfAbsent(id, rel) != null) {
                    throw new SchemaException("Duplicate relationship id: " + id);
                }
                edges.computeIfAbsent(rel.joinKey(), k -> new ArrayList<>()).add(rel);
            }
        }

        Map<JoinKey, List<Relationship>> frozen = new LinkedHashMap<>();
        for (Map.Entry<JoinKey, List<Relationship>> e : edges.entrySet()) {
            List<Relationship> candidates = e.getValue();
            long activeCount = candidates.stream().filter(Relationship::active).count();
            if (activeCount > 1) {
                throw new SchemaException(String.format("%s declares %d active relationships %s, at most one may be active",
                        e.getKey(), activeCount, columnsOf(candidates)));
            }
            if (candidates.size() > 1) {
                log.warn("[Graph] Ambiguous join {}: candidate columns {}", e.getKey(), columnsOf(candidates));
            }
            frozen.put(e.getKey(), List.copyOf(candidates));
        }
        return new RelationshipGraph(Collections.unmodifiableMap(frozen), Collections.unmodifiableMap(byId));
    }

    /**
     * 获取唯一的默认关系
     *
     * @throws AmbiguousJoinException        存在多条候选边
     * @throws UnreachableDimensionException 事实表与维度表之间没有关系
     */
    public Relationship activeRelationshipFor(String fact, String dimension) {
        List<Relationship> candidates = candidates(fact, dimension);
        if (candidates.isEmpty()) {
            throw new UnreachableDimensionException(
                    String.format("No relationship from %s to %s", fact, dimension));
        }
        if (candidates.size() > 1) {
            throw new AmbiguousJoinException(fact, dimension, columnsOf(candidates));
        }
        return candidates.get(0);
    }

    /**
     * 解析关联路径
     *
     * @param selector 关系标识或事实表列名；为空时等价于 {@link #activeRelationshipFor}
     */
    public Relationship resolveJoinPath(String fact, String dimension, String selector) {
        if (selector == null) {
            return activeRelationshipFor(fact, dimension);
        }
        for (Relationship rel : candidates(fact, dimension)) {
            if (rel.id().equals(selector) || rel.factColumn().equals(selector)) {
                return rel;
            }
        }
        throw new UnreachableDimensionException(String.format(
                "Relationship '%s' does not connect %s to %s", selector, fact, dimension));
    }

    /**
     * 按查询上下文中激活的关系解析关联路径
     */
    public Relationship resolveJoinPath(String fact, String dimension, FilterContext context) {
        return resolveJoinPath(fact, dimension, context.selectedRelationship(fact, dimension).orElse(null));
    }

    public List<Relationship> candidates(String fact, String dimension) {
        return edges.getOrDefault(new JoinKey(fact, dimension), List.of());
    }

    public boolean reaches(String fact, String dimension) {
        return edges.containsKey(new JoinKey(fact, dimension));
    }

    public boolean isAmbiguous(String fact, String dimension) {
        return candidates(fact, dimension).size() > 1;
    }

    public Set<JoinKey> ambiguousPairs() {
        Set<JoinKey> result = new LinkedHashSet<>();
        edges.forEach((k, v) -> {
            if (v.size() > 1) result.add(k);
        });
        return result;
    }

    public Optional<Relationship> relationship(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public List<Relationship> relationships() {
        return List.copyOf(byId.values());
    }

    public List<Relationship> relationshipsOf(String fact) {
        List<Relationship> result = new ArrayList<>();
        for (Relationship rel : byId.values()) {
            if (rel.factTable().equals(fact)) result.add(rel);
        }
        return result;
    }

    /**
     * 事实表可到达的维度表，按声明顺序
     */
    public List<String> resolutionOrder(String fact) {
        List<String> result = new ArrayList<>();
        for (JoinKey key : edges.keySet()) {
            if (key.factTable().equals(fact)) result.add(key.dimensionTable());
        }
        return result;
    }

    private static List<String> columnsOf(List<Relationship> candidates) {
        List<String> cols = new ArrayList<>(candidates.size());
        for (Relationship r : candidates) {
            cols.add(r.factColumn() + " -> " + r.dimensionColumn());
        }
        return cols;
    }
}
