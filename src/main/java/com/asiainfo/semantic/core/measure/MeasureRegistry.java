package com.asiainfo.semantic.core.measure;

import com.asiainfo.semantic.core.exception.CyclicMeasureException;
import com.asiainfo.semantic.core.exception.MeasureDefinitionException;
import com.asiainfo.semantic.core.exception.UnknownMeasureException;
import com.asiainfo.semantic.core.graph.RelationshipGraph;
import com.asiainfo.semantic.core.model.ColumnRef;
import com.asiainfo.semantic.core.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 度量注册表
 * 加载时一次性编译全部定义：解析表达式、校验引用、检测循环依赖。
 * 任一定义不合法则整个注册表构建失败，不存在"部分可用"的模型。
 */
public final class MeasureRegistry {

    private static final Logger log = LoggerFactory.getLogger(MeasureRegistry.class);

    private static final int COMPLEX_LENGTH = 200;
    private static final int COMPLEX_NESTING = 5;

    private final Map<String, Measure> measures;
    private final Map<String, Set<String>> factsByMeasure = new HashMap<>();

    private MeasureRegistry(Map<String, Measure> measures) {
        this.measures = measures;
        for (String name : measures.keySet()) {
            factsByMeasure.put(name, Collections.unmodifiableSet(computeFacts(measures.get(name).expr())));
        }
    }

    public static MeasureRegistry compile(Collection<MeasureDefinition> definitions,
                                          SchemaRegistry schema, RelationshipGraph graph) {
        Map<String, MeasureExpr> parsed = new LinkedHashMap<>();
        Map<String, MeasureDefinition> defs = new LinkedHashMap<>();
        for (MeasureDefinition def : definitions) {
            if (def.name() == null || def.name().isBlank()) {
                throw new MeasureDefinitionException(String.valueOf(def.name()), "measure name is required");
            }
            if (defs.putIfAbsent(def.name(), def) != null) {
                throw new MeasureDefinitionException(def.name(), "duplicate measure name");
            }
            parsed.put(def.name(), MeasureExpressionParser.parse(def.name(), def.expression(), schema, graph));
        }

        // 引用校验
        Map<String, List<String>> deps = new LinkedHashMap<>();
        for (Map.Entry<String, MeasureExpr> e : parsed.entrySet()) {
            List<String> refs = new ArrayList<>(references(e.getValue()));
            for (String ref : refs) {
                if (!parsed.containsKey(ref)) {
                    throw new UnknownMeasureException(ref, e.getKey());
                }
            }
            deps.put(e.getKey(), refs);
        }

        detectCycles(deps);

        Map<String, Measure> compiled = new LinkedHashMap<>();
        for (Map.Entry<String, MeasureExpr> e : parsed.entrySet()) {
            MeasureDefinition def = defs.get(e.getKey());
            MeasureExpr expr = e.getValue();
            Set<ColumnRef> columns = new LinkedHashSet<>();
            collectColumns(expr, columns);
            compiled.put(def.name(), new Measure(
                    def.name(),
                    def.type() != null ? def.type() : MeasureType.infer(expr),
                    expr,
                    def.expression(),
                    def.description(),
                    def.formatString(),
                    MeasureCategory.of(expr),
                    deps.get(def.name()),
                    columns,
                    isComplex(def.expression())));
        }
        log.info("[Measure] Compiled {} measures", compiled.size());
        return new MeasureRegistry(Collections.unmodifiableMap(compiled));
    }

    public Measure require(String name) {
        Measure m = measures.get(name);
        if (m == null) {
            throw new UnknownMeasureException(name);
        }
        return m;
    }

    public Optional<Measure> find(String name) {
        return Optional.ofNullable(measures.get(name));
    }

    public boolean contains(String name) {
        return measures.containsKey(name);
    }

    public Collection<Measure> all() {
        return measures.values();
    }

    public int size() {
        return measures.size();
    }

    /**
     * 度量最终聚合的事实表（展开引用），按首次出现顺序
     */
    public Set<String> factsOf(String measureName) {
        Set<String> facts = factsByMeasure.get(measureName);
        if (facts == null) {
            throw new UnknownMeasureException(measureName);
        }
        return facts;
    }

    public Set<String> factsOf(MeasureExpr expr) {
        if (expr instanceof MeasureRefExpr ref) {
            return factsOf(ref.name());
        }
        return computeFacts(expr);
    }

    /**
     * 依赖该度量的度量（直接或间接）
     */
    public Set<String> dependents(String measureName) {
        require(measureName);
        Set<String> result = new LinkedHashSet<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Measure m : measures.values()) {
                if (result.contains(m.name())) continue;
                for (String dep : m.dependsOn()) {
                    if (dep.equals(measureName) || result.contains(dep)) {
                        result.add(m.name());
                        changed = true;
                        break;
                    }
                }
            }
        }
        return result;
    }

    private Set<String> computeFacts(MeasureExpr expr) {
        Set<String> facts = new LinkedHashSet<>();
        collectFacts(expr, facts);
        return facts;
    }

    private void collectFacts(MeasureExpr expr, Set<String> facts) {
        if (expr instanceof AggregateExpr a) {
            facts.add(a.table());
        } else if (expr instanceof PercentileExpr p) {
            facts.add(p.table());
        } else if (expr instanceof MeasureRefExpr ref) {
            Set<String> cached = factsByMeasure.get(ref.name());
            if (cached != null) {
                facts.addAll(cached);
            } else {
                collectFacts(measures.get(ref.name()).expr(), facts);
            }
        }
        for (MeasureExpr child : expr.children()) {
            collectFacts(child, facts);
        }
    }

    private static Set<String> references(MeasureExpr expr) {
        Set<String> refs = new LinkedHashSet<>();
        collectReferences(expr, refs);
        return refs;
    }

    private static void collectReferences(MeasureExpr expr, Set<String> refs) {
        if (expr instanceof MeasureRefExpr ref) {
            refs.add(ref.name());
        }
        for (MeasureExpr child : expr.children()) {
            collectReferences(child, refs);
        }
    }

    private static void collectColumns(MeasureExpr expr, Set<ColumnRef> columns) {
        if (expr instanceof AggregateExpr a && a.column() != null) {
            columns.add(a.columnRef());
        } else if (expr instanceof PercentileExpr p) {
            columns.add(p.columnRef());
        } else if (expr instanceof FilteredExpr f) {
            f.filters().forEach(cf -> columns.add(cf.column()));
        } else if (expr instanceof LastNDaysExpr l) {
            columns.add(l.dateColumn());
        }
        for (MeasureExpr child : expr.children()) {
            collectColumns(child, columns);
        }
    }

    /**
     * 三色 DFS 检测循环依赖，报告完整环路径（首尾相同）
     */
    private static void detectCycles(Map<String, List<String>> deps) {
        Set<String> done = new HashSet<>();
        for (String name : deps.keySet()) {
            visit(name, deps, new ArrayList<>(), new HashSet<>(), done);
        }
    }

    private static void visit(String name, Map<String, List<String>> deps,
                              List<String> path, Set<String> onPath, Set<String> done) {
        if (done.contains(name)) {
            return;
        }
        if (onPath.contains(name)) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(name), path.size()));
            cycle.add(name);
            log.error("[Measure] Circular dependency detected: {}", cycle);
            throw new CyclicMeasureException(cycle);
        }
        path.add(name);
        onPath.add(name);
        for (String dep : deps.getOrDefault(name, List.of())) {
            visit(dep, deps, path, onPath, done);
        }
        path.remove(path.size() - 1);
        onPath.remove(name);
        done.add(name);
    }

    private static boolean isComplex(String expression) {
        if (expression == null) return false;
        if (expression.length() > COMPLEX_LENGTH) return true;
        return expression.chars().filter(c -> c == '(').count() > COMPLEX_NESTING;
    }
}
