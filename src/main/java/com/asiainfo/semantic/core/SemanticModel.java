package com.asiainfo.semantic.core;

import com.asiainfo.semantic.core.anchor.AnchorDateResolver;
import com.asiainfo.semantic.core.engine.RowAccessor;
import com.asiainfo.semantic.core.exception.SchemaException;
import com.asiainfo.semantic.core.exception.UnreachableDimensionException;
import com.asiainfo.semantic.core.graph.RelationshipGraph;
import com.asiainfo.semantic.core.measure.MeasureDefinition;
import com.asiainfo.semantic.core.measure.MeasureRegistry;
import com.asiainfo.semantic.core.model.ColumnRef;
import com.asiainfo.semantic.core.model.Relationship;
import com.asiainfo.semantic.core.model.TableData;
import com.asiainfo.semantic.core.model.TableSchema;
import com.asiainfo.semantic.core.model.Values;
import com.asiainfo.semantic.core.schema.SchemaRegistry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 语义模型快照（不可变）
 * 包含表结构、关系图、表数据、已编译度量与锚点解析器。查询期间无锁共享，
 * 重新加载时整体替换，进行中的查询继续使用旧快照。
 */
public final class SemanticModel {

    private final String name;
    private final long version;
    private final Instant loadedAt;
    private final SchemaRegistry schema;
    private final RelationshipGraph graph;
    private final Map<String, TableData> data;
    private final MeasureRegistry measures;
    private final AnchorDateResolver anchors;

    private SemanticModel(Builder b, RelationshipGraph graph, Map<String, TableData> data, MeasureRegistry measures) {
        this.name = b.name;
        this.version = b.version;
        this.loadedAt = Instant.now();
        this.schema = b.schema;
        this.graph = graph;
        this.data = data;
        this.measures = measures;
        this.anchors = new AnchorDateResolver(this, b.anchorCacheSize);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String name() {
        return name;
    }

    public long version() {
        return version;
    }

    public Instant loadedAt() {
        return loadedAt;
    }

    public SchemaRegistry schema() {
        return schema;
    }

    public RelationshipGraph graph() {
        return graph;
    }

    public MeasureRegistry measures() {
        return measures;
    }

    public AnchorDateResolver anchors() {
        return anchors;
    }

    public TableData data(String table) {
        TableData d = data.get(table);
        if (d == null) {
            throw new SchemaException("Unknown table: " + table);
        }
        return d;
    }

    public int rowCount(String table) {
        return data(table).rowCount();
    }

    /**
     * 列能否从事实表行读取：列在事实表自身上，或位于事实表有关系边指向的维度表上
     */
    public boolean canReach(String fact, ColumnRef column) {
        if (column.table().equals(fact)) {
            return true;
        }
        return schema.isDimension(column.table()) && graph.reaches(fact, column.table());
    }

    /**
     * 构造按事实行号读取列值的访问器
     *
     * @param selector 维度列时使用的关系（关系标识或事实列名），为空时要求关系唯一
     */
    public RowAccessor accessor(String fact, ColumnRef column, String selector) {
        TableData factData = data(fact);
        if (column.table().equals(fact)) {
            int idx = factData.columnIndex(column.column());
            return row -> factData.value(row, idx);
        }
        if (!schema.isDimension(column.table())) {
            throw new UnreachableDimensionException(String.format("%s is not reachable from %s", column, fact));
        }
        Relationship rel = graph.resolveJoinPath(fact, column.table(), selector);
        int fk = factData.columnIndex(rel.factColumn());
        TableData dim = data(rel.dimensionTable());
        Map<Object, Integer> keys = dim.keyIndex(rel.dimensionColumn());
        int target = dim.columnIndex(column.column());
        return row -> {
            Object key = factData.value(row, fk);
            if (key == null) {
                return null;
            }
            Integer dimRow = keys.get(Values.normalize(key));
            return dimRow == null ? null : dim.value(dimRow, target);
        };
    }

    /**
     * 各事实表行数（模型概要用）
     */
    public Map<String, Integer> factRowCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        schema.facts().forEach(f -> counts.put(f.name(), rowCount(f.name())));
        return counts;
    }

    @Override
    public String toString() {
        return String.format("SemanticModel{name=%s, version=%d, facts=%d, dimensions=%d, measures=%d}",
                name, version, schema.facts().size(), schema.dimensions().size(), measures.size());
    }

    public static final class Builder {
        private String name = "default";
        private long version = 1L;
        private SchemaRegistry schema;
        private final Map<String, List<? extends List<?>>> rows = new LinkedHashMap<>();
        private final List<MeasureDefinition> measures = new ArrayList<>();
        private long anchorCacheSize = 256;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder schema(SchemaRegistry schema) {
            this.schema = schema;
            return this;
        }

        public Builder rows(String table, List<? extends List<?>> tableRows) {
            this.rows.put(table, tableRows);
            return this;
        }

        public Builder measure(MeasureDefinition definition) {
            this.measures.add(definition);
            return this;
        }

        public Builder measures(List<MeasureDefinition> definitions) {
            this.measures.addAll(definitions);
            return this;
        }

        public Builder anchorCacheSize(long size) {
            this.anchorCacheSize = size;
            return this;
        }

        /**
         * 构建快照：建立关系图、转换并校验表数据、编译度量
         *
         * @throws SchemaException 结构或数据不合法
         */
        public SemanticModel build() {
            if (schema == null) {
                throw new SchemaException("Schema is required");
            }
            for (String table : rows.keySet()) {
                if (schema.table(table).isEmpty()) {
                    throw new SchemaException("Rows supplied for unknown table: " + table);
                }
            }
            RelationshipGraph graph = RelationshipGraph.build(schema);

            Map<String, TableData> data = new LinkedHashMap<>();
            List<TableSchema> tables = new ArrayList<>(schema.dimensions());
            tables.addAll(schema.facts());
            for (TableSchema table : tables) {
                List<? extends List<?>> tableRows = rows.get(table.name());
                data.put(table.name(), tableRows == null ? TableData.empty(table) : TableData.of(table, tableRows));
            }

            MeasureRegistry registry = MeasureRegistry.compile(measures, schema, graph);
            return new SemanticModel(this, graph, Collections.unmodifiableMap(data), registry);
        }
    }
}
