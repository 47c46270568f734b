package com.asiainfo.semantic.core.schema;

import com.asiainfo.semantic.core.exception.SchemaException;
import com.asiainfo.semantic.core.model.ColumnDef;
import com.asiainfo.semantic.core.model.ColumnRef;
import com.asiainfo.semantic.core.model.ColumnType;
import com.asiainfo.semantic.core.model.DimensionTable;
import com.asiainfo.semantic.core.model.FactTable;
import com.asiainfo.semantic.core.model.ForeignKey;
import com.asiainfo.semantic.core.model.TableSchema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Schema 注册表
 * 持有全部维度表、事实表定义；构建时完成结构校验，之后只读，可被任意并发查询共享。
 */
public final class SchemaRegistry {

    private final Map<String, DimensionTable> dimensions;
    private final Map<String, FactTable> facts;

    private SchemaRegistry(Map<String, DimensionTable> dimensions, Map<String, FactTable> facts) {
        this.dimensions = Collections.unmodifiableMap(dimensions);
        this.facts = Collections.unmodifiableMap(facts);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Collection<DimensionTable> dimensions() {
        return dimensions.values();
    }

    public Collection<FactTable> facts() {
        return facts.values();
    }

    public boolean isFact(String table) {
        return facts.containsKey(table);
    }

    public boolean isDimension(String table) {
        return dimensions.containsKey(table);
    }

    public Optional<TableSchema> table(String name) {
        TableSchema t = facts.get(name);
        return t != null ? Optional.of(t) : Optional.ofNullable(dimensions.get(name));
    }

    public TableSchema requireTable(String name) {
        return table(name).orElseThrow(() -> new SchemaException("Unknown table: " + name));
    }

    public FactTable requireFact(String name) {
        FactTable fact = facts.get(name);
        if (fact == null) {
            throw new SchemaException("Unknown fact table: " + name);
        }
        return fact;
    }

    public DimensionTable requireDimension(String name) {
        DimensionTable dim = dimensions.get(name);
        if (dim == null) {
            throw new SchemaException("Unknown dimension table: " + name);
        }
        return dim;
    }

    public ColumnDef requireColumn(ColumnRef ref) {
        return requireTable(ref.table()).column(ref.column())
                .orElseThrow(() -> new SchemaException("Unknown column: " + ref));
    }

    public Optional<ColumnDef> findColumn(ColumnRef ref) {
        return table(ref.table()).flatMap(t -> t.column(ref.column()));
    }

    public static final class Builder {
        private final List<DimensionTable> dimensions = new ArrayList<>();
        private final List<FactTable> facts = new ArrayList<>();

        public Builder dimension(DimensionTable table) {
            dimensions.add(table);
            return this;
        }

        public Builder fact(FactTable table) {
            facts.add(table);
            return this;
        }

        /**
         * 构建并校验
         *
         * @throws SchemaException 表名重复、列名重复、主键缺失或未声明唯一非空、外键目标不存在等
         */
        public SchemaRegistry build() {
            Map<String, DimensionTable> dims = new LinkedHashMap<>();
            Map<String, FactTable> factMap = new LinkedHashMap<>();
            Set<String> names = new HashSet<>();

            for (DimensionTable dim : dimensions) {
                requireName(dim.name(), names);
                validateColumns(dim);
                ColumnDef pk = dim.column(dim.primaryKey()).orElseThrow(() -> new SchemaException(
                        String.format("Dimension %s has no primary key column %s", dim.name(), dim.primaryKey())));
                if (!pk.unique() || pk.nullable()) {
                    throw new SchemaException(String.format(
                            "Primary key %s[%s] must be declared unique and non-null", dim.name(), pk.name()));
                }
                dims.put(dim.name(), dim);
            }
            for (FactTable fact : facts) {
                requireName(fact.name(), names);
                validateColumns(fact);
                factMap.put(fact.name(), fact);
            }
            for (FactTable fact : facts) {
                validateForeignKeys(fact, dims);
                validateAnchor(fact, dims);
            }
            return new SchemaRegistry(dims, factMap);
        }

        private static void requireName(String name, Set<String> names) {
            if (name == null || name.isBlank()) {
                throw new SchemaException("Table name must not be empty");
            }
            if (!names.add(name)) {
                throw new SchemaException("Duplicate table name: " + name);
            }
        }

        private static void validateColumns(TableSchema table) {
            if (table.columns().isEmpty()) {
                throw new SchemaException("Table " + table.name() + " has no columns");
            }
            Set<String> seen = new HashSet<>();
            for (ColumnDef col : table.columns()) {
                if (col.name() == null || col.name().isBlank() || col.type() == null) {
                    throw new SchemaException("Table " + table.name() + " has a column without name or type");
                }
                if (!seen.add(col.name())) {
                    throw new SchemaException("Duplicate column " + ColumnRef.of(table.name(), col.name()));
                }
            }
        }

        private static void validateForeignKeys(FactTable fact, Map<String, DimensionTable> dims) {
            for (ForeignKey fk : fact.foreignKeys()) {
                if (fact.column(fk.column()).isEmpty()) {
                    throw new SchemaException("Foreign key column not found: " + ColumnRef.of(fact.name(), fk.column()));
                }
                DimensionTable target = dims.get(fk.targetTable());
                if (target == null) {
                    throw new SchemaException(String.format("Foreign key %s references unknown dimension %s",
                            ColumnRef.of(fact.name(), fk.column()), fk.targetTable()));
                }
                ColumnDef targetCol = target.column(fk.targetColumn()).orElseThrow(() -> new SchemaException(
                        "Foreign key target column not found: " + ColumnRef.of(target.name(), fk.targetColumn())));
                // 多对一：目标列必须唯一
                if (!targetCol.unique()) {
                    throw new SchemaException(String.format("Foreign key target %s must be declared unique",
                            ColumnRef.of(target.name(), targetCol.name())));
                }
            }
        }

        private static void validateAnchor(FactTable fact, Map<String, DimensionTable> dims) {
            ColumnRef anchor = fact.anchorColumn();
            if (anchor == null) return;
            TableSchema owner;
            if (anchor.table().equals(fact.name())) {
                owner = fact;
            } else {
                owner = dims.get(anchor.table());
                boolean linked = fact.foreignKeys().stream().anyMatch(fk -> fk.targetTable().equals(anchor.table()));
                if (owner == null || !linked) {
                    throw new SchemaException(String.format(
                            "Anchor column %s of %s must belong to the fact or to a dimension it references",
                            anchor, fact.name()));
                }
            }
            ColumnDef col = owner.column(anchor.column())
                    .orElseThrow(() -> new SchemaException("Anchor column not found: " + anchor));
            if (col.type() != ColumnType.DATE) {
                throw new SchemaException("Anchor column " + anchor + " must be a DATE column");
            }
        }
    }
}
