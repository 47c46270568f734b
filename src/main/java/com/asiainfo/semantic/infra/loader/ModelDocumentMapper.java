package com.asiainfo.semantic.infra.loader;

import com.asiainfo.semantic.core.SemanticModel;
import com.asiainfo.semantic.core.exception.SchemaException;
import com.asiainfo.semantic.core.model.ColumnDef;
import com.asiainfo.semantic.core.model.ColumnRef;
import com.asiainfo.semantic.core.model.DimensionTable;
import com.asiainfo.semantic.core.model.FactTable;
import com.asiainfo.semantic.core.model.ForeignKey;
import com.asiainfo.semantic.core.schema.SchemaRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * 模型文档 -> 语义模型快照
 */
final class ModelDocumentMapper {

    private ModelDocumentMapper() {}

    static SemanticModel toModel(ModelDocument doc, long version, long anchorCacheSize) {
        SchemaRegistry.Builder schema = SchemaRegistry.builder();
        SemanticModel.Builder model = SemanticModel.builder()
                .name(doc.name() == null ? "default" : doc.name())
                .version(version)
                .anchorCacheSize(anchorCacheSize);

        for (ModelDocument.TableDocument t : nullToEmpty(doc.dimensions())) {
            requireName(t);
            schema.dimension(new DimensionTable(t.name(), columns(t), t.primaryKey()));
            if (t.rows() != null) model.rows(t.name(), t.rows());
        }
        for (ModelDocument.TableDocument t : nullToEmpty(doc.facts())) {
            requireName(t);
            List<ForeignKey> fks = new ArrayList<>();
            for (ModelDocument.ForeignKeyDocument fk : nullToEmpty(t.foreignKeys())) {
                if (fk.column() == null || fk.references() == null) {
                    throw new SchemaException(t.name() + ": foreign key needs both column and references");
                }
                ColumnRef target = parseRef(t.name(), fk.references());
                fks.add(new ForeignKey(fk.column(), target.table(), target.column(), fk.id(),
                        fk.active() == null || fk.active()));
            }
            ColumnRef anchor = t.anchorColumn() == null ? null : parseRef(t.name(), t.anchorColumn());
            schema.fact(new FactTable(t.name(), columns(t), fks, anchor));
            if (t.rows() != null) model.rows(t.name(), t.rows());
        }

        return model.schema(schema.build())
                .measures(nullToEmpty(doc.measures()))
                .build();
    }

    private static List<ColumnDef> columns(ModelDocument.TableDocument t) {
        List<ColumnDef> result = new ArrayList<>();
        for (ModelDocument.ColumnDocument c : nullToEmpty(t.columns())) {
            boolean isPk = c.name() != null && c.name().equals(t.primaryKey());
            boolean nullable = c.nullable() != null ? c.nullable() : !isPk;
            boolean unique = c.unique() != null ? c.unique() : isPk;
            result.add(new ColumnDef(c.name(), c.type(), nullable, unique));
        }
        return result;
    }

    private static ColumnRef parseRef(String table, String text) {
        try {
            return ColumnRef.parse(text);
        } catch (IllegalArgumentException e) {
            throw new SchemaException(table + ": invalid column reference '" + text + "'", e);
        }
    }

    private static void requireName(ModelDocument.TableDocument t) {
        if (t.name() == null || t.name().isBlank()) {
            throw new SchemaException("Table without a name in model document");
        }
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
