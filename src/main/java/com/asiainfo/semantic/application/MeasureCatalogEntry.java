package com.asiainfo.semantic.application;

import com.asiainfo.semantic.core.measure.Measure;
import com.asiainfo.semantic.core.measure.MeasureCategory;
import com.asiainfo.semantic.core.measure.MeasureType;
import com.asiainfo.semantic.core.model.ColumnRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 度量目录条目
 */
public record MeasureCatalogEntry(
    String name,
    MeasureType type,
    MeasureCategory category,
    String expression,
    String description,
    String formatString,
    List<String> dependsOn,
    List<String> columns,
    List<String> facts,
    boolean complex
) {
    static MeasureCatalogEntry of(Measure m, Set<String> facts) {
        List<String> columns = new ArrayList<>();
        for (ColumnRef c : m.columns()) {
            columns.add(c.toString());
        }
        columns.sort(null);
        return new MeasureCatalogEntry(m.name(), m.type(), m.category(), m.expression(), m.description(),
                m.formatString(), m.dependsOn(), columns, List.copyOf(facts), m.complex());
    }
}
