package com.asiainfo.semantic.core.integrity;

import com.asiainfo.semantic.core.SemanticModel;
import com.asiainfo.semantic.core.exception.AmbiguousJoinException;
import com.asiainfo.semantic.core.measure.Measure;
import com.asiainfo.semantic.core.model.ColumnDef;
import com.asiainfo.semantic.core.model.FactTable;
import com.asiainfo.semantic.core.model.JoinKey;
import com.asiainfo.semantic.core.model.Relationship;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 模型静态检查：双键关联、缺少锚点、键类型不一致、复杂度量
 */
public final class ModelLinter {

    private ModelLinter() {}

    public static List<LintWarning> lint(SemanticModel model) {
        List<LintWarning> warnings = new ArrayList<>();

        for (JoinKey pair : model.graph().ambiguousPairs()) {
            String columns = model.graph().candidates(pair.factTable(), pair.dimensionTable()).stream()
                    .map(Relationship::factColumn)
                    .collect(Collectors.joining(", "));
            warnings.add(new LintWarning("DUAL_KEY", pair.toString(), String.format(
                    "%s joins %s through %s; queries must pick one explicitly. Consider a single surrogate key.",
                    pair.factTable(), pair.dimensionTable(), columns)));
        }

        for (FactTable fact : model.schema().facts()) {
            try {
                if (model.anchors().findAnchor(fact.name()).isEmpty()) {
                    warnings.add(new LintWarning("NO_ANCHOR", fact.name(),
                            fact.name() + " has no usable anchor date; relative windows evaluate to no value"));
                }
            } catch (AmbiguousJoinException e) {
                warnings.add(new LintWarning("NO_ANCHOR", fact.name(),
                        "Anchor column is reached through an ambiguous join: " + e.getMessage()));
            }
        }

        for (Relationship rel : model.graph().relationships()) {
            ColumnDef from = model.schema().requireColumn(rel.from());
            ColumnDef to = model.schema().requireColumn(rel.to());
            if (from.type() != to.type()) {
                warnings.add(new LintWarning("KEY_TYPE_MISMATCH", rel.id(),
                        String.format("%s is %s but %s is %s", rel.from(), from.type(), rel.to(), to.type())));
            }
        }

        for (Measure m : model.measures().all()) {
            if (m.complex()) {
                warnings.add(new LintWarning("COMPLEX_MEASURE", m.name(),
                        "Expression is long or deeply nested, consider splitting it into named measures"));
            }
        }
        return warnings;
    }
}
