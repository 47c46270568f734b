package com.asiainfo.semantic.core.integrity;

import com.asiainfo.semantic.core.SemanticModel;
import com.asiainfo.semantic.core.engine.CancellationToken;
import com.asiainfo.semantic.core.model.ColumnDef;
import com.asiainfo.semantic.core.model.FactTable;
import com.asiainfo.semantic.core.model.Relationship;
import com.asiainfo.semantic.core.model.TableData;
import com.asiainfo.semantic.core.model.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 关系完整性检查
 * 统计空外键、孤儿行与键覆盖率。检查结果只是数据，不抛异常，也不会把孤儿行从查询中剔除
 * （孤儿行在分组时归入空值组）。
 */
public final class RelationshipIntegrityChecker {

    private static final Logger log = LoggerFactory.getLogger(RelationshipIntegrityChecker.class);

    private static final int SAMPLE_LIMIT = 5;
    private static final int CHECK_INTERVAL = 4096;

    private final SemanticModel model;
    private final IntegrityThresholds thresholds;

    public RelationshipIntegrityChecker(SemanticModel model, IntegrityThresholds thresholds) {
        this.model = model;
        this.thresholds = thresholds;
    }

    public IntegrityReport check(String fact, Relationship rel) {
        return check(fact, rel, CancellationToken.NONE);
    }

    public IntegrityReport check(String fact, Relationship rel, CancellationToken token) {
        if (!rel.factTable().equals(fact)) {
            throw new IllegalArgumentException(String.format("Relationship %s does not start at %s", rel.id(), fact));
        }
        TableData factData = model.data(fact);
        int fk = factData.columnIndex(rel.factColumn());
        Map<Object, Integer> dimKeys = model.data(rel.dimensionTable()).keyIndex(rel.dimensionColumn());

        int total = factData.rowCount();
        int nulls = 0;
        int orphanRows = 0;
        Set<Object> distinct = new HashSet<>();
        Set<Object> orphans = new LinkedHashSet<>();
        for (int r = 0; r < total; r++) {
            if (r % CHECK_INTERVAL == 0) {
                token.throwIfCancelled();
            }
            Object key = factData.value(r, fk);
            if (key == null) {
                nulls++;
                continue;
            }
            Object k = Values.normalize(key);
            distinct.add(k);
            if (!dimKeys.containsKey(k)) {
                orphanRows++;
                orphans.add(k);
            }
        }

        double blankRatio = total == 0 ? 0d : (double) nulls / total;
        double coverage = distinct.isEmpty() ? 1d : 1d - (double) orphans.size() / distinct.size();
        Severity severity = thresholds.classify(coverage, blankRatio);

        List<String> warnings = new ArrayList<>();
        ColumnDef factCol = model.schema().requireFact(fact).column(rel.factColumn()).orElseThrow();
        ColumnDef dimCol = model.schema().requireDimension(rel.dimensionTable()).column(rel.dimensionColumn()).orElseThrow();
        if (factCol.type() != dimCol.type()) {
            warnings.add(String.format("Key type mismatch: %s is %s but %s is %s",
                    rel.from(), factCol.type(), rel.to(), dimCol.type()));
        }
        if (orphanRows > 0) {
            warnings.add(String.format("%d rows reference %d keys missing from %s", orphanRows, orphans.size(), rel.to()));
        }
        if (nulls > 0) {
            warnings.add(String.format("%d rows have blank %s", nulls, rel.from()));
        }

        List<Object> sample = new ArrayList<>();
        for (Object o : orphans) {
            if (sample.size() == SAMPLE_LIMIT) break;
            sample.add(o);
        }

        return new IntegrityReport(rel.id(), fact, rel.factColumn(), rel.dimensionTable(), rel.dimensionColumn(),
                rel.active(), total, nulls, orphanRows, distinct.size(), orphans.size(),
                blankRatio, coverage, severity, sample, warnings);
    }

    /**
     * 检查事实表声明的全部关系
     */
    public List<IntegrityReport> checkAll(String fact) {
        return checkAll(fact, CancellationToken.NONE);
    }

    public List<IntegrityReport> checkAll(String fact, CancellationToken token) {
        model.schema().requireFact(fact);
        List<IntegrityReport> reports = new ArrayList<>();
        for (Relationship rel : model.graph().relationshipsOf(fact)) {
            reports.add(check(fact, rel, token));
        }
        return reports;
    }

    /**
     * 检查整个模型，并把非 GREEN 的结果写日志
     */
    public Map<String, List<IntegrityReport>> checkModel(CancellationToken token) {
        Map<String, List<IntegrityReport>> result = new LinkedHashMap<>();
        for (FactTable fact : model.schema().facts()) {
            List<IntegrityReport> reports = checkAll(fact.name(), token);
            result.put(fact.name(), reports);
            for (IntegrityReport report : reports) {
                if (report.severity() == Severity.GREEN) {
                    log.info("[Integrity] {} GREEN (rows={}, coverage={})",
                            report.relationshipId(), report.totalRows(), String.format("%.4f", report.coverage()));
                } else {
                    log.warn("[Integrity] {} {}: nulls={}, orphans={}, coverage={}, blankRatio={} {}",
                            report.relationshipId(), report.severity(), report.nullCount(), report.orphanCount(),
                            String.format("%.4f", report.coverage()), String.format("%.4f", report.blankRatio()),
                            report.warnings());
                }
            }
        }
        return result;
    }
}
