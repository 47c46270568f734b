package com.asiainfo.semantic.core.integrity;

import java.util.List;

/**
 * 单条关系的完整性报告（只读诊断，不影响查询）
 *
 * @param nullCount     外键为空的事实行数
 * @param orphanCount   外键非空但在维度表找不到的事实行数
 * @param distinctKeys  非空外键的不同取值数
 * @param orphanKeys    找不到维度行的不同外键取值数
 * @param blankRatio    nullCount / totalRows
 * @param coverage      1 - orphanKeys / distinctKeys，没有非空外键时为 1
 * @param sampleOrphans 部分孤儿键，便于排查
 */
public record IntegrityReport(
    String relationshipId,
    String factTable,
    String factColumn,
    String dimensionTable,
    String dimensionColumn,
    boolean active,
    int totalRows,
    int nullCount,
    int orphanCount,
    int distinctKeys,
    int orphanKeys,
    double blankRatio,
    double coverage,
    Severity severity,
    List<Object> sampleOrphans,
    List<String> warnings
) {
    public IntegrityReport {
        sampleOrphans = List.copyOf(sampleOrphans);
        warnings = List.copyOf(warnings);
    }

    public boolean isClean() {
        return nullCount == 0 && orphanCount == 0;
    }
}
