package com.asiainfo.semantic.core.exception;

import java.util.List;

/**
 * 歧义关联异常
 * 同一个 (事实表, 维度表) 存在多条关系时，必须显式指定使用哪一条
 */
public class AmbiguousJoinException extends SemanticModelException {

    private final String factTable;
    private final String dimensionTable;
    private final List<String> candidateColumns;

    public AmbiguousJoinException(String factTable, String dimensionTable, List<String> candidateColumns) {
        super(String.format("Ambiguous join from %s to %s: candidate key columns %s, select one relationship explicitly",
                factTable, dimensionTable, candidateColumns));
        this.factTable = factTable;
        this.dimensionTable = dimensionTable;
        this.candidateColumns = List.copyOf(candidateColumns);
    }

    public String getFactTable() {
        return factTable;
    }

    public String getDimensionTable() {
        return dimensionTable;
    }

    public List<String> getCandidateColumns() {
        return candidateColumns;
    }

    @Override
    public String getUserFriendlyMessage() {
        return String.format("%s 到 %s 存在多条关联路径（%s），请在查询中指定关系",
                factTable, dimensionTable, String.join(" / ", candidateColumns));
    }
}
