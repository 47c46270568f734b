package com.asiainfo.semantic.core.model;

/**
 * (事实表, 维度表) 二元组
 */
public record JoinKey(String factTable, String dimensionTable) {

    @Override
    public String toString() {
        return factTable + " -> " + dimensionTable;
    }
}
