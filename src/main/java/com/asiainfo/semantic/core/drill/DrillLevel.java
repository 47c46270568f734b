package com.asiainfo.semantic.core.drill;

import com.asiainfo.semantic.core.model.ColumnRef;

import java.util.List;

/**
 * 一次层级探索记录（包括失败的层与备选列的重试）
 *
 * @param candidates 按排名排序
 * @param alternate  是否为备选列重试
 */
public record DrillLevel(
    int depth,
    ColumnRef column,
    boolean alternate,
    List<DrillCandidate> candidates,
    LevelOutcome outcome
) {
    public DrillLevel {
        candidates = List.copyOf(candidates);
    }
}
