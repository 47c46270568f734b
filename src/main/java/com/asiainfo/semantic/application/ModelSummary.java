package com.asiainfo.semantic.application;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 模型概要
 */
public record ModelSummary(
    String name,
    long version,
    Instant loadedAt,
    Map<String, Integer> factRowCounts,
    Map<String, Integer> dimensionRowCounts,
    int relationships,
    List<String> ambiguousPairs,
    int measures
) {}
