package com.asiainfo.semantic.api.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;
import java.util.Map;

/**
 * 下钻请求，阈值为空时使用配置默认值
 */
@RegisterForReflection
public record DrillApiRequest(
    String measure,
    List<FilterCondition> filters,
    List<String> relationships,
    List<String> path,
    Double coverageThreshold,
    Integer minSample,
    Double marginalThreshold,
    Double goal,
    String direction,
    String mode,
    String sampleMeasure,
    Map<String, List<String>> fallbacks
) {}
