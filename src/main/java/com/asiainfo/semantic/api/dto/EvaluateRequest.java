package com.asiainfo.semantic.api.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * 单值与分组求值请求
 *
 * @param groupBy       分组列，单值求值时忽略
 * @param relationships 显式激活的关系标识（歧义关联时必填）
 */
@RegisterForReflection
public record EvaluateRequest(
    String measure,
    List<String> groupBy,
    List<FilterCondition> filters,
    List<String> relationships
) {}
