package com.asiainfo.semantic.api.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * 单列筛选条件
 *
 * @param column 列引用，形如 DimGeography[Region]
 * @param op     EQ / IN / BETWEEN / GE / GT / LE / LT / ISNULL，默认 IN
 */
@RegisterForReflection
public record FilterCondition(
    String column,
    String op,
    List<Object> values
) {}
