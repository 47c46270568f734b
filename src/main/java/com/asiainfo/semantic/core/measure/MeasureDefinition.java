package com.asiainfo.semantic.core.measure;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 度量定义（未编译的原始声明）
 *
 * @param type         可为空，为空时按表达式推断
 * @param formatString 展示格式，如 "0.0%"，仅透传
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MeasureDefinition(
    String name,
    MeasureType type,
    String expression,
    String description,
    String formatString
) {
    public static MeasureDefinition of(String name, String expression) {
        return new MeasureDefinition(name, null, expression, null, null);
    }
}
