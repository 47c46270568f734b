package com.asiainfo.semantic.core.integrity;

/**
 * 模型检查提示
 *
 * @param code    DUAL_KEY / NO_ANCHOR / KEY_TYPE_MISMATCH / COMPLEX_MEASURE
 * @param subject 涉及的表、关系或度量
 */
public record LintWarning(String code, String subject, String message) {}
