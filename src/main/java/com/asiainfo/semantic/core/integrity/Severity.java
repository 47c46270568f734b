package com.asiainfo.semantic.core.integrity;

/**
 * 关系健康度
 */
public enum Severity {
    GREEN,
    YELLOW,
    RED
}
