package com.asiainfo.semantic.core.exception;

/**
 * 度量定义不合法（语法错误、引用了不存在的列、类型不匹配等）
 */
public class MeasureDefinitionException extends SemanticModelException {

    private final String measureName;

    public MeasureDefinitionException(String measureName, String message) {
        super(String.format("Invalid measure [%s]: %s", measureName, message));
        this.measureName = measureName;
    }

    public MeasureDefinitionException(String measureName, String message, Throwable cause) {
        super(String.format("Invalid measure [%s]: %s", measureName, message), cause);
        this.measureName = measureName;
    }

    public String getMeasureName() {
        return measureName;
    }
}
