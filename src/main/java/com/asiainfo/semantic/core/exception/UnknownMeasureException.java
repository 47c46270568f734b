package com.asiainfo.semantic.core.exception;

/**
 * 度量不存在
 */
public class UnknownMeasureException extends SemanticModelException {

    private final String measureName;

    public UnknownMeasureException(String measureName) {
        super("Unknown measure: " + measureName);
        this.measureName = measureName;
    }

    public UnknownMeasureException(String measureName, String referencedBy) {
        super(String.format("Unknown measure [%s] referenced by [%s]", measureName, referencedBy));
        this.measureName = measureName;
    }

    public String getMeasureName() {
        return measureName;
    }

    @Override
    public String getUserFriendlyMessage() {
        return "度量不存在: " + measureName;
    }
}
