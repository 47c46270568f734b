package com.asiainfo.semantic.core.exception;

/**
 * 分组列或指定关系无法从事实表到达
 */
public class UnreachableDimensionException extends SemanticModelException {

    public UnreachableDimensionException(String message) {
        super(message);
    }
}
