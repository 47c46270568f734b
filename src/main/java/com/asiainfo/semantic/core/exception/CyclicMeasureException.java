package com.asiainfo.semantic.core.exception;

import java.util.List;

/**
 * 度量循环引用（注册期检测）
 */
public class CyclicMeasureException extends SemanticModelException {

    private final List<String> cycle;

    public CyclicMeasureException(List<String> cycle) {
        super("Detected circular measure dependency: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }

    @Override
    public String getUserFriendlyMessage() {
        return "度量存在循环引用: " + String.join(" -> ", cycle);
    }
}
