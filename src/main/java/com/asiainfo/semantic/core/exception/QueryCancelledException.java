package com.asiainfo.semantic.core.exception;

/**
 * 查询被取消或超时，部分聚合结果已丢弃
 */
public class QueryCancelledException extends SemanticModelException {

    public QueryCancelledException(String message) {
        super(message);
    }

    @Override
    public String getUserFriendlyMessage() {
        return "查询超时或已取消: " + getMessage();
    }
}
