package com.asiainfo.semantic.core.exception;

/**
 * 语义模型异常基类
 * 所有结构性错误（Schema、歧义关联、度量定义）都从这里派生，
 * 调用方可以统一捕获后通过 {@link #getUserFriendlyMessage()} 返回给前端。
 */
public class SemanticModelException extends RuntimeException {

    public SemanticModelException(String message) {
        super(message);
    }

    public SemanticModelException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getUserFriendlyMessage() {
        return getMessage();
    }
}
