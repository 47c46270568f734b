package com.asiainfo.semantic.core.exception;

/**
 * Schema 定义错误（加载期致命）
 * 如：主键缺失、表名重复、声明唯一的列存在重复值
 */
public class SchemaException extends SemanticModelException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getUserFriendlyMessage() {
        return "模型定义错误: " + getMessage();
    }
}
