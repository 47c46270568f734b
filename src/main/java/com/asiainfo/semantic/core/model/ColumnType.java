package com.asiainfo.semantic.core.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * 列的语义类型
 * KEY: 整数键（也接受文本键，如 QueueID）
 * TEXT: 文本属性
 * DATE: 日期
 * NUMERIC: 可参与聚合的数值
 */
public enum ColumnType {
    KEY,
    TEXT,
    DATE,
    NUMERIC;

    private static final DateTimeFormatter COMPACT_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    /**
     * 把原始值（JSON 解析结果或表达式字面量）转换为列类型对应的 Java 值
     */
    public Object coerce(Object raw) {
        if (raw == null) {
            return null;
        }
        switch (this) {
            case KEY:
                if (raw instanceof Number) {
                    return Values.normalize(raw);
                }
                String key = raw.toString();
                return key.matches("-?\\d{1,18}") ? Long.parseLong(key) : key;
            case TEXT:
                return raw.toString();
            case DATE:
                return toDate(raw);
            case NUMERIC:
                if (raw instanceof Number) {
                    return Values.normalize(raw);
                }
                try {
                    return Values.normalize(Double.parseDouble(raw.toString().trim()));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Not a numeric value: " + raw, e);
                }
            default:
                throw new IllegalStateException("Unhandled column type " + this);
        }
    }

    private static LocalDate toDate(Object raw) {
        if (raw instanceof LocalDate) {
            return (LocalDate) raw;
        }
        String text = raw.toString().trim();
        try {
            // 兼容 2025-10-24 和 20251024 两种格式
            if (text.length() == 8 && text.chars().allMatch(Character::isDigit)) {
                return LocalDate.parse(text, COMPACT_DATE);
            }
            return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date value: " + raw, e);
        }
    }
}
