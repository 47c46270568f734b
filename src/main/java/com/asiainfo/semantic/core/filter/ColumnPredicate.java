package com.asiainfo.semantic.core.filter;

import com.asiainfo.semantic.core.model.ColumnType;

/**
 * 列取值谓词
 * 实现类均为不可变值对象（equals/hashCode 基于内容），可作为缓存键的一部分。
 */
public interface ColumnPredicate {

    boolean test(Object value);

    /**
     * 取交集，结果可能是不可满足的谓词（空集合），此时查询结果为空而不是报错
     */
    ColumnPredicate intersect(ColumnPredicate other);

    default boolean isUnsatisfiable() {
        return false;
    }

    /**
     * 将字面量转换为列类型（如 "2025-10-01" -> LocalDate）
     */
    default ColumnPredicate coerce(ColumnType type) {
        return this;
    }
}
