package com.asiainfo.semantic.core.engine;

/**
 * 按事实表行号读取某列的值（列可能位于经外键关联的维度表上）
 * 外键为空或找不到对应维度行（孤儿）时返回 null。
 */
@FunctionalInterface
public interface RowAccessor {

    Object get(int factRow);
}
