package com.asiainfo.semantic.core.measure;

import com.asiainfo.semantic.core.model.ColumnRef;

import java.util.List;
import java.util.Set;

/**
 * 已编译的度量
 *
 * @param dependsOn     表达式直接引用的其他度量
 * @param columns       表达式直接使用的列（聚合列与筛选列）
 * @param complex       表达式较长或嵌套较深，目录中标记为复杂
 */
public record Measure(
    String name,
    MeasureType type,
    MeasureExpr expr,
    String expression,
    String description,
    String formatString,
    MeasureCategory category,
    List<String> dependsOn,
    Set<ColumnRef> columns,
    boolean complex
) {
    public Measure {
        dependsOn = List.copyOf(dependsOn);
        columns = Set.copyOf(columns);
    }
}
