package com.asiainfo.semantic.core.drill;

import com.asiainfo.semantic.core.model.ColumnRef;
import com.asiainfo.semantic.core.model.MeasureValue;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 下钻的一步。达到覆盖率的一层可能同时选中多个取值，此时贡献度、样本量与提升度为各取值之和
 */
public record DrillStep(
    ColumnRef column,
    List<Object> values,
    double contribution,
    double sampleSize,
    MeasureValue measureValue,
    double lift
) {
    public DrillStep {
        // 空值分组可以单独成为一步，不能用 List.copyOf
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * 排名第一的取值
     */
    @JsonIgnore
    public Object value() {
        return values.get(0);
    }
}
