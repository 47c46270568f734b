package com.asiainfo.semantic.core.drill;

import com.asiainfo.semantic.core.model.MeasureValue;

import java.util.List;

public record DrillResult(
    String targetMeasure,
    MeasureValue rootValue,
    double rootSample,
    double rootExcess,
    List<DrillStep> steps,
    List<DrillLevel> levels,
    Termination termination
) {
    public DrillResult {
        steps = List.copyOf(steps);
        levels = List.copyOf(levels);
    }

    public int depth() {
        return steps.size();
    }

    /**
     * 最后一步解释的偏差比例，没有步骤时为 0
     */
    public double explainedCoverage() {
        return steps.isEmpty() ? 0d : steps.get(steps.size() - 1).contribution();
    }
}
