package com.asiainfo.semantic.core.drill;

import com.asiainfo.semantic.core.filter.FilterContext;
import com.asiainfo.semantic.core.model.ColumnRef;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 下钻请求
 *
 * @param sampleMeasure 样本量度量，为空时取目标度量的分母，再没有则取事实表行数
 * @param fallbacks     某列无可用候选时依次尝试的备选列
 */
public record DrillRequest(
    String targetMeasure,
    FilterContext baseline,
    List<ColumnRef> drillPath,
    double coverageThreshold,
    int minSample,
    double marginalThreshold,
    double goal,
    Direction direction,
    DeviationMode mode,
    String sampleMeasure,
    Map<ColumnRef, List<ColumnRef>> fallbacks
) {
    public static final double DEFAULT_COVERAGE = 0.8;
    public static final int DEFAULT_MIN_SAMPLE = 30;
    public static final double DEFAULT_MARGINAL = 0.05;

    public DrillRequest {
        Objects.requireNonNull(targetMeasure, "targetMeasure");
        baseline = baseline == null ? FilterContext.empty() : baseline;
        drillPath = List.copyOf(drillPath);
        fallbacks = fallbacks == null ? Map.of() : Map.copyOf(fallbacks);
        direction = direction == null ? Direction.HIGHER_IS_WORSE : direction;
        mode = mode == null ? DeviationMode.RATE : mode;
        if (coverageThreshold <= 0d || coverageThreshold > 1d) {
            throw new IllegalArgumentException("coverageThreshold must be within (0, 1]: " + coverageThreshold);
        }
        if (minSample < 0) {
            throw new IllegalArgumentException("minSample must not be negative: " + minSample);
        }
        if (marginalThreshold < 0d) {
            throw new IllegalArgumentException("marginalThreshold must not be negative: " + marginalThreshold);
        }
    }

    public List<ColumnRef> fallbacksFor(ColumnRef column) {
        return fallbacks.getOrDefault(column, List.of());
    }

    public static Builder builder(String targetMeasure) {
        return new Builder(targetMeasure);
    }

    public static final class Builder {
        private final String targetMeasure;
        private FilterContext baseline = FilterContext.empty();
        private final List<ColumnRef> drillPath = new ArrayList<>();
        private double coverageThreshold = DEFAULT_COVERAGE;
        private int minSample = DEFAULT_MIN_SAMPLE;
        private double marginalThreshold = DEFAULT_MARGINAL;
        private double goal;
        private Direction direction = Direction.HIGHER_IS_WORSE;
        private DeviationMode mode = DeviationMode.RATE;
        private String sampleMeasure;
        private final Map<ColumnRef, List<ColumnRef>> fallbacks = new LinkedHashMap<>();

        private Builder(String targetMeasure) {
            this.targetMeasure = targetMeasure;
        }

        public Builder baseline(FilterContext baseline) {
            this.baseline = baseline;
            return this;
        }

        public Builder path(ColumnRef... columns) {
            this.drillPath.addAll(List.of(columns));
            return this;
        }

        public Builder path(List<ColumnRef> columns) {
            this.drillPath.addAll(columns);
            return this;
        }

        public Builder coverageThreshold(double coverageThreshold) {
            this.coverageThreshold = coverageThreshold;
            return this;
        }

        public Builder minSample(int minSample) {
            this.minSample = minSample;
            return this;
        }

        public Builder marginalThreshold(double marginalThreshold) {
            this.marginalThreshold = marginalThreshold;
            return this;
        }

        public Builder goal(double goal) {
            this.goal = goal;
            return this;
        }

        public Builder direction(Direction direction) {
            this.direction = direction;
            return this;
        }

        public Builder mode(DeviationMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder sampleMeasure(String sampleMeasure) {
            this.sampleMeasure = sampleMeasure;
            return this;
        }

        public Builder fallback(ColumnRef column, ColumnRef... alternates) {
            this.fallbacks.put(column, List.of(alternates));
            return this;
        }

        public DrillRequest build() {
            return new DrillRequest(targetMeasure, baseline, drillPath, coverageThreshold, minSample,
                    marginalThreshold, goal, direction, mode, sampleMeasure, fallbacks);
        }
    }
}
