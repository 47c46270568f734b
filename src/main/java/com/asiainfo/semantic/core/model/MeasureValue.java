package com.asiainfo.semantic.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.NoSuchElementException;

/**
 * 度量结果
 * NO_VALUE 表示"无数据"（空窗口、分母为零或为空、缺少锚点），与数值 0 严格区分。
 * 算术组合时任一操作数为 NO_VALUE 结果即为 NO_VALUE，组合度量无需逐节点特判。
 */
public final class MeasureValue {

    public static final MeasureValue NO_VALUE = new MeasureValue(Double.NaN, false);

    private final double value;
    private final boolean present;

    private MeasureValue(double value, boolean present) {
        this.value = value;
        this.present = present;
    }

    public static MeasureValue of(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return NO_VALUE;
        }
        return new MeasureValue(value, true);
    }

    public boolean isPresent() {
        return present;
    }

    public boolean isEmpty() {
        return !present;
    }

    public double getAsDouble() {
        if (!present) {
            throw new NoSuchElementException("No value present");
        }
        return value;
    }

    public double orElse(double other) {
        return present ? value : other;
    }

    public MeasureValue plus(MeasureValue other) {
        return present && other.present ? of(value + other.value) : NO_VALUE;
    }

    public MeasureValue minus(MeasureValue other) {
        return present && other.present ? of(value - other.value) : NO_VALUE;
    }

    public MeasureValue times(MeasureValue other) {
        return present && other.present ? of(value * other.value) : NO_VALUE;
    }

    /**
     * 安全除法：分母为 0 或 NO_VALUE 时返回 NO_VALUE
     */
    public MeasureValue dividedBy(MeasureValue denominator) {
        if (!present || !denominator.present || denominator.value == 0d) {
            return NO_VALUE;
        }
        return of(value / denominator.value);
    }

    @JsonValue
    public Double toNullable() {
        return present ? value : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MeasureValue)) return false;
        MeasureValue that = (MeasureValue) o;
        return present == that.present && (!present || Double.compare(value, that.value) == 0);
    }

    @Override
    public int hashCode() {
        return present ? Double.hashCode(value) : 0;
    }

    @Override
    public String toString() {
        return present ? Double.toString(value) : "NoValue";
    }
}
