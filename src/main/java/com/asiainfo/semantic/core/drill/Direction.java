package com.asiainfo.semantic.core.drill;

/**
 * 偏差方向：指标越高越差（如 DSAT%）或越低越差（如 CSAT%）
 */
public enum Direction {
    HIGHER_IS_WORSE(1),
    LOWER_IS_WORSE(-1);

    private final int sign;

    Direction(int sign) {
        this.sign = sign;
    }

    public int sign() {
        return sign;
    }
}
