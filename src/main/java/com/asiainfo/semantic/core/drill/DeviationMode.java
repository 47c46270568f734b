package com.asiainfo.semantic.core.drill;

/**
 * 超额偏差的计算方式
 * RATE: (value - goal) × sample，适用于比率类指标，目标是比率
 * ABSOLUTE: value - goal × sample / rootSample，适用于计数类指标，目标按样本占比分摊
 */
public enum DeviationMode {
    RATE,
    ABSOLUTE
}
