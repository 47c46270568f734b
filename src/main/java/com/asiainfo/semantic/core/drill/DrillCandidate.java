package com.asiainfo.semantic.core.drill;

import com.asiainfo.semantic.core.model.MeasureValue;

/**
 * 某一层的候选取值
 *
 * @param value        维度取值，null 表示空外键或孤儿行
 * @param contribution 超额偏差占根节点超额偏差的比例
 * @param lift         contribution 减去样本占比，衡量偏差是否集中
 * @param eligible     样本量达标且存在不利偏差
 */
public record DrillCandidate(
    Object value,
    MeasureValue measureValue,
    double sampleSize,
    double excess,
    double contribution,
    double lift,
    boolean eligible
) {}
