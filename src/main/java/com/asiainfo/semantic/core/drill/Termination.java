package com.asiainfo.semantic.core.drill;

public enum Termination {
    /** 某一步的贡献度达到覆盖率阈值 */
    COVERAGE_REACHED,
    /** 下钻路径全部走完 */
    PATH_EXHAUSTED,
    /** 当前层及全部备选列都没有可用候选 */
    BACKTRACK_EXHAUSTED,
    /** 根节点没有不利偏差 */
    NO_DEVIATION,
    /** 根节点样本量不足 */
    INSUFFICIENT_SAMPLE
}
