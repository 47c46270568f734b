package com.asiainfo.semantic.core.integrity;

/**
 * 健康度阈值
 * 覆盖率低于 redCoverage 或空值率高于 redBlankRatio 为 RED，
 * 覆盖率低于 yellowCoverage 或空值率高于 yellowBlankRatio 为 YELLOW，其余为 GREEN。
 */
public record IntegrityThresholds(
    double redCoverage,
    double redBlankRatio,
    double yellowCoverage,
    double yellowBlankRatio
) {
    public static final IntegrityThresholds DEFAULTS = new IntegrityThresholds(0.95, 0.05, 0.98, 0.02);

    public IntegrityThresholds {
        if (redCoverage > yellowCoverage) {
            throw new IllegalArgumentException("redCoverage must not exceed yellowCoverage");
        }
        if (redBlankRatio < yellowBlankRatio) {
            throw new IllegalArgumentException("redBlankRatio must not be below yellowBlankRatio");
        }
    }

    public Severity classify(double coverage, double blankRatio) {
        if (coverage < redCoverage || blankRatio > redBlankRatio) {
            return Severity.RED;
        }
        if (coverage < yellowCoverage || blankRatio > yellowBlankRatio) {
            return Severity.YELLOW;
        }
        return Severity.GREEN;
    }
}
