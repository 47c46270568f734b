package com.asiainfo.semantic.config;

import com.asiainfo.semantic.core.integrity.IntegrityThresholds;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 语义模型运行配置
 * 模型加载、完整性阈值、下钻默认参数
 */
@ApplicationScoped
public class SemanticConfig {

    private static final Logger log = LoggerFactory.getLogger(SemanticConfig.class);

    // 模型
    @ConfigProperty(name = "semantic.model.location", defaultValue = "classpath:model/csat-model.json")
    String modelLocation;

    @ConfigProperty(name = "semantic.model.load-on-startup", defaultValue = "true")
    boolean loadOnStartup;

    @ConfigProperty(name = "semantic.model.check-integrity-on-load", defaultValue = "true")
    boolean checkIntegrityOnLoad;

    @ConfigProperty(name = "semantic.model.anchor-cache-size", defaultValue = "256")
    long anchorCacheSize;

    // 完整性阈值
    @ConfigProperty(name = "semantic.integrity.red-coverage", defaultValue = "0.95")
    double redCoverage;

    @ConfigProperty(name = "semantic.integrity.red-blank-ratio", defaultValue = "0.05")
    double redBlankRatio;

    @ConfigProperty(name = "semantic.integrity.yellow-coverage", defaultValue = "0.98")
    double yellowCoverage;

    @ConfigProperty(name = "semantic.integrity.yellow-blank-ratio", defaultValue = "0.02")
    double yellowBlankRatio;

    // 下钻
    @ConfigProperty(name = "semantic.drill.coverage-threshold", defaultValue = "0.8")
    double drillCoverageThreshold;

    @ConfigProperty(name = "semantic.drill.min-sample", defaultValue = "30")
    int drillMinSample;

    @ConfigProperty(name = "semantic.drill.marginal-threshold", defaultValue = "0.05")
    double drillMarginalThreshold;

    @ConfigProperty(name = "semantic.drill.timeout-seconds", defaultValue = "30")
    long drillTimeoutSeconds;

    @PostConstruct
    void init() {
        log.info("=== Semantic Model Configuration ===");
        log.info("Model:     {} (loadOnStartup={}, integrityOnLoad={})",
                modelLocation, loadOnStartup, checkIntegrityOnLoad);
        log.info("Integrity: RED coverage<{} or blank>{}, YELLOW coverage<{} or blank>{}",
                redCoverage, redBlankRatio, yellowCoverage, yellowBlankRatio);
        log.info("Drill:     coverage={}, minSample={}, marginal={}, timeout={}s",
                drillCoverageThreshold, drillMinSample, drillMarginalThreshold, drillTimeoutSeconds);
        log.info("====================================");
    }

    public String getModelLocation() {
        return modelLocation;
    }

    public boolean isLoadOnStartup() {
        return loadOnStartup;
    }

    public boolean isCheckIntegrityOnLoad() {
        return checkIntegrityOnLoad;
    }

    public long getAnchorCacheSize() {
        return anchorCacheSize;
    }

    public IntegrityThresholds getIntegrityThresholds() {
        return new IntegrityThresholds(redCoverage, redBlankRatio, yellowCoverage, yellowBlankRatio);
    }

    public double getDrillCoverageThreshold() {
        return drillCoverageThreshold;
    }

    public int getDrillMinSample() {
        return drillMinSample;
    }

    public double getDrillMarginalThreshold() {
        return drillMarginalThreshold;
    }

    public long getDrillTimeoutSeconds() {
        return drillTimeoutSeconds;
    }
}
