package com.asiainfo.semantic.application;

import com.asiainfo.semantic.config.ComputeExecutorConfig;
import com.asiainfo.semantic.config.SemanticConfig;
import com.asiainfo.semantic.core.SemanticModel;
import com.asiainfo.semantic.core.anchor.AnchorProfile;
import com.asiainfo.semantic.core.drill.DrillRequest;
import com.asiainfo.semantic.core.drill.DrillResult;
import com.asiainfo.semantic.core.drill.RootCauseDrillDown;
import com.asiainfo.semantic.core.engine.CancellationToken;
import com.asiainfo.semantic.core.engine.MeasureEvaluator;
import com.asiainfo.semantic.core.exception.SemanticModelException;
import com.asiainfo.semantic.core.filter.FilterContext;
import com.asiainfo.semantic.core.integrity.IntegrityReport;
import com.asiainfo.semantic.core.integrity.LintWarning;
import com.asiainfo.semantic.core.integrity.ModelLinter;
import com.asiainfo.semantic.core.integrity.RelationshipIntegrityChecker;
import com.asiainfo.semantic.core.measure.Measure;
import com.asiainfo.semantic.core.model.ColumnRef;
import com.asiainfo.semantic.core.model.DimensionTable;
import com.asiainfo.semantic.core.model.JoinKey;
import com.asiainfo.semantic.core.model.MeasureValue;
import com.asiainfo.semantic.core.model.ResultTable;
import com.asiainfo.semantic.infra.cache.QueryCacheKey;
import com.asiainfo.semantic.infra.cache.QueryResultCache;
import com.asiainfo.semantic.infra.loader.ModelDocumentLoader;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 语义模型服务
 * 持有当前模型快照，负责加载与原子替换，对外提供求值、分组、下钻、完整性检查与目录查询。
 */
@ApplicationScoped
public class SemanticModelService {

    private static final Logger log = LoggerFactory.getLogger(SemanticModelService.class);

    @Inject
    SemanticConfig config;

    @Inject
    ModelDocumentLoader loader;

    @Inject
    QueryResultCache cache;

    @Inject
    ComputeExecutorConfig executorConfig;

    @Inject
    MeterRegistry registry;

    private final AtomicReference<MeasureEvaluator> current = new AtomicReference<>();
    private final AtomicLong versions = new AtomicLong();

    void onStart(@Observes StartupEvent event) {
        if (config.isLoadOnStartup()) {
            reload();
        } else {
            log.info("[Model] semantic.model.load-on-startup=false, 等待手动加载");
        }
    }

    /**
     * 从配置的位置重新加载模型
     */
    public SemanticModel reload() {
        return reload(config.getModelLocation());
    }

    /**
     * 加载模型并原子替换当前快照。加载失败时保留旧快照并抛出异常。
     *
     * 重新加载互斥执行，快照版本只增不减；查询读取 {@link #current} 不受锁影响。
     */
    public synchronized SemanticModel reload(String location) {
        long start = System.currentTimeMillis();
        long version = versions.incrementAndGet();
        SemanticModel model = loader.load(location, version, config.getAnchorCacheSize());
        if (config.isCheckIntegrityOnLoad()) {
            new RelationshipIntegrityChecker(model, config.getIntegrityThresholds())
                    .checkModel(CancellationToken.NONE);
        }
        for (LintWarning w : ModelLinter.lint(model)) {
            log.warn("[Model] {} {}: {}", w.code(), w.subject(), w.message());
        }
        MeasureEvaluator previous = current.getAndSet(new MeasureEvaluator(model));
        cache.invalidateBefore(version);
        log.info("[Model] 模型加载完成 {} in {} ms (previous version: {})", model,
                System.currentTimeMillis() - start, previous == null ? "-" : previous.model().version());
        return model;
    }

    /**
     * 当前快照
     */
    public SemanticModel model() {
        return evaluator().model();
    }

    public MeasureValue evaluate(String measure, FilterContext context) {
        MeasureEvaluator evaluator = evaluator();
        QueryCacheKey key = QueryCacheKey.scalar(evaluator.model().version(), measure, context);
        return timed("evaluate", () -> cache.get(key, () -> evaluator.evaluate(measure, context)));
    }

    public ResultTable evaluateGrouped(String measure, List<ColumnRef> groupBy, FilterContext context) {
        MeasureEvaluator evaluator = evaluator();
        QueryCacheKey key = QueryCacheKey.grouped(evaluator.model().version(), measure, groupBy, context);
        return timed("evaluateGrouped", () -> cache.get(key, () -> evaluator.evaluateGrouped(measure, groupBy, context)));
    }

    /**
     * 根因下钻，整个下钻过程受超时令牌约束
     */
    public DrillResult drill(DrillRequest request) {
        MeasureEvaluator evaluator = evaluator();
        RootCauseDrillDown search = new RootCauseDrillDown(evaluator, executorConfig.getComputeExecutor());
        CancellationToken token = CancellationToken.withTimeout(Duration.ofSeconds(config.getDrillTimeoutSeconds()));
        DrillResult result = timed("drill", () -> search.drill(request, token));
        log.info("[Drill] {} finished: {} steps, termination={}, coverage={}", request.targetMeasure(),
                result.depth(), result.termination(), String.format("%.4f", result.explainedCoverage()));
        return result;
    }

    public DrillRequest.Builder drillDefaults(String measure) {
        return DrillRequest.builder(measure)
                .coverageThreshold(config.getDrillCoverageThreshold())
                .minSample(config.getDrillMinSample())
                .marginalThreshold(config.getDrillMarginalThreshold());
    }

    public List<IntegrityReport> checkIntegrity(String fact) {
        SemanticModel model = model();
        CancellationToken token = CancellationToken.withTimeout(Duration.ofSeconds(config.getDrillTimeoutSeconds()));
        return timed("integrity", () -> new RelationshipIntegrityChecker(model, config.getIntegrityThresholds())
                .checkAll(fact, token));
    }

    public AnchorProfile anchorProfile(String fact) {
        return model().anchors().profile(fact);
    }

    public List<MeasureCatalogEntry> catalog() {
        SemanticModel model = model();
        List<MeasureCatalogEntry> entries = new ArrayList<>();
        for (Measure m : model.measures().all()) {
            entries.add(MeasureCatalogEntry.of(m, model.measures().factsOf(m.name())));
        }
        return entries;
    }

    public List<LintWarning> lint() {
        return ModelLinter.lint(model());
    }

    public ModelSummary summary() {
        SemanticModel model = model();
        Map<String, Integer> dims = new LinkedHashMap<>();
        for (DimensionTable d : model.schema().dimensions()) {
            dims.put(d.name(), model.rowCount(d.name()));
        }
        List<String> ambiguous = new ArrayList<>();
        for (JoinKey k : model.graph().ambiguousPairs()) {
            ambiguous.add(k.toString());
        }
        return new ModelSummary(model.name(), model.version(), model.loadedAt(), model.factRowCounts(), dims,
                model.graph().relationships().size(), ambiguous, model.measures().size());
    }

    private MeasureEvaluator evaluator() {
        MeasureEvaluator evaluator = current.get();
        if (evaluator == null) {
            throw new SemanticModelException("Semantic model is not loaded yet");
        }
        return evaluator;
    }

    private <T> T timed(String operation, Supplier<T> action) {
        Timer.Sample sample = Timer.start(registry);
        try {
            T result = action.get();
            sample.stop(Timer.builder("semantic.query.time")
                    .description("Semantic model query time")
                    .tag("operation", operation)
                    .tag("outcome", "success")
                    .register(registry));
            return result;
        } catch (RuntimeException e) {
            sample.stop(Timer.builder("semantic.query.time")
                    .description("Semantic model query time")
                    .tag("operation", operation)
                    .tag("outcome", "error")
                    .register(registry));
            Counter.builder("semantic.query.errors")
                    .tag("operation", operation)
                    .tag("type", e.getClass().getSimpleName())
                    .register(registry)
                    .increment();
            throw e;
        }
    }
}
