package com.asiainfo.semantic.core.drill;

import com.asiainfo.semantic.core.engine.CancellationToken;
import com.asiainfo.semantic.core.engine.EvaluationSession;
import com.asiainfo.semantic.core.engine.MeasureEvaluator;
import com.asiainfo.semantic.core.filter.FilterContext;
import com.asiainfo.semantic.core.filter.Predicates;
import com.asiainfo.semantic.core.measure.AggFunc;
import com.asiainfo.semantic.core.measure.AggregateExpr;
import com.asiainfo.semantic.core.measure.DivideExpr;
import com.asiainfo.semantic.core.measure.Measure;
import com.asiainfo.semantic.core.measure.MeasureExpr;
import com.asiainfo.semantic.core.measure.MeasureRefExpr;
import com.asiainfo.semantic.core.model.ColumnRef;
import com.asiainfo.semantic.core.model.MeasureValue;
import com.asiainfo.semantic.core.model.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * 根因下钻搜索
 *
 * 贪心、深度优先、单一活动分支：
 * 1. 在基线上下文求目标度量与样本量，计算根节点超额偏差；
 * 2. 每层按下钻路径的下一列分组，候选值按贡献度（占根节点超额偏差的比例）排序；
 * 3. 样本不足的候选不参与排名。按排名累加候选在当前分支剩余偏差中的占比，
 *    取最短的前缀使累计占比达到覆盖率；该组取值的偏差占比高出样本占比至少边际阈值时，
 *    整组作为一步并结束下钻；
 * 4. 否则沿排名第一的取值继续下钻。首层以下，该取值解释的剩余偏差不足边际阈值时本层失败；
 * 5. 本层失败时回到当前上下文，依次用备选列重试，全部失败则结束。
 *
 * 同一层的候选在线程池中并行求值，结果按排名规则归约，与完成顺序无关。
 */
public final class RootCauseDrillDown {

    private static final Logger log = LoggerFactory.getLogger(RootCauseDrillDown.class);

    private static final Comparator<DrillCandidate> RANKING = Comparator
            .comparingDouble(DrillCandidate::contribution).reversed()
            .thenComparing(DrillCandidate::value, Values.NULLS_LAST);

    private final MeasureEvaluator evaluator;
    private final Executor executor;

    public RootCauseDrillDown(MeasureEvaluator evaluator, Executor executor) {
        this.evaluator = evaluator;
        this.executor = executor;
    }

    public DrillResult drill(DrillRequest request) {
        return drill(request, CancellationToken.NONE);
    }

    public DrillResult drill(DrillRequest request, CancellationToken token) {
        EvaluationSession session = evaluator.newSession(token);
        Measure target = session.measures().require(request.targetMeasure());
        for (ColumnRef col : request.drillPath()) {
            session.model().schema().requireColumn(col);
        }
        MeasureExpr sampleExpr = sampleExpression(session, request, target);
        Set<String> facts = session.measures().factsOf(target.name());

        FilterContext context = request.baseline();
        MeasureValue rootValue = session.evaluateMeasure(target.name(), context);
        double rootSample = session.evaluate(sampleExpr, context).orElse(0d);
        List<DrillStep> steps = new ArrayList<>();
        List<DrillLevel> levels = new ArrayList<>();

        if (rootSample < request.minSample()) {
            log.info("[Drill] {} root sample {} below minimum {}", target.name(), rootSample, request.minSample());
            return new DrillResult(target.name(), rootValue, rootSample, 0d, steps, levels, Termination.INSUFFICIENT_SAMPLE);
        }
        double rootExcess = rootValue.isPresent()
                ? excess(request, rootValue.getAsDouble(), rootSample, rootSample)
                : 0d;
        // 空基线在绝对值模式下得到 NaN，同样视为没有可分摊的偏差
        if (rootSample <= 0d || !(rootExcess > 0d) || Double.isInfinite(rootExcess)) {
            log.info("[Drill] {} = {} shows no adverse deviation from goal {} (sample={})",
                    target.name(), rootValue, request.goal(), rootSample);
            double reported = Double.isFinite(rootExcess) ? rootExcess : 0d;
            return new DrillResult(target.name(), rootValue, rootSample, reported, steps, levels, Termination.NO_DEVIATION);
        }
        log.info("[Drill] 开始下钻 {}: value={}, sample={}, excess={}, path={}",
                target.name(), rootValue, rootSample, rootExcess, request.drillPath());

        double currentExcess = rootExcess;
        double currentSample = rootSample;
        for (ColumnRef column : request.drillPath()) {
            token.throwIfCancelled();
            int depth = steps.size();

            List<ColumnRef> attempts = new ArrayList<>();
            attempts.add(column);
            attempts.addAll(request.fallbacksFor(column));

            Selection chosen = null;
            ColumnRef chosenColumn = null;
            for (int i = 0; i < attempts.size() && chosen == null; i++) {
                ColumnRef attempt = attempts.get(i);
                List<DrillCandidate> ranked = rank(session, request, facts, sampleExpr, attempt,
                        context, rootSample, rootExcess);
                Selection selection = select(request, ranked, depth, currentExcess, currentSample);
                levels.add(new DrillLevel(depth, attempt, i > 0, ranked, selection.outcome()));
                log.debug("[Drill] depth={} column={} outcome={} selected={}",
                        depth, attempt, selection.outcome(), selection.values());
                if (selection.taken()) {
                    chosen = selection;
                    chosenColumn = attempt;
                } else if (i + 1 < attempts.size()) {
                    log.info("[Drill] {} 无可用候选 ({})，改用备选列 {}", attempt, selection.outcome(), attempts.get(i + 1));
                }
            }

            if (chosen == null) {
                log.info("[Drill] {} 及其备选列均无可用候选，结束下钻", column);
                return new DrillResult(target.name(), rootValue, rootSample, rootExcess, steps, levels,
                        Termination.BACKTRACK_EXHAUSTED);
            }

            FilterContext narrowed = narrowAll(context, chosenColumn, chosen.values());
            DrillStep step = toStep(session, request, chosenColumn, chosen, narrowed, rootSample);
            steps.add(step);
            context = narrowed;
            currentExcess = chosen.excess();
            currentSample = step.sampleSize();

            if (chosen.outcome() == LevelOutcome.COVERAGE_REACHED) {
                log.info("[Drill] {} in {} 解释了 {} 的偏差，下钻结束", chosenColumn, step.values(),
                        String.format("%.1f%%", step.contribution() * 100));
                return new DrillResult(target.name(), rootValue, rootSample, rootExcess, steps, levels,
                        Termination.COVERAGE_REACHED);
            }
        }
        return new DrillResult(target.name(), rootValue, rootSample, rootExcess, steps, levels,
                Termination.PATH_EXHAUSTED);
    }

    /**
     * 本层结论。样本量已在候选阶段过滤
     *
     * @param currentExcess 当前分支的剩余偏差
     * @param currentSample 当前分支的样本量
     */
    static Selection select(DrillRequest request, List<DrillCandidate> ranked, int depth,
                            double currentExcess, double currentSample) {
        List<DrillCandidate> eligible = ranked.stream()
                .filter(DrillCandidate::eligible)
                .collect(Collectors.toList());
        if (eligible.isEmpty()) {
            return new Selection(List.of(), LevelOutcome.NO_ELIGIBLE_CANDIDATE);
        }

        List<DrillCandidate> covering = covering(request, eligible, currentExcess);
        if (!covering.isEmpty()) {
            double share = covering.stream().mapToDouble(DrillCandidate::excess).sum() / currentExcess;
            double sampleShare = covering.stream().mapToDouble(DrillCandidate::sampleSize).sum() / currentSample;
            // 偏差与样本同比例分布的一组取值并不能解释偏差
            if (share - sampleShare >= request.marginalThreshold()) {
                return new Selection(covering, LevelOutcome.COVERAGE_REACHED);
            }
        }

        DrillCandidate top = eligible.get(0);
        if (depth > 0 && top.excess() / currentExcess < request.marginalThreshold()) {
            return new Selection(List.of(top), LevelOutcome.INSUFFICIENT_IMPROVEMENT);
        }
        return new Selection(List.of(top), LevelOutcome.STEP_TAKEN);
    }

    /**
     * 按排名累加剩余偏差占比，返回首个达到覆盖率的前缀；达不到时返回空列表。
     * 空值分组无法与其他取值合并为一个过滤条件，只能单独成组
     */
    private static List<DrillCandidate> covering(DrillRequest request, List<DrillCandidate> eligible,
                                                 double currentExcess) {
        List<DrillCandidate> selected = new ArrayList<>();
        double covered = 0d;
        for (DrillCandidate candidate : eligible) {
            if (candidate.value() == null) {
                if (selected.isEmpty() && candidate.excess() / currentExcess >= request.coverageThreshold()) {
                    return List.of(candidate);
                }
                continue;
            }
            selected.add(candidate);
            covered += candidate.excess();
            if (covered / currentExcess >= request.coverageThreshold()) {
                return selected;
            }
        }
        return List.of();
    }

    private DrillStep toStep(EvaluationSession session, DrillRequest request, ColumnRef column,
                             Selection selection, FilterContext narrowed, double rootSample) {
        List<DrillCandidate> members = selection.members();
        if (members.size() == 1) {
            DrillCandidate only = members.get(0);
            return new DrillStep(column, selection.values(), only.contribution(), only.sampleSize(),
                    only.measureValue(), only.lift());
        }
        double contribution = members.stream().mapToDouble(DrillCandidate::contribution).sum();
        double sample = members.stream().mapToDouble(DrillCandidate::sampleSize).sum();
        MeasureValue measured = session.evaluateMeasure(request.targetMeasure(), narrowed);
        return new DrillStep(column, selection.values(), contribution, sample, measured,
                contribution - sample / rootSample);
    }

    private List<DrillCandidate> rank(EvaluationSession session, DrillRequest request, Set<String> facts,
                                      MeasureExpr sampleExpr, ColumnRef column, FilterContext context,
                                      double rootSample, double rootExcess) {
        List<Object> values = evaluator.distinctValues(session, facts, column, context);
        List<CompletableFuture<DrillCandidate>> futures = new ArrayList<>(values.size());
        for (Object value : values) {
            futures.add(CompletableFuture.supplyAsync(() -> candidate(session, request, sampleExpr,
                    narrow(context, column, value), value, rootSample, rootExcess), executor));
        }
        List<DrillCandidate> candidates = new ArrayList<>(futures.size());
        try {
            for (CompletableFuture<DrillCandidate> f : futures) {
                candidates.add(f.join());
            }
        } catch (CompletionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
        candidates.sort(RANKING);
        return candidates;
    }

    private DrillCandidate candidate(EvaluationSession session, DrillRequest request, MeasureExpr sampleExpr,
                                     FilterContext context, Object value, double rootSample, double rootExcess) {
        MeasureValue measured = session.evaluateMeasure(request.targetMeasure(), context);
        double sample = session.evaluate(sampleExpr, context).orElse(0d);
        if (measured.isEmpty()) {
            return new DrillCandidate(value, measured, sample, 0d, 0d, 0d, false);
        }
        double excess = excess(request, measured.getAsDouble(), sample, rootSample);
        double contribution = excess / rootExcess;
        double lift = contribution - sample / rootSample;
        boolean eligible = sample >= request.minSample() && excess > 0d;
        return new DrillCandidate(value, measured, sample, excess, contribution, lift, eligible);
    }

    private static double excess(DrillRequest request, double value, double sample, double rootSample) {
        int sign = request.direction().sign();
        if (request.mode() == DeviationMode.RATE) {
            return sign * (value - request.goal()) * sample;
        }
        return sign * (value - request.goal() * sample / rootSample);
    }

    private static FilterContext narrow(FilterContext context, ColumnRef column, Object value) {
        return context.with(column, value == null ? Predicates.isNull() : Predicates.eq(value));
    }

    private static FilterContext narrowAll(FilterContext context, ColumnRef column, List<Object> values) {
        if (values.size() == 1) {
            return narrow(context, column, values.get(0));
        }
        return context.with(column, Predicates.in(values));
    }

    /**
     * 样本量表达式：显式指定的度量 > 目标度量的分母 > 首个事实表行数
     */
    private static MeasureExpr sampleExpression(EvaluationSession session, DrillRequest request, Measure target) {
        if (request.sampleMeasure() != null) {
            session.measures().require(request.sampleMeasure());
            return new MeasureRefExpr(request.sampleMeasure());
        }
        MeasureExpr expr = target.expr();
        while (expr instanceof MeasureRefExpr ref) {
            expr = session.measures().require(ref.name()).expr();
        }
        if (expr instanceof DivideExpr divide) {
            return divide.denominator();
        }
        Set<String> facts = session.measures().factsOf(target.name());
        if (facts.isEmpty()) {
            throw new IllegalArgumentException("Measure [" + target.name() + "] does not aggregate any fact table");
        }
        String fact = facts.iterator().next();
        return new AggregateExpr(AggFunc.COUNTROWS, fact, null);
    }

    /**
     * 一层选中的候选（按排名顺序）及本层结论
     */
    record Selection(List<DrillCandidate> members, LevelOutcome outcome) {

        boolean taken() {
            return outcome == LevelOutcome.STEP_TAKEN || outcome == LevelOutcome.COVERAGE_REACHED;
        }

        double excess() {
            return members.stream().mapToDouble(DrillCandidate::excess).sum();
        }

        List<Object> values() {
            List<Object> values = new ArrayList<>(members.size());
            members.forEach(m -> values.add(m.value()));
            return values;
        }
    }
}
