package com.asiainfo.semantic.core.engine;

import com.asiainfo.semantic.TestModels;
import com.asiainfo.semantic.core.SemanticModel;
import com.asiainfo.semantic.core.exception.AmbiguousJoinException;
import com.asiainfo.semantic.core.exception.QueryCancelledException;
import com.asiainfo.semantic.core.exception.UnknownMeasureException;
import com.asiainfo.semantic.core.exception.UnreachableDimensionException;
import com.asiainfo.semantic.core.filter.FilterContext;
import com.asiainfo.semantic.core.filter.Predicates;
import com.asiainfo.semantic.core.measure.MeasureDefinition;
import com.asiainfo.semantic.core.model.ColumnRef;
import com.asiainfo.semantic.core.model.MeasureValue;
import com.asiainfo.semantic.core.model.ResultTable;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static com.asiainfo.semantic.TestModels.CSAT_RESPONSE;
import static com.asiainfo.semantic.TestModels.DSAT;
import static com.asiainfo.semantic.TestModels.DSAT_RATE;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 度量求值测试
 * 基于客服满意度样例模型：10 条问卷（评分 1,1,2,4,5,5,5,3,2,4），8 条工单。
 */
public class MeasureEvaluatorTest {

    private static final ColumnRef REGION = ColumnRef.of("DimGeography", "Region");
    private static final ColumnRef COUNTRY = ColumnRef.of("DimGeography", "Country");
    private static final ColumnRef SCORE = ColumnRef.of("FactCsat", "CsatScore");
    private static final ColumnRef QUEUE_NAME = ColumnRef.of("DimQueue", "QueueName");

    private static SemanticModel model;
    private static MeasureEvaluator evaluator;

    @BeforeAll
    static void setUp() {
        model = TestModels.support(
                MeasureDefinition.of("# Americas DSAT A",
                        "FILTERED(FILTERED([# CSAT Response], DimGeography[Region] = \"Americas\"), FactCsat[CsatScore] <= 2)"),
                MeasureDefinition.of("# Americas DSAT B",
                        "FILTERED(FILTERED([# CSAT Response], FactCsat[CsatScore] <= 2), DimGeography[Region] = \"Americas\")"),
                MeasureDefinition.of("# Billing Tasks", "FILTERED([# Tasks], DimQueue[QueueName] = \"Billing\")"),
                MeasureDefinition.of("P75 Early", "FILTERED([P75 Handle Time], FactTask[TaskId] <= 4)"));
        evaluator = new MeasureEvaluator(model);
    }

    private static double value(String measure) {
        return value(measure, FilterContext.empty());
    }

    private static double value(String measure, FilterContext ctx) {
        MeasureValue v = evaluator.evaluate(measure, ctx);
        assertTrue(v.isPresent(), measure + " should have a value in " + ctx);
        return v.getAsDouble();
    }

    @Test
    public void testCsatBasics() {
        System.out.println("\n╔══════════════════════════════════════════════════════════════════════════════╗");
        System.out.println("║                    测试: CSAT 基础度量                                      ║");
        System.out.println("╚══════════════════════════════════════════════════════════════════════════════╝");

        assertEquals(10, value(CSAT_RESPONSE));
        assertEquals(4, value(DSAT));
        assertEquals(0.4, value(DSAT_RATE), 1e-12);
        assertEquals(5, value("# CSAT(4,5)"));
        assertEquals(0.5, value("% CSAT(4,5)"), 1e-12);
        assertEquals(110, value("NSAT"), 1e-9);
        assertEquals(3.2, value("Avg CSAT"), 1e-12);

        System.out.println("# CSAT Response = " + value(CSAT_RESPONSE));
        System.out.println("# DSAT(1,2)     = " + value(DSAT));
        System.out.println("% DSAT(1,2)     = " + value(DSAT_RATE));
        System.out.println("NSAT            = " + value("NSAT"));
        System.out.println("✓ 基础度量求值正确");
        System.out.println("══════════════════════════════════════════════════════════════════════════════\n");
    }

    @Test
    public void testTaskMeasures() {
        assertEquals(8, value("# Tasks"));
        assertEquals(45, value("Avg Handle Time"), 1e-12);
        // n=8, ceil(8 × 0.75) = 6 -> 第 6 个值
        assertEquals(60, value("P75 Handle Time"));
        // [10, 20, 30, 40] 的 75 分位为 30
        assertEquals(30, value("P75 Early"));
    }

    @Test
    public void testDimensionFilterFlowsToFact() {
        FilterContext americas = FilterContext.of(REGION, Predicates.eq("Americas"));

        assertEquals(5, value(CSAT_RESPONSE, americas));
        assertEquals(3, value(DSAT, americas));
        assertEquals(0.6, value(DSAT_RATE, americas), 1e-12);
    }

    @Test
    public void testZeroDenominatorIsNoValue() {
        FilterContext nowhere = FilterContext.of(REGION, Predicates.eq("Nowhere"));

        // 计数为 0 是有效值，比率为 NO_VALUE
        assertEquals(MeasureValue.of(0), evaluator.evaluate(CSAT_RESPONSE, nowhere));
        assertEquals(MeasureValue.NO_VALUE, evaluator.evaluate(DSAT_RATE, nowhere));
        assertEquals(MeasureValue.NO_VALUE, evaluator.evaluate("NSAT", nowhere));
        assertEquals(MeasureValue.NO_VALUE, evaluator.evaluate("Avg CSAT", nowhere));
    }

    @Test
    public void testFilteredIsOrderIndependent() {
        assertEquals(3, value("# Americas DSAT A"));
        assertEquals(value("# Americas DSAT A"), value("# Americas DSAT B"));
    }

    @Test
    public void testFilteredIntersectsOuterContext() {
        FilterContext outer = FilterContext.of(SCORE, Predicates.in(1, 5));

        // (score <= 2) ∩ {1, 5} = {1}
        assertEquals(2, value(DSAT, outer));
        // 外层条件不受内层影响
        assertEquals(5, value(CSAT_RESPONSE, outer));
    }

    @Test
    public void testPredicatesOnOtherTablesAreIgnored() {
        FilterContext taskSide = FilterContext.of(ColumnRef.of("FactTask", "HandleMinutes"), Predicates.atLeast(50));

        assertEquals(10, value(CSAT_RESPONSE, taskSide));
        assertEquals(4, value("# Tasks", taskSide));

        FilterContext month = FilterContext.of(ColumnRef.of("DimDate", "Month"), Predicates.eq("2025-09"));
        assertEquals(10, value(CSAT_RESPONSE, month));
        assertEquals(0, value("# Tasks", month));
    }

    @Test
    public void testUnsatisfiableContext() {
        FilterContext ctx = FilterContext.of(SCORE, Predicates.eq(1)).with(SCORE, Predicates.eq(5));
        assertEquals(0, value(CSAT_RESPONSE, ctx));
    }

    @Test
    public void testLastNDays() {
        // 锚点 2025-10-31，窗口 [10-24, 10-31]
        assertEquals(3, value("# CSAT Response L7D"));
        assertEquals(0.4, value("% DSAT(1,2) L30D"), 1e-12);
        // 锚点取被引用的最大日期 2025-10-08，窗口 [10-05, 10-08]
        assertEquals(4, value("# Tasks L3D"));
        // ClosedDate 全为空：无锚点，结果为 NO_VALUE 而非 0
        assertEquals(MeasureValue.NO_VALUE, evaluator.evaluate("# Tasks Closed L7D", FilterContext.empty()));
    }

    @Test
    public void testAmbiguousJoinRequiresSelection() {
        System.out.println("\n╔══════════════════════════════════════════════════════════════════════════════╗");
        System.out.println("║                    测试: 歧义关联必须显式选择                               ║");
        System.out.println("╚══════════════════════════════════════════════════════════════════════════════╝");

        assertThrows(AmbiguousJoinException.class,
                () -> evaluator.evaluate("# Billing Tasks", FilterContext.empty()));
        assertThrows(AmbiguousJoinException.class,
                () -> evaluator.evaluateGrouped("# Tasks", List.of(QUEUE_NAME), FilterContext.empty()));

        FilterContext byKey = FilterContext.empty().useRelationship("FactTask", "DimQueue", "Task-QueueKey");
        FilterContext byId = FilterContext.empty().useRelationship("FactTask", "DimQueue", "Task-QueueID");
        assertEquals(2, value("# Billing Tasks", byKey));
        assertEquals(2, value("# Billing Tasks", byId));
        assertEquals(2, value("# Billing Tasks (Routed)"));

        ResultTable viaKey = evaluator.evaluateGrouped("# Tasks", List.of(QUEUE_NAME), byKey);
        ResultTable viaId = evaluator.evaluateGrouped("# Tasks", List.of(QUEUE_NAME), byId);
        System.out.println("QueueKey 关联: " + viaKey.toMaps());
        System.out.println("QueueID 关联:  " + viaId.toMaps());

        assertEquals(MeasureValue.of(2), viaKey.find("Technical").value());
        assertEquals(MeasureValue.of(3), viaId.find("Technical").value());
        System.out.println("✓ 不同关联路径给出不同结果，绝不静默选择");
        System.out.println("══════════════════════════════════════════════════════════════════════════════\n");
    }

    @Test
    public void testGroupedOrphansFallIntoNullGroup() {
        ResultTable table = evaluator.evaluateGrouped(CSAT_RESPONSE, List.of(REGION), FilterContext.empty());

        assertEquals(List.of("DimGeography[Region]"), table.groupColumns());
        assertEquals(Arrays.asList("APAC", "Americas", "EMEA", null),
                table.rows().stream().map(r -> r.keys().get(0)).collect(Collectors.toList()));
        assertEquals(MeasureValue.of(5), table.find("Americas").value());
        // 空外键 1 行 + 孤儿 1 行
        assertEquals(MeasureValue.of(2), table.find((Object) null).value());

        double total = table.rows().stream().mapToDouble(r -> r.value().getAsDouble()).sum();
        assertEquals(10, total);
    }

    @Test
    public void testGroupedByTwoColumns() {
        ResultTable table = evaluator.evaluateGrouped(DSAT, List.of(REGION, COUNTRY),
                FilterContext.of(REGION, Predicates.eq("Americas")));

        assertEquals(2, table.size());
        assertEquals(MeasureValue.of(1), table.find("Americas", "CA").value());
        assertEquals(MeasureValue.of(2), table.find("Americas", "US").value());
    }

    @Test
    public void testGroupedByFactColumn() {
        ResultTable table = evaluator.evaluateGrouped("# Tasks", List.of(ColumnRef.of("FactTask", "QueueID")),
                FilterContext.empty());

        assertEquals(4, table.size());
        assertEquals(MeasureValue.of(3), table.find("Q-TECH").value());
        assertEquals(MeasureValue.of(1), table.find((Object) null).value());
    }

    @Test
    public void testGroupedByUnreachableColumn() {
        assertThrows(UnreachableDimensionException.class, () -> evaluator.evaluateGrouped(CSAT_RESPONSE,
                List.of(ColumnRef.of("DimDate", "Month")), FilterContext.empty()));
    }

    @Test
    public void testUnknownMeasure() {
        assertThrows(UnknownMeasureException.class, () -> evaluator.evaluate("nope", FilterContext.empty()));
    }

    @Test
    public void testSessionReusesScans() {
        EvaluationSession session = evaluator.newSession(CancellationToken.NONE);

        MeasureValue first = session.evaluateMeasure(DSAT_RATE, FilterContext.empty());
        int scans = session.cachedScans();
        MeasureValue second = session.evaluateMeasure("NSAT", FilterContext.empty());

        assertEquals(first, evaluator.evaluate(DSAT_RATE, FilterContext.empty()));
        assertTrue(second.isPresent());
        assertTrue(scans > 0);
        assertTrue(session.cachedScans() >= scans);
    }

    @Test
    public void testCancelledQuery() {
        CancellationToken token = CancellationToken.create();
        token.cancel();

        assertTrue(token.isCancelled());
        assertThrows(QueryCancelledException.class,
                () -> evaluator.evaluate(DSAT_RATE, FilterContext.empty(), token));
        assertThrows(IllegalStateException.class, CancellationToken.NONE::cancel);
    }
}
