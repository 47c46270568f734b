package com.asiainfo.semantic.core.measure;

import com.asiainfo.semantic.TestModels;
import com.asiainfo.semantic.core.exception.CyclicMeasureException;
import com.asiainfo.semantic.core.exception.MeasureDefinitionException;
import com.asiainfo.semantic.core.exception.UnknownMeasureException;
import com.asiainfo.semantic.core.graph.RelationshipGraph;
import com.asiainfo.semantic.core.model.ColumnRef;
import com.asiainfo.semantic.core.schema.SchemaRegistry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 度量注册测试：引用校验、循环检测、依赖分析
 */
public class MeasureRegistryTest {

    private static SchemaRegistry schema;
    private static RelationshipGraph graph;

    @BeforeAll
    static void setUp() {
        schema = TestModels.supportSchema();
        graph = RelationshipGraph.build(schema);
    }

    private static MeasureRegistry compile(List<MeasureDefinition> defs) {
        return MeasureRegistry.compile(defs, schema, graph);
    }

    @Test
    public void testCompileSupportMeasures() {
        MeasureRegistry registry = compile(TestModels.supportMeasures());

        assertEquals(15, registry.size());
        Measure ratio = registry.require(TestModels.DSAT_RATE);
        assertEquals(MeasureType.RATIO, ratio.type());
        assertEquals(MeasureCategory.CALCULATION, ratio.category());
        assertEquals(List.of(TestModels.DSAT, TestModels.CSAT_RESPONSE), ratio.dependsOn());
        assertFalse(ratio.complex());

        Measure dsat = registry.require(TestModels.DSAT);
        assertEquals(Set.of(ColumnRef.of("FactCsat", "CsatScore")), dsat.columns());
    }

    @Test
    public void testFactsOfFollowsReferences() {
        MeasureRegistry registry = compile(TestModels.supportMeasures());

        assertEquals(Set.of("FactCsat"), registry.factsOf("NSAT"));
        assertEquals(Set.of("FactTask"), registry.factsOf("# Tasks L3D"));
        assertThrows(UnknownMeasureException.class, () -> registry.factsOf("nope"));
    }

    @Test
    public void testDependents() {
        MeasureRegistry registry = compile(TestModels.supportMeasures());

        Set<String> dependents = registry.dependents(TestModels.DSAT);
        assertEquals(Set.of(TestModels.DSAT_RATE, "NSAT", "% DSAT(1,2) L30D"), dependents);
        assertTrue(registry.dependents("NSAT").isEmpty());
    }

    @Test
    public void testDeclaredTypeWins() {
        MeasureRegistry registry = compile(List.of(
                new MeasureDefinition("Handle", MeasureType.NUMBER, "SUM(FactTask[HandleMinutes])", "minutes", "0.0")));

        Measure m = registry.require("Handle");
        assertEquals(MeasureType.NUMBER, m.type());
        assertEquals("minutes", m.description());
        assertEquals("0.0", m.formatString());
    }

    @Test
    public void testDuplicateName() {
        MeasureDefinitionException e = assertThrows(MeasureDefinitionException.class, () -> compile(List.of(
                MeasureDefinition.of("A", "COUNTROWS(FactTask)"),
                MeasureDefinition.of("A", "COUNTROWS(FactCsat)"))));
        assertEquals("A", e.getMeasureName());
    }

    @Test
    public void testUnknownReference() {
        UnknownMeasureException e = assertThrows(UnknownMeasureException.class, () -> compile(List.of(
                MeasureDefinition.of("A", "[B] + 1"))));
        assertEquals("B", e.getMeasureName());
        assertTrue(e.getMessage().contains("referenced by [A]"));
    }

    @Test
    public void testCycleDetected() {
        System.out.println("\n╔══════════════════════════════════════════════════════════════════════════════╗");
        System.out.println("║                    测试: 度量循环引用                                       ║");
        System.out.println("╚══════════════════════════════════════════════════════════════════════════════╝");

        CyclicMeasureException e = assertThrows(CyclicMeasureException.class, () -> compile(List.of(
                MeasureDefinition.of("A", "[B] * 2"),
                MeasureDefinition.of("B", "FILTERED([C], FactCsat[CsatScore] = 1)"),
                MeasureDefinition.of("C", "[A] + COUNTROWS(FactCsat)"))));

        assertEquals(List.of("A", "B", "C", "A"), e.getCycle());
        System.out.println("环路径: " + e.getUserFriendlyMessage());
        System.out.println("✓ 循环引用在注册期被拒绝");
        System.out.println("══════════════════════════════════════════════════════════════════════════════\n");
    }

    @Test
    public void testSelfReference() {
        CyclicMeasureException e = assertThrows(CyclicMeasureException.class, () -> compile(List.of(
                MeasureDefinition.of("A", "[A] + 1"))));
        assertEquals(List.of("A", "A"), e.getCycle());
    }

    @Test
    public void testComplexExpression() {
        List<MeasureDefinition> defs = new ArrayList<>();
        defs.add(MeasureDefinition.of("Deep", "((((((COUNTROWS(FactTask)))))))"));
        MeasureRegistry registry = compile(defs);

        assertTrue(registry.require("Deep").complex());
    }

    @Test
    public void testRequireUnknown() {
        MeasureRegistry registry = compile(List.of());
        assertThrows(UnknownMeasureException.class, () -> registry.require("nope"));
        assertTrue(registry.find("nope").isEmpty());
        assertFalse(registry.contains("nope"));
    }
}
