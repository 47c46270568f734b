package com.asiainfo.semantic.core.filter;

import com.asiainfo.semantic.core.model.ColumnRef;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 筛选上下文测试
 */
public class FilterContextTest {

    private static final ColumnRef SCORE = ColumnRef.of("FactCsat", "CsatScore");
    private static final ColumnRef REGION = ColumnRef.of("DimGeography", "Region");

    @Test
    public void testWithIntersectsSameColumn() {
        FilterContext ctx = FilterContext.of(SCORE, Predicates.in(1, 2, 5))
                .with(SCORE, Predicates.atMost(2));

        assertEquals(Predicates.in(1, 2), ctx.predicate(SCORE).orElseThrow());
    }

    @Test
    public void testNarrowingDoesNotLeak() {
        FilterContext outer = FilterContext.of(REGION, Predicates.eq("Americas"));
        FilterContext inner = outer.with(SCORE, Predicates.atMost(2));

        assertTrue(outer.predicate(SCORE).isEmpty());
        assertTrue(inner.predicate(SCORE).isPresent());
        assertNotEquals(outer, inner);
    }

    @Test
    public void testIntersectIsOrderIndependent() {
        FilterContext a = FilterContext.of(REGION, Predicates.eq("Americas")).with(SCORE, Predicates.atMost(2));
        FilterContext b = FilterContext.of(SCORE, Predicates.atMost(2)).with(REGION, Predicates.eq("Americas"));

        // 谓词映射相等即上下文相等（可作缓存键）
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    public void testRelationshipSelection() {
        FilterContext ctx = FilterContext.empty().useRelationship("FactTask", "DimQueue", "Task-QueueID");

        assertEquals("Task-QueueID", ctx.selectedRelationship("FactTask", "DimQueue").orElseThrow());
        assertTrue(ctx.selectedRelationship("FactCsat", "DimQueue").isEmpty());

        // 内层覆盖外层
        FilterContext inner = ctx.intersect(FilterContext.empty().useRelationship("FactTask", "DimQueue", "Task-QueueKey"));
        assertEquals("Task-QueueKey", inner.selectedRelationship("FactTask", "DimQueue").orElseThrow());
    }

    @Test
    public void testUnsatisfiable() {
        FilterContext ctx = FilterContext.of(SCORE, Predicates.eq(1)).with(SCORE, Predicates.eq(5));
        assertTrue(ctx.isUnsatisfiable());
        assertFalse(FilterContext.empty().isUnsatisfiable());
        assertTrue(FilterContext.empty().isEmpty());
    }
}
