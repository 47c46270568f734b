package com.asiainfo.semantic.core.graph;

import com.asiainfo.semantic.TestModels;
import com.asiainfo.semantic.core.exception.AmbiguousJoinException;
import com.asiainfo.semantic.core.exception.SchemaException;
import com.asiainfo.semantic.core.exception.UnreachableDimensionException;
import com.asiainfo.semantic.core.filter.FilterContext;
import com.asiainfo.semantic.core.model.ColumnDef;
import com.asiainfo.semantic.core.model.ColumnType;
import com.asiainfo.semantic.core.model.DimensionTable;
import com.asiainfo.semantic.core.model.FactTable;
import com.asiainfo.semantic.core.model.ForeignKey;
import com.asiainfo.semantic.core.model.JoinKey;
import com.asiainfo.semantic.core.model.Relationship;
import com.asiainfo.semantic.core.schema.SchemaRegistry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 关系图测试：默认关系、歧义检测、显式选择
 */
public class RelationshipGraphTest {

    private static RelationshipGraph graph;

    @BeforeAll
    static void setUp() {
        graph = RelationshipGraph.build(TestModels.supportSchema());
    }

    @Test
    public void testSingleRelationship() {
        Relationship rel = graph.activeRelationshipFor("FactCsat", "DimGeography");

        assertEquals("GeographyKey", rel.factColumn());
        assertEquals("GeographyKey", rel.dimensionColumn());
        assertEquals("FactCsat[GeographyKey]->DimGeography[GeographyKey]", rel.id());
        assertTrue(rel.active());
    }

    @Test
    public void testAmbiguousJoinDetected() {
        System.out.println("\n╔══════════════════════════════════════════════════════════════════════════════╗");
        System.out.println("║                    测试: 双键歧义关联                                       ║");
        System.out.println("╚══════════════════════════════════════════════════════════════════════════════╝");

        assertTrue(graph.isAmbiguous("FactTask", "DimQueue"));
        assertEquals(Set.of(new JoinKey("FactTask", "DimQueue")), graph.ambiguousPairs());

        // 即使其中一条声明为 active，也不会静默选择
        AmbiguousJoinException e = assertThrows(AmbiguousJoinException.class,
                () -> graph.activeRelationshipFor("FactTask", "DimQueue"));
        assertEquals("FactTask", e.getFactTable());
        assertEquals("DimQueue", e.getDimensionTable());
        assertEquals(2, e.getCandidateColumns().size());
        System.out.println("歧义提示: " + e.getUserFriendlyMessage());
        System.out.println("✓ 歧义关联被检测到");
        System.out.println("══════════════════════════════════════════════════════════════════════════════\n");
    }

    @Test
    public void testExplicitSelection() {
        assertEquals("QueueID", graph.resolveJoinPath("FactTask", "DimQueue", "Task-QueueID").factColumn());
        // 也可以用事实列名选择
        assertEquals("Task-QueueKey", graph.resolveJoinPath("FactTask", "DimQueue", "QueueKey").id());

        FilterContext ctx = FilterContext.empty().useRelationship("FactTask", "DimQueue", "Task-QueueID");
        assertEquals("Task-QueueID", graph.resolveJoinPath("FactTask", "DimQueue", ctx).id());
    }

    @Test
    public void testUnknownSelector() {
        assertThrows(UnreachableDimensionException.class,
                () -> graph.resolveJoinPath("FactTask", "DimQueue", "Task-Nope"));
    }

    @Test
    public void testUnreachableDimension() {
        assertFalse(graph.reaches("FactCsat", "DimDate"));
        assertThrows(UnreachableDimensionException.class,
                () -> graph.activeRelationshipFor("FactCsat", "DimDate"));
    }

    @Test
    public void testResolutionOrderFollowsDeclaration() {
        assertEquals(List.of("DimGeography", "DimProduct", "DimQueue"), graph.resolutionOrder("FactCsat"));
        assertEquals(3, graph.relationshipsOf("FactTask").size());
        assertEquals(6, graph.relationships().size());
    }

    @Test
    public void testAtMostOneActiveRelationship() {
        SchemaRegistry schema = SchemaRegistry.builder()
                .dimension(new DimensionTable("DimQueue", List.of(
                        ColumnDef.key("QueueKey"),
                        new ColumnDef("QueueID", ColumnType.TEXT, false, true)), "QueueKey"))
                .fact(new FactTable("FactTask", List.of(
                        ColumnDef.of("QueueKey", ColumnType.KEY),
                        ColumnDef.of("QueueID", ColumnType.TEXT)),
                        List.of(ForeignKey.of("QueueKey", "DimQueue", "QueueKey"),
                                ForeignKey.of("QueueID", "DimQueue", "QueueID")), null))
                .build();

        assertThrows(SchemaException.class, () -> RelationshipGraph.build(schema));
    }
}
