package com.gdin.inspection.graphalgo.graph;

import com.gdin.inspection.graphalgo.models.EdgeRecord;
import com.gdin.inspection.graphalgo.models.NodeRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GraphBuilderTest {

    private final GraphBuilder builder = new GraphBuilder();

    private static NodeRecord node(String uid) {
        return NodeRecord.builder().uid(uid).name("n-" + uid).type("Entity").build();
    }

    private static EdgeRecord edge(String source, String target) {
        return EdgeRecord.builder().source(source).target(target).build();
    }

    @Test
    public void testBuildDropsInvalidEdgesAndSelfLoops() {
        List<NodeRecord> nodes = List.of(node("a"), node("b"), node("c"));
        List<EdgeRecord> edges = List.of(
                edge("a", "b"),
                edge("b", "c"),
                edge("a", "a"),
                edge("a", "x"),
                EdgeRecord.builder().source("a").build()
        );

        AnalyticsGraph graph = builder.build(nodes, edges, false, false, 0);

        assertEquals(3, graph.nodeCount());
        assertEquals(2, graph.edgeCount());
        assertEquals(2, graph.degree("b"));
        assertEquals(3, builder.getLastGraphSize());
        assertTrue(builder.getLastBuildSeconds() >= 0d);
    }

    @Test
    public void testSelfLoopKeptWhenAllowed() {
        AnalyticsGraph graph = builder.build(List.of(node("a")), List.of(edge("a", "a")), false, true, 0);
        assertEquals(1, graph.edgeCount());
    }

    @Test
    public void testNodeIdFallsBackToNodeIdField() {
        List<NodeRecord> nodes = List.of(
                NodeRecord.builder().nodeId("n1").name("only node id").build(),
                NodeRecord.builder().name("no id at all").build()
        );

        AnalyticsGraph graph = builder.build(nodes, List.of(), false, false, 0);

        assertEquals(1, graph.nodeCount());
        assertTrue(graph.containsNode("n1"));
        assertEquals("", graph.node("n1").getType());
    }

    @Test
    public void testNodeAttributesAreKept() {
        NodeRecord record = NodeRecord.builder().uid("a").name("Alice").type("PERSON").attribute("age", 30).build();

        AnalyticsGraph graph = builder.build(List.of(record), List.of(), false, false, 0);

        GraphNode node = graph.node("a");
        assertEquals("Alice", node.getName());
        assertEquals("PERSON", node.attribute("type"));
        assertEquals(30, node.attribute("age"));
    }

    @Test
    public void testDefaultRelationshipType() {
        AnalyticsGraph graph = builder.build(List.of(node("a"), node("b")), List.of(edge("a", "b")), false, false, 0);
        assertEquals(GraphEdge.DEFAULT_RELATIONSHIP_TYPE, graph.edge("a", "b").getRelationshipType());
    }

    @Test
    public void testDuplicateEdgeOverwritesAttributes() {
        List<EdgeRecord> edges = List.of(
                EdgeRecord.builder().source("a").target("b").relationshipType("knows").attribute("weight", 1.0).build(),
                EdgeRecord.builder().source("b").target("a").relationshipType("likes").attribute("weight", 3.0).build()
        );

        AnalyticsGraph graph = builder.build(List.of(node("a"), node("b")), edges, false, false, 0);

        assertEquals(1, graph.edgeCount());
        GraphEdge e = graph.edge("a", "b");
        assertEquals("likes", e.getRelationshipType());
        assertEquals(3.0, e.weight("weight"));
    }

    @Test
    public void testDirectedGraphKeepsBothDirections() {
        AnalyticsGraph graph = builder.build(
                List.of(node("a"), node("b")), List.of(edge("a", "b"), edge("b", "a")), true, false, 0);

        assertTrue(graph.isDirected());
        assertEquals(2, graph.edgeCount());
        assertEquals(2, graph.degree("a"));
    }

    @Test
    public void testMinDegreeIsSinglePass() {
        // a-b-c 链加孤立点 d：度数 1,2,1,0。阈值 2 只删 a、c、d，b 剩下后度数变 0 也不再删除
        List<NodeRecord> nodes = List.of(node("a"), node("b"), node("c"), node("d"));
        AnalyticsGraph graph = builder.build(nodes, List.of(edge("a", "b"), edge("b", "c")), false, false, 2);

        assertEquals(Set.of("b"), graph.nodeIds());
        assertEquals(0, graph.edgeCount());
    }

    @Test
    public void testEmptyInput() {
        AnalyticsGraph graph = builder.build(null, null, false, false, 0);
        assertEquals(0, graph.nodeCount());
        assertFalse(graph.isConnected());
        assertEquals(0d, graph.density());
    }

    @Test
    public void testDensityAndConnectivity() {
        AnalyticsGraph undirected = GraphFixtures.undirected("a-b", "b-c");
        assertEquals(2d / 3d, undirected.density(), 1e-12);
        assertTrue(undirected.isConnected());

        AnalyticsGraph directed = GraphFixtures.directed("a-b", "b-c");
        assertEquals(2d / 6d, directed.density(), 1e-12);
        // 有向图按弱连通
        assertTrue(directed.isConnected());
    }

    @Test
    public void testSubgraphFilters() {
        List<NodeRecord> nodes = List.of(
                NodeRecord.builder().uid("a").type("PERSON").build(),
                NodeRecord.builder().uid("b").type("PERSON").build(),
                NodeRecord.builder().uid("c").type("PERSON").build(),
                NodeRecord.builder().uid("d").type("ORG").build()
        );
        List<EdgeRecord> edges = List.of(
                EdgeRecord.builder().source("a").target("b").relationshipType("knows").build(),
                EdgeRecord.builder().source("b").target("c").relationshipType("likes").build(),
                EdgeRecord.builder().source("c").target("d").relationshipType("knows").build()
        );
        AnalyticsGraph graph = builder.build(nodes, edges, false, false, 0);

        AnalyticsGraph people = builder.subgraph(graph, Map.of("type", "PERSON"), null, null);
        assertEquals(Set.of("a", "b", "c"), people.nodeIds());
        assertEquals(2, people.edgeCount());

        AnalyticsGraph knows = builder.subgraph(graph, Map.of("type", "PERSON"), Map.of("relationship_type", "knows"), 0);
        assertEquals(3, knows.nodeCount());
        assertEquals(1, knows.edgeCount());
        assertNotNull(knows.edge("a", "b"));
        assertNull(knows.edge("b", "c"));

        AnalyticsGraph truncated = builder.subgraph(graph, null, null, 2);
        assertEquals(2, truncated.nodeCount());

        // 原图不受影响
        assertEquals(4, graph.nodeCount());
        assertEquals(3, graph.edgeCount());
    }

    @Test
    public void testLargestComponent() {
        AnalyticsGraph graph = GraphFixtures.graph(false, List.of("z"), "a-b", "b-c", "x-y");

        AnalyticsGraph lcc = builder.largestComponent(graph);

        assertEquals(Set.of("a", "b", "c"), lcc.nodeIds());
        assertEquals(2, lcc.edgeCount());
        assertTrue(lcc.isConnected());
    }

    @Test
    public void testLargestComponentOfEmptyGraph() {
        AnalyticsGraph lcc = builder.largestComponent(AnalyticsGraph.empty(true));
        assertEquals(0, lcc.nodeCount());
        assertTrue(lcc.isDirected());
    }
}
