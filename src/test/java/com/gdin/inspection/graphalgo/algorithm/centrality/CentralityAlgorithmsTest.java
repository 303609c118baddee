package com.gdin.inspection.graphalgo.algorithm.centrality;

import com.gdin.inspection.graphalgo.algorithm.AlgorithmNotFoundException;
import com.gdin.inspection.graphalgo.algorithm.AlgorithmParameters;
import com.gdin.inspection.graphalgo.algorithm.GraphAlgorithm;
import com.gdin.inspection.graphalgo.algorithm.StubResultWriter;
import com.gdin.inspection.graphalgo.config.properties.GraphAlgoProperties;
import com.gdin.inspection.graphalgo.graph.AnalyticsGraph;
import com.gdin.inspection.graphalgo.graph.GraphFixtures;
import com.gdin.inspection.graphalgo.models.AlgorithmRunResult;
import com.gdin.inspection.graphalgo.models.AlgorithmStatistics;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CentralityAlgorithmsTest {

    private static final double EPS = 1e-9;

    /** 额外注册一个必然失败的算法，验证互不影响 */
    static class WithBrokenAlgorithm extends CentralityAlgorithms {
        WithBrokenAlgorithm(GraphAlgoProperties properties) {
            super(properties);
            register(new GraphAlgorithm<Double>() {
                @Override
                public String name() {
                    return "broken";
                }

                @Override
                public Map<String, Double> compute(AnalyticsGraph graph, AlgorithmParameters parameters) {
                    throw new IllegalStateException("boom");
                }
            });
        }
    }

    @Test
    public void testRegistryFollowsToggles() {
        GraphAlgoProperties properties = new GraphAlgoProperties();
        assertEquals(List.of("pagerank", "betweenness_centrality", "closeness_centrality", "eigenvector_centrality"),
                new CentralityAlgorithms(properties).availableNames());

        properties.getAlgorithms().setCloseness(false);
        properties.getAlgorithms().setEigenvector(false);
        assertEquals(List.of("pagerank", "betweenness_centrality"),
                new CentralityAlgorithms(properties).availableNames());
    }

    @Test
    public void testRunOneUnknownName() {
        CentralityAlgorithms algorithms = new CentralityAlgorithms(new GraphAlgoProperties());
        AnalyticsGraph graph = GraphFixtures.undirected("a-b");

        assertThrows(AlgorithmNotFoundException.class,
                () -> algorithms.runOne("katz", graph, false, null, false, null));
    }

    @Test
    public void testRunAllIsolatesFailures() {
        CentralityAlgorithms algorithms = new WithBrokenAlgorithm(new GraphAlgoProperties());
        AnalyticsGraph graph = GraphFixtures.undirected("a-b", "b-c");

        Map<String, AlgorithmRunResult<Double>> results = algorithms.runAll(graph, false, null, false, null);

        assertEquals(5, results.size());
        assertEquals("boom", results.get("broken").getMetadata().getError());
        assertTrue(results.get("broken").getResults().isEmpty());
        for (String name : List.of("pagerank", "betweenness_centrality", "closeness_centrality", "eigenvector_centrality")) {
            assertTrue(results.get(name).isSuccess(), name);
            assertEquals(3, results.get(name).getResults().size(), name);
        }
    }

    @Test
    public void testCentralityNeverCreatesCommunityNodes() {
        CentralityAlgorithms algorithms = new CentralityAlgorithms(new GraphAlgoProperties());
        StubResultWriter writer = new StubResultWriter();

        algorithms.runAll(GraphFixtures.undirected("a-b", "b-c"), true, writer, true, null);

        assertEquals(4, writer.scalarWrites.size());
        assertTrue(writer.communityWrites.isEmpty());
    }

    @Test
    public void testStatistics() {
        GraphAlgoProperties properties = new GraphAlgoProperties();
        properties.setDefaultAlgorithmTimeout(60);
        CentralityAlgorithms algorithms = new CentralityAlgorithms(properties);

        algorithms.runOne("pagerank", GraphFixtures.undirected("a-b", "b-c"), false, null, false, null);

        Map<String, AlgorithmStatistics> stats = algorithms.statistics();
        assertEquals(3, stats.get("pagerank").getLastResultCount());
        assertEquals(60, stats.get("pagerank").getTimeout());
        assertNotNull(stats.get("pagerank").getLastRunTime());
        assertNull(stats.get("betweenness_centrality").getLastRunTime());
    }

    @Test
    public void testPageRankStar() {
        AnalyticsGraph star = GraphFixtures.undirected("c-l1", "c-l2", "c-l3");

        Map<String, Double> scores = new PageRankAlgorithm().compute(star, AlgorithmParameters.empty());

        double sum = scores.values().stream().mapToDouble(Double::doubleValue).sum();
        assertEquals(1.0, sum, 1e-4);
        assertTrue(scores.get("c") > scores.get("l1"));
        assertEquals(scores.get("l1"), scores.get("l2"), 1e-9);
    }

    @Test
    public void testBetweennessPath() {
        AnalyticsGraph path = GraphFixtures.undirected("a-b", "b-c");

        Map<String, Double> scores = new BetweennessCentralityAlgorithm()
                .compute(path, AlgorithmParameters.of(Map.of("k", 2)));

        assertEquals(1d, scores.get("b"), EPS);
        assertEquals(0d, scores.get("a"), EPS);
        assertEquals(0d, scores.get("c"), EPS);
    }

    @Test
    public void testBetweennessStarCenterIsOne() {
        AnalyticsGraph star = GraphFixtures.undirected("c-a", "c-b", "c-d");

        Map<String, Double> scores = new BetweennessCentralityAlgorithm().compute(star, AlgorithmParameters.empty());

        assertEquals(1d, scores.get("c"), EPS);
        assertEquals(0d, scores.get("a"), EPS);
    }

    @Test
    public void testBetweennessUnnormalized() {
        AnalyticsGraph path = GraphFixtures.undirected("a-b", "b-c");

        Map<String, Double> scores = new BetweennessCentralityAlgorithm()
                .compute(path, AlgorithmParameters.of(Map.of("normalized", false)));

        // 只有 a-c 一对经过 b
        assertEquals(1d, scores.get("b"), EPS);
    }

    @Test
    public void testBetweennessDirectedPath() {
        AnalyticsGraph path = GraphFixtures.directed("a-b", "b-c");

        Map<String, Double> scores = new BetweennessCentralityAlgorithm().compute(path, AlgorithmParameters.empty());

        // 有向图归一化因子 (n-1)(n-2) = 2，只有 a->c 经过 b
        assertEquals(0.5, scores.get("b"), EPS);
    }

    @Test
    public void testClosenessUndirected() {
        AnalyticsGraph path = GraphFixtures.undirected("a-b", "b-c");

        Map<String, Double> scores = new ClosenessCentralityAlgorithm().compute(path, AlgorithmParameters.empty());

        assertEquals(2d / 3d, scores.get("a"), EPS);
        assertEquals(1d, scores.get("b"), EPS);
        assertEquals(2d / 3d, scores.get("c"), EPS);
    }

    @Test
    public void testClosenessWithUnreachableNodes() {
        AnalyticsGraph graph = GraphFixtures.graph(false, List.of("z"), "a-b");

        Map<String, Double> improved = new ClosenessCentralityAlgorithm().compute(graph, AlgorithmParameters.empty());
        assertEquals(0.5, improved.get("a"), EPS);
        assertEquals(0d, improved.get("z"), EPS);

        Map<String, Double> plain = new ClosenessCentralityAlgorithm()
                .compute(graph, AlgorithmParameters.of(Map.of("wf_improved", false)));
        assertEquals(1d, plain.get("a"), EPS);
    }

    @Test
    public void testClosenessDirectedUsesIncomingDistance() {
        AnalyticsGraph chain = GraphFixtures.directed("a-b", "b-c");

        Map<String, Double> scores = new ClosenessCentralityAlgorithm().compute(chain, AlgorithmParameters.empty());

        assertEquals(0d, scores.get("a"), EPS);
        assertEquals(0.5, scores.get("b"), EPS);
        assertEquals(2d / 3d, scores.get("c"), EPS);
    }

    @Test
    public void testEigenvectorTriangle() {
        AnalyticsGraph triangle = GraphFixtures.undirected("a-b", "b-c", "a-c");

        Map<String, Double> scores = new EigenvectorCentralityAlgorithm().compute(triangle, AlgorithmParameters.empty());

        double expected = 1d / Math.sqrt(3d);
        for (String id : List.of("a", "b", "c")) {
            assertEquals(expected, scores.get(id), 1e-6);
        }
    }

    @Test
    public void testEigenvectorPathCenterIsHighest() {
        AnalyticsGraph path = GraphFixtures.undirected("a-b", "b-c");

        Map<String, Double> scores = new EigenvectorCentralityAlgorithm().compute(path, AlgorithmParameters.empty());

        assertTrue(scores.get("b") > scores.get("a"));
        assertEquals(scores.get("a"), scores.get("c"), 1e-6);
    }

    @Test
    public void testEigenvectorFallsBackToDirectSolve() {
        AnalyticsGraph triangle = GraphFixtures.undirected("a-b", "b-c", "a-c");

        Map<String, Double> scores = new EigenvectorCentralityAlgorithm()
                .compute(triangle, AlgorithmParameters.of(Map.of("max_iter", 1)));

        double expected = 1d / Math.sqrt(3d);
        for (String id : List.of("a", "b", "c")) {
            assertEquals(expected, scores.get(id), 1e-6);
        }
    }

    @Test
    public void testEigenvectorDirectedChain() {
        CentralityAlgorithms algorithms = new CentralityAlgorithms(new GraphAlgoProperties());
        AnalyticsGraph chain = GraphFixtures.directed("a-b");

        AlgorithmRunResult<Double> result = algorithms.runOne("eigenvector_centrality", chain, false, null, false, null);

        assertTrue(result.isSuccess());
        assertNull(result.getMetadata().getError());
        assertEquals(2, result.getResults().size());
        assertEquals(0d, result.getResults().get("a"), 1e-6);
        assertEquals(1d, result.getResults().get("b"), 1e-6);
    }
}
