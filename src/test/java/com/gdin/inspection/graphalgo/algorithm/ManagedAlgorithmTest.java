package com.gdin.inspection.graphalgo.algorithm;

import com.gdin.inspection.graphalgo.graph.AnalyticsGraph;
import com.gdin.inspection.graphalgo.graph.GraphFixtures;
import com.gdin.inspection.graphalgo.models.AlgorithmMetadata;
import com.gdin.inspection.graphalgo.models.AlgorithmRunResult;
import com.gdin.inspection.graphalgo.models.AlgorithmStatistics;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ManagedAlgorithmTest {

    /** 每个节点返回其度数 */
    static class DegreeAlgorithm implements GraphAlgorithm<Integer> {
        int calls;

        @Override
        public String name() {
            return "degree";
        }

        @Override
        public Map<String, Integer> compute(AnalyticsGraph graph, AlgorithmParameters parameters) {
            calls++;
            return new LinkedHashMap<>(graph.degrees());
        }
    }

    static class FailingAlgorithm implements GraphAlgorithm<Double> {
        private final Exception failure;

        FailingAlgorithm(Exception failure) {
            this.failure = failure;
        }

        @Override
        public String name() {
            return "failing";
        }

        @Override
        public Map<String, Double> compute(AnalyticsGraph graph, AlgorithmParameters parameters) throws Exception {
            throw failure;
        }
    }

    @Test
    public void testEmptyGraphSkipsCompute() {
        DegreeAlgorithm algorithm = new DegreeAlgorithm();
        ManagedAlgorithm<Integer> managed = new ManagedAlgorithm<>(algorithm, 300);
        StubResultWriter writer = new StubResultWriter();

        AlgorithmRunResult<Integer> result = managed.run(AnalyticsGraph.empty(false), true, writer, true, null);

        assertEquals(0, algorithm.calls);
        assertTrue(result.getResults().isEmpty());
        AlgorithmMetadata metadata = result.getMetadata();
        assertEquals(Boolean.TRUE, metadata.getEmptyGraph());
        assertEquals(0, metadata.getResultCount());
        assertNull(metadata.getError());
        assertTrue(writer.scalarWrites.isEmpty());
    }

    @Test
    public void testSuccessfulRunPopulatesMetadata() {
        AnalyticsGraph graph = GraphFixtures.undirected("a-b", "b-c");
        ManagedAlgorithm<Integer> managed = new ManagedAlgorithm<>(new DegreeAlgorithm(), 300);

        AlgorithmRunResult<Integer> result = managed.run(graph, AlgorithmParameters.empty());

        assertTrue(result.isSuccess());
        assertEquals(Map.of("a", 1, "b", 2, "c", 1), result.getResults());
        AlgorithmMetadata metadata = result.getMetadata();
        assertEquals("degree", metadata.getAlgorithm());
        assertEquals(3, metadata.getResultCount());
        assertEquals(3, metadata.getGraphNodes());
        assertEquals(2, metadata.getGraphEdges());
        assertNotNull(metadata.getTimestamp());
        assertTrue(metadata.getDurationSeconds() >= 0d);
        assertNull(metadata.getEmptyGraph());
        assertNull(metadata.getWrittenBack());
    }

    @Test
    public void testFailureIsRecordedNotThrown() {
        ManagedAlgorithm<Double> managed =
                new ManagedAlgorithm<>(new FailingAlgorithm(new IllegalStateException("did not converge")), 300);
        StubResultWriter writer = new StubResultWriter();

        AlgorithmRunResult<Double> result = managed.run(GraphFixtures.undirected("a-b"), true, writer, false, null);

        assertFalse(result.isSuccess());
        assertTrue(result.getResults().isEmpty());
        assertEquals("did not converge", result.getMetadata().getError());
        assertTrue(result.getMetadata().getDurationSeconds() >= 0d);
        assertTrue(writer.scalarWrites.isEmpty());
    }

    @Test
    public void testFailureWithoutMessageUsesExceptionType() {
        ManagedAlgorithm<Double> managed = new ManagedAlgorithm<>(new FailingAlgorithm(new ArithmeticException()), 300);

        AlgorithmRunResult<Double> result = managed.run(GraphFixtures.undirected("a-b"), null);

        assertEquals("ArithmeticException", result.getMetadata().getError());
    }

    @Test
    public void testWriteBackFailureKeepsResults() {
        StubResultWriter writer = new StubResultWriter();
        writer.scalarFailure = new IllegalStateException("store down");
        ManagedAlgorithm<Integer> managed = new ManagedAlgorithm<>(new DegreeAlgorithm(), 300);

        AlgorithmRunResult<Integer> result = managed.run(GraphFixtures.undirected("a-b"), true, writer, false, null);

        assertEquals(2, result.getResults().size());
        assertEquals(Boolean.FALSE, result.getMetadata().getWrittenBack());
        assertEquals("store down", result.getMetadata().getWriteBackError());
        assertNull(result.getMetadata().getError());
    }

    @Test
    public void testWriterReportingFalse() {
        StubResultWriter writer = new StubResultWriter();
        writer.scalarResult = false;
        ManagedAlgorithm<Integer> managed = new ManagedAlgorithm<>(new DegreeAlgorithm(), 300);

        AlgorithmRunResult<Integer> result = managed.run(GraphFixtures.undirected("a-b"), true, writer, false, null);

        assertEquals(Boolean.FALSE, result.getMetadata().getWrittenBack());
        assertNull(result.getMetadata().getWriteBackError());
    }

    @Test
    public void testNoWriteBackWithoutFlag() {
        StubResultWriter writer = new StubResultWriter();
        ManagedAlgorithm<Integer> managed = new ManagedAlgorithm<>(new DegreeAlgorithm(), 300);

        AlgorithmRunResult<Integer> result = managed.run(GraphFixtures.undirected("a-b"), false, writer, true, null);

        assertTrue(writer.scalarWrites.isEmpty());
        assertTrue(writer.communityWrites.isEmpty());
        assertNull(result.getMetadata().getWrittenBack());
        assertNull(result.getMetadata().getCommunityEntitiesCreated());
    }

    @Test
    public void testCommunityEntitiesCreated() {
        StubResultWriter writer = new StubResultWriter();
        ManagedAlgorithm<Integer> managed = new ManagedAlgorithm<>(new DegreeAlgorithm(), 300);

        // 度数 1,2,1 -> 两个“社区”
        AlgorithmRunResult<Integer> result = managed.run(GraphFixtures.undirected("a-b", "b-c"), true, writer, true, null);

        AlgorithmMetadata metadata = result.getMetadata();
        assertEquals(Boolean.TRUE, metadata.getWrittenBack());
        assertEquals(2, metadata.getCommunityEntitiesCreated());
        assertEquals(Map.of(1, "0x101", 2, "0x102"), metadata.getCommunityUids());
        assertNull(metadata.getCommunityCreationError());
    }

    @Test
    public void testCommunityCreationFailureRecorded() {
        StubResultWriter writer = new StubResultWriter();
        writer.communityFailure = new IllegalStateException("mutation rejected");
        ManagedAlgorithm<Integer> managed = new ManagedAlgorithm<>(new DegreeAlgorithm(), 300);

        AlgorithmRunResult<Integer> result = managed.run(GraphFixtures.undirected("a-b"), true, writer, true, null);

        assertEquals(Boolean.TRUE, result.getMetadata().getWrittenBack());
        assertEquals("mutation rejected", result.getMetadata().getCommunityCreationError());
        assertNull(result.getMetadata().getCommunityEntitiesCreated());
        assertEquals(2, result.getResults().size());
    }

    @Test
    public void testStatisticsUpdatedOnEveryRun() {
        ManagedAlgorithm<Integer> managed = new ManagedAlgorithm<>(new DegreeAlgorithm(), 120);

        AlgorithmStatistics before = managed.statistics();
        assertEquals("degree", before.getName());
        assertEquals(120, before.getTimeout());
        assertNull(before.getLastRunTime());

        managed.run(GraphFixtures.undirected("a-b", "b-c"), null);
        assertEquals(3, managed.statistics().getLastResultCount());
        assertNotNull(managed.statistics().getLastRunTime());

        managed.run(AnalyticsGraph.empty(false), null);
        assertEquals(0, managed.statistics().getLastResultCount());
    }

    @Test
    public void testStatisticsSnapshotIsConsistent() {
        ManagedAlgorithm<Integer> managed = new ManagedAlgorithm<>(new DegreeAlgorithm(), 120);

        managed.run(GraphFixtures.undirected("a-b", "b-c"), null);
        AlgorithmStatistics first = managed.statistics();
        assertSame(first, managed.statistics());

        managed.run(GraphFixtures.undirected("a-b"), null);
        AlgorithmStatistics second = managed.statistics();

        // 旧快照不会被后一次运行改写
        assertEquals(3, first.getLastResultCount());
        assertEquals(2, second.getLastResultCount());
        assertNotSame(first, second);
        assertFalse(second.getLastRunTime().isBefore(first.getLastRunTime()));
        assertEquals(120, second.getTimeout());
    }
}
