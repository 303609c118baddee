package com.gdin.inspection.graphalgo.algorithm;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.graphalgo.graph.AnalyticsGraph;
import com.gdin.inspection.graphalgo.models.AlgorithmMetadata;
import com.gdin.inspection.graphalgo.models.AlgorithmRunResult;
import com.gdin.inspection.graphalgo.models.AlgorithmStatistics;
import com.gdin.inspection.graphalgo.storage.ResultWriter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * 给 {@link GraphAlgorithm} 套上统一的运行语义：
 * <ul>
 *     <li>空图直接返回空结果，metadata.empty_graph = true；</li>
 *     <li>compute 抛出的任何异常都记进 metadata.error，不向上抛；</li>
 *     <li>writeBack 时交给 {@link ResultWriter}，写回失败不影响内存中的结果；</li>
 *     <li>每次运行（包括失败）都刷新统计信息，以不可变快照整体发布。</li>
 * </ul>
 */
@Slf4j
public class ManagedAlgorithm<V extends Number> {

    private final GraphAlgorithm<V> algorithm;

    private final int timeoutSeconds;

    // 整体替换，读到的时间、耗时、条数总是同一次运行的
    private volatile AlgorithmStatistics statistics;

    public ManagedAlgorithm(GraphAlgorithm<V> algorithm, int timeoutSeconds) {
        this.algorithm = algorithm;
        this.timeoutSeconds = timeoutSeconds;
        this.statistics = AlgorithmStatistics.builder()
                .name(algorithm.name())
                .timeout(timeoutSeconds)
                .build();
    }

    public String name() {
        return algorithm.name();
    }

    public AlgorithmRunResult<V> run(AnalyticsGraph graph, AlgorithmParameters parameters) {
        return run(graph, false, null, false, parameters);
    }

    public AlgorithmRunResult<V> run(
            AnalyticsGraph graph,
            boolean writeBack,
            ResultWriter writer,
            boolean createCommunityNodes,
            AlgorithmParameters parameters
    ) {
        String name = algorithm.name();
        AlgorithmParameters params = parameters == null ? AlgorithmParameters.empty() : parameters;
        long t0 = System.nanoTime();
        Instant startedAt = Instant.now();

        if (graph == null || graph.nodeCount() == 0) {
            log.warn("[{}] 空图，跳过计算", name);
            AlgorithmMetadata metadata = AlgorithmMetadata.builder()
                    .algorithm(name)
                    .durationSeconds(elapsedSeconds(t0))
                    .resultCount(0)
                    .graphNodes(0)
                    .graphEdges(graph == null ? 0 : graph.edgeCount())
                    .timestamp(startedAt)
                    .emptyGraph(true)
                    .build();
            recordStatistics(startedAt, metadata.getDurationSeconds(), 0);
            return AlgorithmRunResult.<V>builder().results(Collections.emptyMap()).metadata(metadata).build();
        }

        log.info("[{}] 开始运行：nodes={}, edges={}, params={}", name, graph.nodeCount(), graph.edgeCount(), params);

        Map<String, V> results;
        try {
            results = algorithm.compute(graph, params);
            if (results == null) results = Collections.emptyMap();
        } catch (Exception e) {
            double duration = elapsedSeconds(t0);
            log.error("[{}] 运行失败，耗时 {}s", name, String.format("%.3f", duration), e);
            AlgorithmMetadata metadata = AlgorithmMetadata.builder()
                    .algorithm(name)
                    .durationSeconds(duration)
                    .resultCount(0)
                    .graphNodes(graph.nodeCount())
                    .graphEdges(graph.edgeCount())
                    .timestamp(startedAt)
                    .error(errorMessage(e))
                    .build();
            recordStatistics(startedAt, duration, 0);
            return AlgorithmRunResult.<V>builder().results(Collections.emptyMap()).metadata(metadata).build();
        }

        double duration = elapsedSeconds(t0);
        AlgorithmMetadata metadata = AlgorithmMetadata.builder()
                .algorithm(name)
                .durationSeconds(duration)
                .resultCount(results.size())
                .graphNodes(graph.nodeCount())
                .graphEdges(graph.edgeCount())
                .timestamp(startedAt)
                .build();
        recordStatistics(startedAt, duration, results.size());
        log.info("[{}] 完成：结果 {} 条，耗时 {}s", name, results.size(), String.format("%.3f", duration));

        if (writeBack && writer != null) {
            writeBack(name, results, metadata, writer, createCommunityNodes);
        }

        return AlgorithmRunResult.<V>builder().results(results).metadata(metadata).build();
    }

    private void writeBack(
            String name,
            Map<String, V> results,
            AlgorithmMetadata metadata,
            ResultWriter writer,
            boolean createCommunityNodes
    ) {
        try {
            boolean ok = writer.writeScalarResults(name, results, metadata);
            metadata.setWrittenBack(ok);
            if (!ok) log.warn("[{}] 结果写回未全部成功", name);
        } catch (Exception e) {
            log.error("[{}] 结果写回异常", name, e);
            metadata.setWrittenBack(false);
            metadata.setWriteBackError(errorMessage(e));
        }

        if (!createCommunityNodes || results.isEmpty()) return;

        try {
            Map<Integer, String> uids = writer.createCommunityEntities(name, results, metadata);
            metadata.setCommunityEntitiesCreated(uids.size());
            metadata.setCommunityUids(uids);
            log.info("[{}] 新建社区节点 {} 个", name, uids.size());
        } catch (Exception e) {
            log.error("[{}] 社区节点创建失败", name, e);
            metadata.setCommunityCreationError(errorMessage(e));
        }
    }

    public AlgorithmStatistics statistics() {
        return statistics;
    }

    private void recordStatistics(Instant runTime, double duration, int resultCount) {
        this.statistics = AlgorithmStatistics.builder()
                .name(algorithm.name())
                .lastRunTime(runTime)
                .lastRunDuration(duration)
                .lastResultCount(resultCount)
                .timeout(timeoutSeconds)
                .build();
    }

    private static double elapsedSeconds(long t0) {
        return (System.nanoTime() - t0) / 1_000_000_000.0;
    }

    private static String errorMessage(Exception e) {
        return StrUtil.isNotBlank(e.getMessage()) ? e.getMessage() : e.getClass().getSimpleName();
    }
}
