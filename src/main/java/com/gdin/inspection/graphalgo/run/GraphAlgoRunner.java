package com.gdin.inspection.graphalgo.run;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.graphalgo.algorithm.AlgorithmParameters;
import com.gdin.inspection.graphalgo.algorithm.centrality.CentralityAlgorithms;
import com.gdin.inspection.graphalgo.algorithm.community.CommunityAnalyzer;
import com.gdin.inspection.graphalgo.algorithm.community.CommunityDetection;
import com.gdin.inspection.graphalgo.config.properties.GraphAlgoProperties;
import com.gdin.inspection.graphalgo.graph.AnalyticsGraph;
import com.gdin.inspection.graphalgo.graph.GraphBuilder;
import com.gdin.inspection.graphalgo.graph.GraphEdge;
import com.gdin.inspection.graphalgo.graph.GraphNode;
import com.gdin.inspection.graphalgo.models.AlgorithmMetadata;
import com.gdin.inspection.graphalgo.models.AlgorithmRunResult;
import com.gdin.inspection.graphalgo.models.CommunityAnalysis;
import com.gdin.inspection.graphalgo.models.GraphData;
import com.gdin.inspection.graphalgo.models.GraphInfo;
import com.gdin.inspection.graphalgo.storage.GraphStore;
import com.gdin.inspection.graphalgo.storage.ResultWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.IntSummaryStatistics;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * 拉图 -> 构图 -> 跑算法 -> 写回 的入口，定时任务和其他调用方都走这里。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphAlgoRunner {

    public static final String ALL = "all";

    static final String UNKNOWN_TYPE = "unknown";

    private final GraphStore graphStore;

    private final GraphBuilder graphBuilder;

    private final CentralityAlgorithms centralityAlgorithms;

    private final CommunityDetection communityDetection;

    private final CommunityAnalyzer communityAnalyzer;

    private final ResultWriter resultWriter;

    private final GraphAlgoProperties graphAlgoProperties;

    public AnalyticsGraph buildGraph(GraphRequest request) {
        String entityType = StrUtil.blankToDefault(request.getEntityType(), graphAlgoProperties.getDefaultEntityType());
        int limit = request.getLimit() == null || request.getLimit() <= 0
                ? graphAlgoProperties.getMaxGraphSize()
                : request.getLimit();

        GraphData data = graphStore.fetchGraphData(entityType, limit);
        return graphBuilder.build(data, request.isDirected(), request.isIncludeSelfLoops(), request.getMinDegree());
    }

    public GraphInfo graphInfo(GraphRequest request) {
        return graphInfo(buildGraph(request));
    }

    public GraphInfo graphInfo(AnalyticsGraph graph) {
        IntSummaryStatistics degrees = graph.degrees().values().stream()
                .mapToInt(Integer::intValue)
                .summaryStatistics();
        boolean empty = degrees.getCount() == 0;

        Map<String, Integer> nodeTypes = new TreeMap<>();
        for (GraphNode node : graph.nodes()) {
            nodeTypes.merge(StrUtil.blankToDefault(node.getType(), UNKNOWN_TYPE), 1, Integer::sum);
        }
        Map<String, Integer> edgeTypes = new TreeMap<>();
        for (GraphEdge edge : graph.edges()) {
            edgeTypes.merge(StrUtil.blankToDefault(edge.getRelationshipType(), UNKNOWN_TYPE), 1, Integer::sum);
        }

        GraphInfo info = GraphInfo.builder()
                .nodes(graph.nodeCount())
                .edges(graph.edgeCount())
                .directed(graph.isDirected())
                .density(graph.density())
                .connected(graph.isConnected())
                .averageDegree(empty ? 0d : degrees.getAverage())
                .maxDegree(empty ? 0 : degrees.getMax())
                .minDegree(empty ? 0 : degrees.getMin())
                .nodeTypes(nodeTypes)
                .edgeTypes(edgeTypes)
                .build();
        log.info("图概要：nodes={}, edges={}, density={}, connected={}",
                info.getNodes(), info.getEdges(), String.format("%.4f", info.getDensity()), info.isConnected());
        return info;
    }

    /**
     * @param name 算法名，或 all 表示全部已启用的中心性算法
     */
    public Map<String, AlgorithmRunResult<Double>> runCentrality(
            String name,
            AnalyticsGraph graph,
            boolean writeBack,
            Map<String, AlgorithmParameters> parameters
    ) {
        if (StrUtil.isBlank(name) || ALL.equalsIgnoreCase(name)) {
            return centralityAlgorithms.runAll(graph, writeBack, resultWriter, false, parameters);
        }
        Map<String, AlgorithmRunResult<Double>> results = new LinkedHashMap<>();
        results.put(name, centralityAlgorithms.runOne(name, graph, writeBack, resultWriter, false, paramsFor(name, parameters)));
        return results;
    }

    /**
     * @param name 算法名，或 all 表示全部已启用的社区发现算法
     */
    public Map<String, AlgorithmRunResult<Integer>> runCommunity(
            String name,
            AnalyticsGraph graph,
            boolean writeBack,
            boolean createCommunityNodes,
            Map<String, AlgorithmParameters> parameters
    ) {
        if (StrUtil.isBlank(name) || ALL.equalsIgnoreCase(name)) {
            return communityDetection.runAll(graph, writeBack, resultWriter, createCommunityNodes, parameters);
        }
        Map<String, AlgorithmRunResult<Integer>> results = new LinkedHashMap<>();
        results.put(name, communityDetection.runOne(
                name, graph, writeBack, resultWriter, createCommunityNodes, paramsFor(name, parameters)));
        return results;
    }

    public CommunityAnalysis analyzeCommunities(AnalyticsGraph graph, Map<String, ? extends Number> partition) {
        return communityAnalyzer.analyze(graph, partition);
    }

    /**
     * 批量任务：按默认参数构图，跑 scope 内全部算法并写回。图为空时整批跳过。
     */
    public JobReport runJob(AlgorithmScope scope, boolean createCommunityNodes) {
        long t0 = System.nanoTime();
        log.info("开始批量任务：scope={}", scope);

        AnalyticsGraph graph = buildGraph(GraphRequest.defaults());
        if (graph.nodeCount() == 0) {
            log.warn("图为空，跳过 {} 任务", scope);
            return JobReport.builder()
                    .scope(scope)
                    .skipped(true)
                    .durationSeconds(elapsedSeconds(t0))
                    .build();
        }

        Map<String, AlgorithmMetadata> centrality = new LinkedHashMap<>();
        Map<String, AlgorithmMetadata> community = new LinkedHashMap<>();
        Map<String, CommunityAnalysis> analyses = new LinkedHashMap<>();
        int total = 0;

        if (scope.includesCentrality()) {
            for (Map.Entry<String, AlgorithmRunResult<Double>> entry : runCentrality(ALL, graph, true, null).entrySet()) {
                centrality.put(entry.getKey(), entry.getValue().getMetadata());
                total += entry.getValue().getResults().size();
            }
        }

        if (scope.includesCommunity()) {
            Map<String, AlgorithmRunResult<Integer>> results = runCommunity(ALL, graph, true, createCommunityNodes, null);
            for (Map.Entry<String, AlgorithmRunResult<Integer>> entry : results.entrySet()) {
                community.put(entry.getKey(), entry.getValue().getMetadata());
                Map<String, Integer> partition = entry.getValue().getResults();
                total += partition.size();
                if (!partition.isEmpty()) {
                    CommunityAnalysis analysis = analyzeCommunities(graph, partition);
                    analyses.put(entry.getKey(), analysis);
                    log.info("{} 社区统计：{} 个社区，modularity={}",
                            entry.getKey(), analysis.getNumCommunities(), analysis.getModularity());
                }
            }
        }

        double duration = elapsedSeconds(t0);
        log.info("批量任务完成：scope={}, 结果 {} 条，耗时 {}s", scope, total, String.format("%.3f", duration));
        return JobReport.builder()
                .scope(scope)
                .skipped(false)
                .graphNodes(graph.nodeCount())
                .graphEdges(graph.edgeCount())
                .centrality(centrality)
                .community(community)
                .analyses(analyses)
                .totalResults(total)
                .durationSeconds(duration)
                .build();
    }

    public JobReport runAll() {
        return runJob(AlgorithmScope.ALL, graphAlgoProperties.getScheduler().isCreateCommunityNodes());
    }

    private static AlgorithmParameters paramsFor(String name, Map<String, AlgorithmParameters> parameters) {
        return parameters == null ? null : parameters.get(name);
    }

    private static double elapsedSeconds(long t0) {
        return (System.nanoTime() - t0) / 1_000_000_000.0;
    }
}
