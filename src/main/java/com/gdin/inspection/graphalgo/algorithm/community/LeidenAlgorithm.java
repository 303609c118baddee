package com.gdin.inspection.graphalgo.algorithm.community;

import com.gdin.inspection.graphalgo.algorithm.AlgorithmParameters;
import com.gdin.inspection.graphalgo.algorithm.GraphAlgorithm;
import com.gdin.inspection.graphalgo.algorithm.community.cluster.ClusterEdge;
import com.gdin.inspection.graphalgo.algorithm.community.cluster.GraphClusterClient;
import com.gdin.inspection.graphalgo.algorithm.community.cluster.LeidenCluster;
import com.gdin.inspection.graphalgo.graph.AnalyticsGraph;
import com.gdin.inspection.graphalgo.graph.GraphEdge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Leiden，交给外部聚类服务计算，参数：resolution、n_iterations、seed、level（取哪一层，默认 0）、weight。
 *
 * 服务未配置时退化为 Louvain（同样的参数）。
 * 服务只认识边，孤立节点各自单独成社区；最终编号重新压成从 0 开始的连续整数。
 */
@Slf4j
@RequiredArgsConstructor
public class LeidenAlgorithm implements GraphAlgorithm<Integer> {

    public static final String NAME = "leiden";

    private final GraphClusterClient clusterClient;

    private final LouvainAlgorithm fallback = new LouvainAlgorithm();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Integer> compute(AnalyticsGraph graph, AlgorithmParameters parameters) {
        if (clusterClient == null || !clusterClient.isAvailable()) {
            log.warn("[{}] 聚类服务未配置，改用 louvain", NAME);
            return fallback.compute(graph, parameters);
        }

        double resolution = parameters.getDouble("resolution", 1.0);
        int iterations = parameters.getInt("n_iterations", 2);
        Integer seed = parameters.getInt("seed", null);
        int level = parameters.getInt("level", 0);
        String weight = parameters.getString("weight", null);

        List<ClusterEdge> edges = new ArrayList<>(graph.edgeCount());
        for (GraphEdge edge : graph.edges()) {
            edges.add(new ClusterEdge(edge.getSource(), edge.getTarget(), edge.weight(weight)));
        }

        List<LeidenCluster> clusters = clusterClient.clusterGraph(edges, resolution, iterations, seed);

        // 只取指定层，按社区编号排序保证结果稳定
        Map<Integer, List<String>> byCommunity = new TreeMap<>();
        for (LeidenCluster cluster : clusters) {
            if (cluster.getLevel() != level || cluster.getNodeIds() == null) continue;
            byCommunity.computeIfAbsent(cluster.getCommunityId(), k -> new ArrayList<>()).addAll(cluster.getNodeIds());
        }

        Map<String, Integer> partition = new LinkedHashMap<>();
        int next = 0;
        for (List<String> members : byCommunity.values()) {
            boolean used = false;
            for (String id : members) {
                if (!graph.containsNode(id) || partition.containsKey(id)) continue;
                partition.put(id, next);
                used = true;
            }
            if (used) next++;
        }
        for (String id : graph.nodeIds()) {
            if (!partition.containsKey(id)) partition.put(id, next++);
        }
        return partition;
    }
}
