package com.gdin.inspection.graphalgo.algorithm.community;

import com.gdin.inspection.graphalgo.algorithm.AlgorithmParameters;
import com.gdin.inspection.graphalgo.algorithm.GraphAlgorithm;
import com.gdin.inspection.graphalgo.algorithm.clustering.GreedyModularityClustering;
import com.gdin.inspection.graphalgo.algorithm.clustering.Partitions;
import com.gdin.inspection.graphalgo.graph.AnalyticsGraph;
import com.gdin.inspection.graphalgo.graph.GraphEdge;

import java.util.Map;

/**
 * 贪心模块度（CNM），参数：resolution、cutoff、best_n、weight。
 * 社区编号按社区大小降序分配，0 号最大。
 */
public class GreedyModularityAlgorithm implements GraphAlgorithm<Integer> {

    public static final String NAME = "greedy_modularity";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Integer> compute(AnalyticsGraph graph, AlgorithmParameters parameters) {
        double resolution = parameters.getDouble("resolution", 1.0);
        int cutoff = parameters.getInt("cutoff", 1);
        Integer bestN = parameters.getInt("best_n", null);
        String weight = parameters.getString("weight", null);

        GreedyModularityClustering<String, GraphEdge> clustering = new GreedyModularityClustering<>(
                Partitions.undirected(graph.weightedView(weight)), resolution, cutoff, bestN);
        return Partitions.toMembership(clustering.getClustering().getClusters());
    }
}
