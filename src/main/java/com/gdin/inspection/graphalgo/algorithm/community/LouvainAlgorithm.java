package com.gdin.inspection.graphalgo.algorithm.community;

import com.gdin.inspection.graphalgo.algorithm.AlgorithmParameters;
import com.gdin.inspection.graphalgo.algorithm.GraphAlgorithm;
import com.gdin.inspection.graphalgo.algorithm.clustering.LouvainClustering;
import com.gdin.inspection.graphalgo.algorithm.clustering.Partitions;
import com.gdin.inspection.graphalgo.graph.AnalyticsGraph;

import java.util.Map;
import java.util.Random;

/**
 * Louvain，参数：resolution、random_state、weight（默认读边上的 weight 属性，没有则按 1）。
 * 有向图按无向处理。
 */
public class LouvainAlgorithm implements GraphAlgorithm<Integer> {

    public static final String NAME = "louvain";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Integer> compute(AnalyticsGraph graph, AlgorithmParameters parameters) {
        double resolution = parameters.getDouble("resolution", 1.0);
        Long seed = parameters.getLong("random_state", null);
        String weight = parameters.getString("weight", "weight");

        Random rng = seed == null ? new Random() : new Random(seed);
        return Partitions.toMembership(LouvainClustering.cluster(graph.weightedView(weight), resolution, rng));
    }
}
