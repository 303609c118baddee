package com.gdin.inspection.graphalgo.algorithm.community;

import com.gdin.inspection.graphalgo.algorithm.AlgorithmParameters;
import com.gdin.inspection.graphalgo.algorithm.GraphAlgorithm;
import com.gdin.inspection.graphalgo.algorithm.clustering.Partitions;
import com.gdin.inspection.graphalgo.graph.AnalyticsGraph;
import com.gdin.inspection.graphalgo.graph.GraphEdge;
import org.jgrapht.alg.clustering.LabelPropagationClustering;

import java.util.Map;
import java.util.Random;

/**
 * 标签传播，参数：max_iter（0 表示直到收敛）、seed。有向图按无向处理。
 */
public class LabelPropagationAlgorithm implements GraphAlgorithm<Integer> {

    public static final String NAME = "label_propagation";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Integer> compute(AnalyticsGraph graph, AlgorithmParameters parameters) {
        int maxIter = parameters.getInt("max_iter", 30);
        Long seed = parameters.getLong("seed", null);

        Random rng = seed == null ? new Random() : new Random(seed);
        LabelPropagationClustering<String, GraphEdge> clustering =
                new LabelPropagationClustering<>(Partitions.undirected(graph.view()), maxIter, rng);
        return Partitions.toMembership(clustering.getClustering().getClusters());
    }
}
