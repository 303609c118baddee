package com.gdin.inspection.graphalgo.algorithm.community;

import com.gdin.inspection.graphalgo.algorithm.GraphAlgorithm;
import com.gdin.inspection.graphalgo.algorithm.community.cluster.GraphClusterClient;
import com.gdin.inspection.graphalgo.config.properties.GraphAlgoProperties;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * 可用的社区发现算法。greedy_modularity 不受开关控制，始终注册。
 */
public enum CommunityAlgorithmType {

    LOUVAIN(GraphAlgoProperties.Algorithms::isLouvain, client -> new LouvainAlgorithm()),
    LABEL_PROPAGATION(GraphAlgoProperties.Algorithms::isLabelPropagation, client -> new LabelPropagationAlgorithm()),
    LEIDEN(GraphAlgoProperties.Algorithms::isLeiden, LeidenAlgorithm::new),
    GREEDY_MODULARITY(algorithms -> true, client -> new GreedyModularityAlgorithm());

    private final Predicate<GraphAlgoProperties.Algorithms> toggle;

    private final Function<GraphClusterClient, GraphAlgorithm<Integer>> factory;

    CommunityAlgorithmType(
            Predicate<GraphAlgoProperties.Algorithms> toggle,
            Function<GraphClusterClient, GraphAlgorithm<Integer>> factory
    ) {
        this.toggle = toggle;
        this.factory = factory;
    }

    public boolean isEnabled(GraphAlgoProperties.Algorithms algorithms) {
        return toggle.test(algorithms);
    }

    public GraphAlgorithm<Integer> create(GraphClusterClient clusterClient) {
        return factory.apply(clusterClient);
    }
}
