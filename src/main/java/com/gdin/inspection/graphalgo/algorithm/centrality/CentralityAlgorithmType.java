package com.gdin.inspection.graphalgo.algorithm.centrality;

import com.gdin.inspection.graphalgo.algorithm.GraphAlgorithm;
import com.gdin.inspection.graphalgo.config.properties.GraphAlgoProperties;

import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 可用的中心性算法：配置开关、实现。
 */
public enum CentralityAlgorithmType {

    PAGERANK(GraphAlgoProperties.Algorithms::isPagerank, PageRankAlgorithm::new),
    BETWEENNESS(GraphAlgoProperties.Algorithms::isBetweenness, BetweennessCentralityAlgorithm::new),
    CLOSENESS(GraphAlgoProperties.Algorithms::isCloseness, ClosenessCentralityAlgorithm::new),
    EIGENVECTOR(GraphAlgoProperties.Algorithms::isEigenvector, EigenvectorCentralityAlgorithm::new);

    private final Predicate<GraphAlgoProperties.Algorithms> toggle;

    private final Supplier<GraphAlgorithm<Double>> factory;

    CentralityAlgorithmType(
            Predicate<GraphAlgoProperties.Algorithms> toggle,
            Supplier<GraphAlgorithm<Double>> factory
    ) {
        this.toggle = toggle;
        this.factory = factory;
    }

    public boolean isEnabled(GraphAlgoProperties.Algorithms algorithms) {
        return toggle.test(algorithms);
    }

    public GraphAlgorithm<Double> create() {
        return factory.get();
    }
}
