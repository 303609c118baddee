package com.gdin.inspection.graphalgo.algorithm;

import com.gdin.inspection.graphalgo.graph.AnalyticsGraph;
import com.gdin.inspection.graphalgo.models.AlgorithmRunResult;
import com.gdin.inspection.graphalgo.models.AlgorithmStatistics;
import com.gdin.inspection.graphalgo.storage.ResultWriter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一组按名字注册的算法。注册顺序即 runAll 的执行顺序，算法之间互不影响。
 */
@Slf4j
public abstract class AlgorithmRegistry<V extends Number> {

    private final Map<String, ManagedAlgorithm<V>> algorithms = new LinkedHashMap<>();

    protected void register(ManagedAlgorithm<V> algorithm) {
        algorithms.put(algorithm.name(), algorithm);
    }

    /**
     * 是否允许创建社区节点，中心性一类的注册表覆盖为 false。
     */
    protected boolean supportsCommunityNodes() {
        return true;
    }

    public List<String> availableNames() {
        return Collections.unmodifiableList(new ArrayList<>(algorithms.keySet()));
    }

    public boolean contains(String name) {
        return algorithms.containsKey(name);
    }

    public Map<String, AlgorithmRunResult<V>> runAll(
            AnalyticsGraph graph,
            boolean writeBack,
            ResultWriter writer,
            boolean createCommunityNodes,
            Map<String, AlgorithmParameters> parametersByName
    ) {
        log.info("依次运行 {} 个算法：{}", algorithms.size(), algorithms.keySet());
        Map<String, AlgorithmRunResult<V>> results = new LinkedHashMap<>();
        for (ManagedAlgorithm<V> algorithm : algorithms.values()) {
            AlgorithmParameters params = parametersByName == null ? null : parametersByName.get(algorithm.name());
            results.put(algorithm.name(), runManaged(algorithm, graph, writeBack, writer, createCommunityNodes, params));
        }
        return results;
    }

    public AlgorithmRunResult<V> runOne(
            String name,
            AnalyticsGraph graph,
            boolean writeBack,
            ResultWriter writer,
            boolean createCommunityNodes,
            AlgorithmParameters parameters
    ) {
        ManagedAlgorithm<V> algorithm = algorithms.get(name);
        if (algorithm == null) {
            throw new AlgorithmNotFoundException(name, algorithms.keySet());
        }
        return runManaged(algorithm, graph, writeBack, writer, createCommunityNodes, parameters);
    }

    public Map<String, AlgorithmStatistics> statistics() {
        Map<String, AlgorithmStatistics> stats = new LinkedHashMap<>();
        algorithms.forEach((name, algorithm) -> stats.put(name, algorithm.statistics()));
        return stats;
    }

    private AlgorithmRunResult<V> runManaged(
            ManagedAlgorithm<V> algorithm,
            AnalyticsGraph graph,
            boolean writeBack,
            ResultWriter writer,
            boolean createCommunityNodes,
            AlgorithmParameters parameters
    ) {
        return algorithm.run(graph, writeBack, writer, createCommunityNodes && supportsCommunityNodes(), parameters);
    }
}
