package com.gdin.inspection.graphalgo.algorithm.centrality;

import com.gdin.inspection.graphalgo.algorithm.AlgorithmParameters;
import com.gdin.inspection.graphalgo.algorithm.GraphAlgorithm;
import com.gdin.inspection.graphalgo.graph.AnalyticsGraph;
import com.gdin.inspection.graphalgo.graph.GraphEdge;
import lombok.extern.slf4j.Slf4j;
import org.jgrapht.alg.scoring.BetweennessCentrality;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 介数中心性，参数：normalized、weight。
 * 抽样近似（k）不支持，传了也按精确计算。
 *
 * JGraphT 对无向图先把分值减半再除以 (n-1)(n-2)，归一化时乘回 2，
 * 使无向图的取值范围也是 [0, 1]（路径中点、星形中心为 1）。
 */
@Slf4j
public class BetweennessCentralityAlgorithm implements GraphAlgorithm<Double> {

    public static final String NAME = "betweenness_centrality";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Double> compute(AnalyticsGraph graph, AlgorithmParameters parameters) {
        boolean normalized = parameters.getBoolean("normalized", true);
        String weight = parameters.getString("weight", null);
        if (parameters.contains("k")) {
            log.warn("[{}] 不支持抽样参数 k={}，按全量精确计算", NAME, parameters.getInt("k", null));
        }

        BetweennessCentrality<String, GraphEdge> betweenness =
                new BetweennessCentrality<>(graph.weightedView(weight), normalized);
        Map<String, Double> scores = new LinkedHashMap<>(betweenness.getScores());
        if (normalized && !graph.isDirected()) {
            scores.replaceAll((id, score) -> score * 2);
        }
        return scores;
    }
}
