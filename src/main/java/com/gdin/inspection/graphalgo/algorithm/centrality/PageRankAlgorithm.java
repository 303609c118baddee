package com.gdin.inspection.graphalgo.algorithm.centrality;

import com.gdin.inspection.graphalgo.algorithm.AlgorithmParameters;
import com.gdin.inspection.graphalgo.algorithm.GraphAlgorithm;
import com.gdin.inspection.graphalgo.graph.AnalyticsGraph;
import com.gdin.inspection.graphalgo.graph.GraphEdge;
import org.jgrapht.Graph;
import org.jgrapht.alg.scoring.PageRank;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * PageRank，参数：alpha（阻尼系数）、max_iter、tol、weight（作为权重的边属性）。
 * 无向图上每条边按双向处理。
 */
public class PageRankAlgorithm implements GraphAlgorithm<Double> {

    public static final String NAME = "pagerank";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Double> compute(AnalyticsGraph graph, AlgorithmParameters parameters) {
        double alpha = parameters.getDouble("alpha", 0.85);
        int maxIter = parameters.getInt("max_iter", 100);
        double tol = parameters.getDouble("tol", 1e-6);
        String weight = parameters.getString("weight", null);

        Graph<String, GraphEdge> view = graph.weightedView(weight);
        PageRank<String, GraphEdge> pageRank = new PageRank<>(view, alpha, maxIter, tol);
        return new LinkedHashMap<>(pageRank.getScores());
    }
}
