package com.gdin.inspection.graphalgo.algorithm.centrality;

import com.gdin.inspection.graphalgo.algorithm.AlgorithmParameters;
import com.gdin.inspection.graphalgo.algorithm.GraphAlgorithm;
import com.gdin.inspection.graphalgo.graph.AnalyticsGraph;
import com.gdin.inspection.graphalgo.graph.GraphEdge;
import org.jgrapht.Graph;
import org.jgrapht.alg.interfaces.ShortestPathAlgorithm;
import org.jgrapht.alg.shortestpath.DijkstraShortestPath;
import org.jgrapht.graph.EdgeReversedGraph;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 接近中心性：closeness(u) = (r - 1) / sum(d(v, u))，r 为能到达 u 的节点数（含 u）。
 *
 * 有向图用入向距离（在反向图上从 u 出发）。wf_improved 为 true 时再乘 (r - 1) / (n - 1)，
 * 让只能覆盖一小部分节点的分量得分降低。distance 指定作为距离的边属性，缺省每条边长度为 1。
 */
public class ClosenessCentralityAlgorithm implements GraphAlgorithm<Double> {

    public static final String NAME = "closeness_centrality";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Double> compute(AnalyticsGraph graph, AlgorithmParameters parameters) {
        boolean wfImproved = parameters.getBoolean("wf_improved", true);
        String distance = parameters.getString("distance", null);

        Graph<String, GraphEdge> view = graph.weightedView(distance);
        if (graph.isDirected()) {
            view = new EdgeReversedGraph<>(view);
        }
        DijkstraShortestPath<String, GraphEdge> dijkstra = new DijkstraShortestPath<>(view);

        int n = graph.nodeCount();
        Map<String, Double> closeness = new LinkedHashMap<>();
        for (String u : graph.nodeIds()) {
            ShortestPathAlgorithm.SingleSourcePaths<String, GraphEdge> paths = dijkstra.getPaths(u);
            double total = 0d;
            int reachable = 0;
            for (String v : graph.nodeIds()) {
                double d = paths.getWeight(v);
                if (Double.isInfinite(d)) continue;
                total += d;
                reachable++;
            }

            double value = 0d;
            if (total > 0d && n > 1) {
                value = (reachable - 1) / total;
                if (wfImproved) {
                    value *= (reachable - 1) / (double) (n - 1);
                }
            }
            closeness.put(u, value);
        }
        return closeness;
    }
}
