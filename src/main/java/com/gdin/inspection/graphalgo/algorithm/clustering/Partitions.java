package com.gdin.inspection.graphalgo.algorithm.clustering;

import org.jgrapht.Graph;
import org.jgrapht.graph.AsUndirectedGraph;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class Partitions {

    private Partitions() {
    }

    /**
     * 簇列表 -> 节点到社区编号，编号从 0 开始按簇的顺序分配。
     */
    public static <V> Map<V, Integer> toMembership(List<Set<V>> clusters) {
        Map<V, Integer> membership = new LinkedHashMap<>();
        int id = 0;
        for (Set<V> cluster : clusters) {
            if (cluster.isEmpty()) continue;
            for (V v : cluster) membership.put(v, id);
            id++;
        }
        return membership;
    }

    /**
     * 有向图返回无向视图，无向图原样返回。
     */
    public static <V, E> Graph<V, E> undirected(Graph<V, E> graph) {
        if (graph.getType().isUndirected()) return graph;
        return new AsUndirectedGraph<>(graph);
    }
}
