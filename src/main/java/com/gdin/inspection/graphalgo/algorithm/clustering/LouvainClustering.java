package com.gdin.inspection.graphalgo.algorithm.clustering;

import org.jgrapht.Graph;
import org.jgrapht.alg.interfaces.ClusteringAlgorithm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Louvain 社区发现（无向、带权）。
 *
 * 每一层：按随机顺序逐个节点尝试移动到模块度增益最大的邻居社区，直到一轮没有节点移动；
 * 然后把社区折叠成超节点进入下一层。某一层没有任何移动时结束。
 * 自环权重在度数里计两次。
 */
public class LouvainClustering<V, E> implements ClusteringAlgorithm<V> {

    private static final double EPSILON = 1e-12;

    private final Graph<V, E> graph;

    private final double resolution;

    private final Random rng;

    private Clustering<V> clustering;

    public LouvainClustering(Graph<V, E> graph, double resolution, Random rng) {
        if (graph.getType().isDirected()) {
            throw new IllegalArgumentException("Louvain requires an undirected graph");
        }
        this.graph = graph;
        this.resolution = resolution;
        this.rng = rng;
    }

    @Override
    public Clustering<V> getClustering() {
        if (clustering == null) {
            clustering = new ClusteringImpl<>(compute());
        }
        return clustering;
    }

    private List<Set<V>> compute() {
        List<V> vertices = new ArrayList<>(graph.vertexSet());
        int n = vertices.size();
        if (n == 0) return Collections.emptyList();

        Map<V, Integer> index = new HashMap<>();
        for (int i = 0; i < n; i++) index.put(vertices.get(i), i);

        List<Map<Integer, Double>> adj = new ArrayList<>(n);
        for (int i = 0; i < n; i++) adj.add(new HashMap<>());
        for (E e : graph.edgeSet()) {
            int s = index.get(graph.getEdgeSource(e));
            int t = index.get(graph.getEdgeTarget(e));
            double w = graph.getEdgeWeight(e);
            adj.get(s).merge(t, w, Double::sum);
            if (s != t) adj.get(t).merge(s, w, Double::sum);
        }

        // membership[i]：原始节点 i 当前所在的超节点
        int[] membership = new int[n];
        for (int i = 0; i < n; i++) membership[i] = i;

        while (true) {
            int[] level = oneLevel(adj);
            if (level == null) break;
            for (int i = 0; i < n; i++) membership[i] = level[membership[i]];
            adj = aggregate(adj, level);
        }

        Map<Integer, Set<V>> clusters = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            clusters.computeIfAbsent(membership[i], k -> new LinkedHashSet<>()).add(vertices.get(i));
        }
        return new ArrayList<>(clusters.values());
    }

    /**
     * 一层局部移动。
     *
     * @return 节点 -> 稠密社区编号；一个节点都没移动时返回 null
     */
    private int[] oneLevel(List<Map<Integer, Double>> adj) {
        int n = adj.size();
        double[] k = new double[n];
        double m2 = 0d;
        for (int i = 0; i < n; i++) {
            for (Map.Entry<Integer, Double> entry : adj.get(i).entrySet()) {
                k[i] += entry.getKey() == i ? 2 * entry.getValue() : entry.getValue();
            }
            m2 += k[i];
        }
        if (m2 == 0d) return null;

        int[] community = new int[n];
        double[] tot = new double[n];
        for (int i = 0; i < n; i++) {
            community[i] = i;
            tot[i] = k[i];
        }

        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) order.add(i);
        Collections.shuffle(order, rng);

        boolean improved = false;
        boolean moved = true;
        while (moved) {
            moved = false;
            for (int i : order) {
                int current = community[i];
                Map<Integer, Double> weightToCommunity = new LinkedHashMap<>();
                for (Map.Entry<Integer, Double> entry : adj.get(i).entrySet()) {
                    int j = entry.getKey();
                    if (j == i) continue;
                    weightToCommunity.merge(community[j], entry.getValue(), Double::sum);
                }

                tot[current] -= k[i];
                int best = current;
                double bestGain = weightToCommunity.getOrDefault(current, 0d) - resolution * k[i] * tot[current] / m2;
                for (Map.Entry<Integer, Double> entry : weightToCommunity.entrySet()) {
                    int c = entry.getKey();
                    double gain = entry.getValue() - resolution * k[i] * tot[c] / m2;
                    if (gain > bestGain + EPSILON) {
                        best = c;
                        bestGain = gain;
                    }
                }
                tot[best] += k[i];
                community[i] = best;
                if (best != current) {
                    moved = true;
                    improved = true;
                }
            }
        }
        if (!improved) return null;

        Map<Integer, Integer> dense = new HashMap<>();
        int[] result = new int[n];
        for (int i = 0; i < n; i++) {
            result[i] = dense.computeIfAbsent(community[i], c -> dense.size());
        }
        return result;
    }

    private static List<Map<Integer, Double>> aggregate(List<Map<Integer, Double>> adj, int[] community) {
        int size = 0;
        for (int c : community) size = Math.max(size, c + 1);
        List<Map<Integer, Double>> next = new ArrayList<>(size);
        for (int c = 0; c < size; c++) next.add(new HashMap<>());

        for (int i = 0; i < adj.size(); i++) {
            int ci = community[i];
            for (Map.Entry<Integer, Double> entry : adj.get(i).entrySet()) {
                int j = entry.getKey();
                double w = entry.getValue();
                if (j == i) {
                    next.get(ci).merge(ci, w, Double::sum);
                } else if (i < j) {
                    int cj = community[j];
                    if (ci == cj) {
                        next.get(ci).merge(ci, w, Double::sum);
                    } else {
                        next.get(ci).merge(cj, w, Double::sum);
                        next.get(cj).merge(ci, w, Double::sum);
                    }
                }
            }
        }
        return next;
    }

    /**
     * 便捷入口：把图当作无向图跑一次 Louvain。
     */
    public static <V, E> List<Set<V>> cluster(Graph<V, E> graph, double resolution, Random rng) {
        return new LouvainClustering<>(Partitions.undirected(graph), resolution, rng).getClustering().getClusters();
    }
}
