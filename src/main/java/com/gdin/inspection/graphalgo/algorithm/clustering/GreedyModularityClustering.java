package com.gdin.inspection.graphalgo.algorithm.clustering;

import org.jgrapht.Graph;
import org.jgrapht.alg.interfaces.ClusteringAlgorithm;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;

/**
 * Clauset-Newman-Moore 贪心模块度聚类（无向、带权）。
 *
 * 从每个节点单独成社区开始，每一步合并模块度增益 dq 最大的一对相邻社区：
 * <ul>
 *     <li>社区数降到 cutoff 时停止；</li>
 *     <li>最大增益为负且社区数已不超过 bestN 时停止；</li>
 *     <li>没有相邻社区可合并时停止。</li>
 * </ul>
 * 结果按社区大小降序。
 *
 * 候选合并放在最大堆里，每次合并只重算新社区与其邻居之间的 dq。
 */
public class GreedyModularityClustering<V, E> implements ClusteringAlgorithm<V> {

    private final Graph<V, E> graph;

    private final double resolution;

    private final int cutoff;

    private final int bestN;

    private Clustering<V> clustering;

    private static final Comparator<Candidate> CANDIDATE_ORDER = Comparator
            .comparingDouble((Candidate c) -> c.dq).reversed()
            .thenComparingInt(c -> c.i)
            .thenComparingInt(c -> c.j);

    private static final class Candidate {
        final double dq;
        final int i;
        final int j;

        Candidate(double dq, int i, int j) {
            this.dq = dq;
            this.i = i;
            this.j = j;
        }
    }

    public GreedyModularityClustering(Graph<V, E> graph, double resolution, int cutoff, Integer bestN) {
        if (graph.getType().isDirected()) {
            throw new IllegalArgumentException("greedy modularity requires an undirected graph");
        }
        int n = graph.vertexSet().size();
        if (cutoff < 1 || cutoff > Math.max(n, 1)) {
            throw new IllegalArgumentException("cutoff must be between 1 and " + n + ", got " + cutoff);
        }
        int best = bestN == null ? n : bestN;
        if (bestN != null && (best < cutoff || best > n)) {
            throw new IllegalArgumentException("best_n must be between " + cutoff + " and " + n + ", got " + bestN);
        }
        this.graph = graph;
        this.resolution = resolution;
        this.cutoff = cutoff;
        this.bestN = best;
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
        Map<V, Integer> index = new HashMap<>();
        for (int i = 0; i < n; i++) index.put(vertices.get(i), i);

        // 社区 -> 成员；TreeMap 保证遍历顺序固定
        Map<Integer, Set<V>> communities = new TreeMap<>();
        for (int i = 0; i < n; i++) {
            Set<V> members = new LinkedHashSet<>();
            members.add(vertices.get(i));
            communities.put(i, members);
        }

        double m2 = 0d;
        double[] degree = new double[n];
        // e.get(i).get(j)：社区 i、j 之间的边权（未归一化）
        Map<Integer, Map<Integer, Double>> e = new TreeMap<>();
        for (int i = 0; i < n; i++) e.put(i, new TreeMap<>());
        for (E edge : graph.edgeSet()) {
            int s = index.get(graph.getEdgeSource(edge));
            int t = index.get(graph.getEdgeTarget(edge));
            double w = graph.getEdgeWeight(edge);
            degree[s] += w;
            degree[t] += w;
            m2 += 2 * w;
            if (s != t) {
                e.get(s).merge(t, w, Double::sum);
                e.get(t).merge(s, w, Double::sum);
            }
        }
        if (m2 == 0d) return sorted(communities);

        double[] a = new double[n];
        for (int i = 0; i < n; i++) a[i] = degree[i] / m2;

        // 候选合并按 dq 降序，同分时按 (i, j) 升序；合并后只为新社区的邻居补新候选，过期候选出堆时丢弃
        PriorityQueue<Candidate> heap = new PriorityQueue<>(CANDIDATE_ORDER);
        for (Map.Entry<Integer, Map<Integer, Double>> row : e.entrySet()) {
            int i = row.getKey();
            for (Map.Entry<Integer, Double> cell : row.getValue().entrySet()) {
                int j = cell.getKey();
                if (j > i) heap.add(new Candidate(deltaQ(i, j, cell.getValue(), m2, a), i, j));
            }
        }

        while (communities.size() > cutoff) {
            Candidate best = pollValid(heap, e, a, m2);
            if (best == null) break;
            if (best.dq < 0 && communities.size() <= bestN) break;

            merge(best.i, best.j, communities, e, a);
            for (Map.Entry<Integer, Double> cell : e.get(best.i).entrySet()) {
                int k = cell.getKey();
                int lo = Math.min(best.i, k);
                int hi = Math.max(best.i, k);
                heap.add(new Candidate(deltaQ(lo, hi, cell.getValue(), m2, a), lo, hi));
            }
        }
        return sorted(communities);
    }

    private double deltaQ(int i, int j, double eij, double m2, double[] a) {
        return 2 * (eij / m2 - resolution * a[i] * a[j]);
    }

    // 弹出第一个仍然有效的候选：两个社区都还在、仍相邻、dq 与当前状态一致
    private Candidate pollValid(PriorityQueue<Candidate> heap, Map<Integer, Map<Integer, Double>> e, double[] a, double m2) {
        while (!heap.isEmpty()) {
            Candidate top = heap.poll();
            Map<Integer, Double> row = e.get(top.i);
            if (row == null) continue;
            Double eij = row.get(top.j);
            if (eij == null) continue;
            if (deltaQ(top.i, top.j, eij, m2, a) != top.dq) continue;
            return top;
        }
        return null;
    }

    // 把 j 并入 i
    private void merge(int i, int j, Map<Integer, Set<V>> communities, Map<Integer, Map<Integer, Double>> e, double[] a) {
        communities.get(i).addAll(communities.remove(j));

        Map<Integer, Double> rowJ = e.remove(j);
        Map<Integer, Double> rowI = e.get(i);
        rowI.remove(j);
        for (Map.Entry<Integer, Double> cell : rowJ.entrySet()) {
            int k = cell.getKey();
            if (k == i) continue;
            rowI.merge(k, cell.getValue(), Double::sum);
            Map<Integer, Double> rowK = e.get(k);
            rowK.remove(j);
            rowK.merge(i, cell.getValue(), Double::sum);
        }
        a[i] += a[j];
        a[j] = 0d;
    }

    private List<Set<V>> sorted(Map<Integer, Set<V>> communities) {
        List<Set<V>> result = new ArrayList<>(communities.values());
        result.sort(Comparator.comparingInt((Set<V> c) -> c.size()).reversed());
        return result;
    }
}
