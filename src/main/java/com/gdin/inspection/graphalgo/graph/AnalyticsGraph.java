package com.gdin.inspection.graphalgo.graph;

import cn.hutool.core.util.StrUtil;
import org.jgrapht.Graph;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.AsWeightedGraph;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultUndirectedGraph;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 一次算法调用使用的内存图。
 *
 * 底层是 JGraphT 的 DefaultDirectedGraph / DefaultUndirectedGraph：允许自环、不允许平行边，
 * 同一 (source, target) 重复加边时只覆盖属性。节点属性单独放在 nodes 里。
 *
 * 只有同包的 GraphBuilder 能修改它；算法拿到的是 {@link #view()} 返回的只读视图。
 */
public class AnalyticsGraph {

    private final boolean directed;

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();

    private final Graph<String, GraphEdge> graph;

    private final Graph<String, GraphEdge> readOnlyView;

    public AnalyticsGraph(boolean directed) {
        this.directed = directed;
        this.graph = directed
                ? new DefaultDirectedGraph<>(GraphEdge.class)
                : new DefaultUndirectedGraph<>(GraphEdge.class);
        this.readOnlyView = new AsUnmodifiableGraph<>(graph);
    }

    public static AnalyticsGraph empty(boolean directed) {
        return new AnalyticsGraph(directed);
    }

    // ===== 构图（仅 GraphBuilder 使用）=====

    void addNode(GraphNode node) {
        nodes.put(node.getId(), node);
        graph.addVertex(node.getId());
    }

    /**
     * @return true 表示新增了一条边，false 表示覆盖了已有边的属性
     */
    boolean addEdge(String source, String target, String relationshipType, Map<String, Object> attributes) {
        GraphEdge existing = graph.getEdge(source, target);
        if (existing != null) {
            existing.merge(relationshipType, attributes);
            return false;
        }
        graph.addEdge(source, target, new GraphEdge(source, target, relationshipType, attributes));
        return true;
    }

    void removeNode(String id) {
        nodes.remove(id);
        graph.removeVertex(id);
    }

    void removeEdge(GraphEdge edge) {
        graph.removeEdge(edge);
    }

    // ===== 查询 =====

    public boolean isDirected() {
        return directed;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return graph.edgeSet().size();
    }

    public boolean containsNode(String id) {
        return id != null && nodes.containsKey(id);
    }

    public GraphNode node(String id) {
        return nodes.get(id);
    }

    public Collection<GraphNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Set<String> nodeIds() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public Set<GraphEdge> edges() {
        return readOnlyView.edgeSet();
    }

    public GraphEdge edge(String source, String target) {
        return graph.getEdge(source, target);
    }

    /**
     * 度数。有向图为入度 + 出度，无向自环计 2。
     */
    public int degree(String id) {
        return graph.degreeOf(id);
    }

    public Map<String, Integer> degrees() {
        Map<String, Integer> result = new LinkedHashMap<>();
        for (String id : nodes.keySet()) {
            result.put(id, graph.degreeOf(id));
        }
        return result;
    }

    public double density() {
        int n = nodeCount();
        if (n <= 1) return 0d;
        double possible = (double) n * (n - 1);
        return directed ? edgeCount() / possible : 2d * edgeCount() / possible;
    }

    /**
     * 连通性，有向图按弱连通判断。空图视为不连通。
     */
    public boolean isConnected() {
        if (nodes.isEmpty()) return false;
        return new ConnectivityInspector<>(graph).isConnected();
    }

    /**
     * 连通分量（有向图为弱连通分量），顺序由 ConnectivityInspector 决定。
     */
    public List<Set<String>> connectedComponents() {
        return new ConnectivityInspector<>(graph).connectedSets();
    }

    // ===== 给算法用的视图 =====

    public Graph<String, GraphEdge> view() {
        return readOnlyView;
    }

    /**
     * 以某个边属性为权重的只读视图，attribute 为空时等价于 {@link #view()}。
     */
    public Graph<String, GraphEdge> weightedView(String attribute) {
        if (StrUtil.isBlank(attribute)) return readOnlyView;
        return new AsWeightedGraph<>(readOnlyView, e -> e.weight(attribute), false, false);
    }

    @Override
    public String toString() {
        return "AnalyticsGraph{directed=" + directed + ", nodes=" + nodeCount() + ", edges=" + edgeCount() + "}";
    }
}
