package com.gdin.inspection.graphalgo.graph;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.map.MapUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.graphalgo.models.EdgeRecord;
import com.gdin.inspection.graphalgo.models.GraphData;
import com.gdin.inspection.graphalgo.models.NodeRecord;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 把图库拉回来的实体 / 关系记录转换成 {@link AnalyticsGraph}，并提供子图、最大连通分量两种派生视图。
 *
 * 过滤规则：
 * 1. 没有 uid / node_id 的实体直接丢弃；
 * 2. 缺少端点、端点不在图中的关系直接丢弃（属于正常过滤，不算错误）；
 * 3. 默认去掉自环；
 * 4. minDegree > 0 时对建好的整张图做一次度数过滤，不会因为邻居被删而反复剪枝。
 */
@Slf4j
@Component
public class GraphBuilder {

    @Getter
    private volatile int lastGraphSize;

    @Getter
    private volatile double lastBuildSeconds;

    public AnalyticsGraph build(GraphData data, boolean directed, boolean includeSelfLoops, int minDegree) {
        return build(data.getNodes(), data.getEdges(), directed, includeSelfLoops, minDegree);
    }

    public AnalyticsGraph build(
            List<NodeRecord> nodes,
            List<EdgeRecord> edges,
            boolean directed,
            boolean includeSelfLoops,
            int minDegree
    ) {
        long t0 = System.nanoTime();
        List<NodeRecord> nodeRecords = nodes == null ? List.of() : nodes;
        List<EdgeRecord> edgeRecords = edges == null ? List.of() : edges;
        log.info("开始构图：nodes={}, edges={}, directed={}", nodeRecords.size(), edgeRecords.size(), directed);

        AnalyticsGraph graph = new AnalyticsGraph(directed);

        // 1. 节点
        for (NodeRecord record : nodeRecords) {
            if (record == null) continue;
            String id = record.id();
            if (id == null) continue;

            graph.addNode(GraphNode.builder()
                    .id(id)
                    .name(StrUtil.nullToEmpty(record.getName()))
                    .type(StrUtil.nullToEmpty(record.getType()))
                    .attributes(MapUtil.emptyIfNull(record.getAttributes()))
                    .build());
        }

        // 2. 边，两端都必须已经在图里
        int dropped = 0;
        for (EdgeRecord record : edgeRecords) {
            if (record == null) continue;
            String source = record.getSource();
            String target = record.getTarget();
            if (StrUtil.isBlank(source) || StrUtil.isBlank(target)) {
                dropped++;
                continue;
            }
            if (!includeSelfLoops && source.equals(target)) {
                dropped++;
                continue;
            }
            if (!graph.containsNode(source) || !graph.containsNode(target)) {
                dropped++;
                continue;
            }
            graph.addEdge(source, target, record.getRelationshipType(), record.getAttributes());
        }
        if (dropped > 0) log.debug("构图时丢弃 {} 条关系（缺端点 / 自环 / 端点不存在）", dropped);

        // 3. 度数过滤，只做一轮
        if (minDegree > 0) {
            List<String> toRemove = new ArrayList<>();
            graph.degrees().forEach((id, degree) -> {
                if (degree < minDegree) toRemove.add(id);
            });
            toRemove.forEach(graph::removeNode);
            log.info("移除 {} 个度数 < {} 的节点", toRemove.size(), minDegree);
        }

        lastGraphSize = graph.nodeCount();
        lastBuildSeconds = (System.nanoTime() - t0) / 1_000_000_000.0;
        log.info("构图完成：nodes={}, edges={}, 耗时 {}s",
                graph.nodeCount(), graph.edgeCount(), String.format("%.3f", lastBuildSeconds));
        return graph;
    }

    /**
     * 按属性精确匹配筛子图。
     *
     * @param nodeFilter 节点属性过滤，如 {"type": "PERSON"}，为空表示保留全部
     * @param edgeFilter 边属性过滤，relationship_type 也可参与匹配
     * @param maxNodes   最多保留多少个节点，null 或 0 表示不限制；截断时保留哪些节点没有顺序保证
     */
    public AnalyticsGraph subgraph(
            AnalyticsGraph graph,
            Map<String, Object> nodeFilter,
            Map<String, Object> edgeFilter,
            Integer maxNodes
    ) {
        Set<String> included = new LinkedHashSet<>();
        for (GraphNode node : graph.nodes()) {
            if (matches(nodeFilter, node::attribute)) included.add(node.getId());
        }

        if (maxNodes != null && maxNodes > 0 && included.size() > maxNodes) {
            included = new LinkedHashSet<>(new ArrayList<>(included).subList(0, maxNodes));
        }

        AnalyticsGraph sub = induced(graph, included);

        if (MapUtil.isNotEmpty(edgeFilter)) {
            List<GraphEdge> toRemove = sub.edges().stream()
                    .filter(e -> !matches(edgeFilter, e::attribute))
                    .toList();
            toRemove.forEach(sub::removeEdge);
        }

        log.info("生成子图：nodes={}, edges={}", sub.nodeCount(), sub.edgeCount());
        return sub;
    }

    /**
     * 最大连通分量（有向图为弱连通）。大小相同的分量之间取哪个由 JGraphT 的枚举顺序决定。
     */
    public AnalyticsGraph largestComponent(AnalyticsGraph graph) {
        List<Set<String>> components = graph.connectedComponents();
        if (CollectionUtil.isEmpty(components)) {
            return AnalyticsGraph.empty(graph.isDirected());
        }

        Set<String> largest = components.stream()
                .max(Comparator.comparingInt(Set::size))
                .orElseThrow();

        AnalyticsGraph lcc = induced(graph, largest);
        log.info("最大连通分量：nodes={}, edges={}", lcc.nodeCount(), lcc.edgeCount());
        return lcc;
    }

    private AnalyticsGraph induced(AnalyticsGraph graph, Set<String> nodeIds) {
        AnalyticsGraph sub = new AnalyticsGraph(graph.isDirected());
        for (GraphNode node : graph.nodes()) {
            if (nodeIds.contains(node.getId())) sub.addNode(node);
        }
        for (GraphEdge edge : graph.edges()) {
            if (sub.containsNode(edge.getSource()) && sub.containsNode(edge.getTarget())) {
                GraphEdge copy = edge.copy();
                sub.addEdge(copy.getSource(), copy.getTarget(), copy.getRelationshipType(), copy.getAttributes());
            }
        }
        return sub;
    }

    private static boolean matches(Map<String, Object> filter, java.util.function.Function<String, Object> accessor) {
        if (MapUtil.isEmpty(filter)) return true;
        for (Map.Entry<String, Object> entry : filter.entrySet()) {
            if (!Objects.equals(accessor.apply(entry.getKey()), entry.getValue())) return false;
        }
        return true;
    }
}
