package com.gdin.inspection.graphalgo.algorithm.community;

import cn.hutool.core.map.MapUtil;
import com.gdin.inspection.graphalgo.algorithm.clustering.Partitions;
import com.gdin.inspection.graphalgo.graph.AnalyticsGraph;
import com.gdin.inspection.graphalgo.graph.GraphEdge;
import com.gdin.inspection.graphalgo.models.CommunityAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.jgrapht.Graph;
import org.jgrapht.alg.clustering.UndirectedModularityMeasurer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 划分结果的统计：社区数、各社区大小、最大 / 最小 / 平均，以及模块度。
 *
 * 模块度算不出来（划分没有恰好覆盖图中全部节点、图没有边、数值异常）时为 null，其余统计照常返回。
 */
@Slf4j
@Component
public class CommunityAnalyzer {

    public static final String NO_PARTITION = "No partition provided";

    public CommunityAnalysis analyze(AnalyticsGraph graph, Map<String, ? extends Number> partition) {
        if (MapUtil.isEmpty(partition)) {
            return CommunityAnalysis.error(NO_PARTITION);
        }

        Map<Integer, Set<String>> communities = new TreeMap<>();
        partition.forEach((node, community) ->
                communities.computeIfAbsent(community.intValue(), k -> new LinkedHashSet<>()).add(node));

        Map<Integer, Integer> sizes = new TreeMap<>();
        communities.forEach((id, members) -> sizes.put(id, members.size()));

        int largest = Collections.max(sizes.values());
        int smallest = Collections.min(sizes.values());
        double average = sizes.values().stream().mapToInt(Integer::intValue).average().orElse(0d);

        return CommunityAnalysis.builder()
                .numCommunities(communities.size())
                .communitySizes(sizes)
                .largestCommunity(largest)
                .smallestCommunity(smallest)
                .averageCommunitySize(average)
                .modularity(modularity(graph, partition.keySet(), new ArrayList<>(communities.values())))
                .build();
    }

    private Double modularity(AnalyticsGraph graph, Set<String> covered, List<Set<String>> communities) {
        try {
            if (graph == null || graph.edgeCount() == 0) return null;
            if (!covered.equals(graph.nodeIds())) {
                log.warn("划分与图的节点集合不一致，跳过模块度计算：partition={}, graph={}",
                        covered.size(), graph.nodeCount());
                return null;
            }
            Graph<String, GraphEdge> undirected = Partitions.undirected(graph.view());
            double q = new UndirectedModularityMeasurer<>(undirected).modularity(communities);
            if (Double.isNaN(q) || Double.isInfinite(q)) return null;
            return q;
        } catch (Exception e) {
            log.warn("模块度计算失败：{}", e.getMessage());
            return null;
        }
    }
}
