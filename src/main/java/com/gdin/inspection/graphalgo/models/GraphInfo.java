package com.gdin.inspection.graphalgo.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * 图的概要信息：规模、密度、连通性、度数分布，以及节点类型 / 关系类型计数。
 * 空图时度数统计均为 0。
 */
@Value
@Jacksonized
@Builder
public class GraphInfo {

    @JsonProperty("nodes")
    int nodes;

    @JsonProperty("edges")
    int edges;

    @JsonProperty("directed")
    boolean directed;

    @JsonProperty("density")
    double density;

    /** 有向图按弱连通判断 */
    @JsonProperty("is_connected")
    boolean connected;

    @JsonProperty("average_degree")
    double averageDegree;

    @JsonProperty("max_degree")
    int maxDegree;

    @JsonProperty("min_degree")
    int minDegree;

    // 缺少类型的节点计入 unknown
    @JsonProperty("node_types")
    Map<String, Integer> nodeTypes;

    @JsonProperty("edge_types")
    Map<String, Integer> edgeTypes;
}
