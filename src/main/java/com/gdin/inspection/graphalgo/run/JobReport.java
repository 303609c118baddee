package com.gdin.inspection.graphalgo.run;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gdin.inspection.graphalgo.models.AlgorithmMetadata;
import com.gdin.inspection.graphalgo.models.CommunityAnalysis;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * 一次批量任务的汇总，只保留元数据和社区统计，不保留逐节点结果。
 */
@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobReport {

    @JsonProperty("scope")
    AlgorithmScope scope;

    /** 图为空时整批跳过 */
    @JsonProperty("skipped")
    boolean skipped;

    @JsonProperty("graph_nodes")
    int graphNodes;

    @JsonProperty("graph_edges")
    int graphEdges;

    @JsonProperty("centrality")
    Map<String, AlgorithmMetadata> centrality;

    @JsonProperty("community")
    Map<String, AlgorithmMetadata> community;

    @JsonProperty("analyses")
    Map<String, CommunityAnalysis> analyses;

    @JsonProperty("total_results")
    int totalResults;

    @JsonProperty("duration_seconds")
    double durationSeconds;
}
