package com.gdin.inspection.graphalgo.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单次算法运行的元数据。
 *
 * 固定字段之外的可选字段（empty_graph / written_back / community_*）只在对应分支发生时才有值，
 * 序列化时按 NON_NULL 省略。
 */
@Data
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AlgorithmMetadata {

    @JsonProperty("algorithm")
    private String algorithm;

    @JsonProperty("duration_seconds")
    private Double durationSeconds;

    @JsonProperty("result_count")
    private Integer resultCount;

    @JsonProperty("graph_nodes")
    private Integer graphNodes;

    @JsonProperty("graph_edges")
    private Integer graphEdges;

    @JsonProperty("timestamp")
    private Instant timestamp;

    /** compute 抛出的异常信息，成功时为空 */
    @JsonProperty("error")
    private String error;

    @JsonProperty("empty_graph")
    private Boolean emptyGraph;

    @JsonProperty("written_back")
    private Boolean writtenBack;

    @JsonProperty("write_back_error")
    private String writeBackError;

    @JsonProperty("community_entities_created")
    private Integer communityEntitiesCreated;

    /** 社区编号 -> 新建 Community 节点的 uid */
    @JsonProperty("community_uids")
    private Map<Integer, String> communityUids;

    @JsonProperty("community_creation_error")
    private String communityCreationError;

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }

    /**
     * 写回图库时附带的标量字段（snake_case key），空值和集合类型字段不输出。
     */
    public Map<String, Object> toAttributes() {
        Map<String, Object> attrs = new LinkedHashMap<>();
        putIfNotNull(attrs, "algorithm", algorithm);
        putIfNotNull(attrs, "duration_seconds", durationSeconds);
        putIfNotNull(attrs, "result_count", resultCount);
        putIfNotNull(attrs, "graph_nodes", graphNodes);
        putIfNotNull(attrs, "graph_edges", graphEdges);
        putIfNotNull(attrs, "timestamp", timestamp == null ? null : timestamp.toString());
        putIfNotNull(attrs, "error", error);
        putIfNotNull(attrs, "empty_graph", emptyGraph);
        return attrs;
    }

    private static void putIfNotNull(Map<String, Object> attrs, String key, Object value) {
        if (value != null) attrs.put(key, value);
    }
}
