package com.gdin.inspection.graphalgo.models;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 算法结果 + 元数据。结果为 节点 id -> 值，失败或空图时为空 map，不会是 null。
 */
@Value
@Builder
public class AlgorithmRunResult<V extends Number> {

    Map<String, V> results;

    AlgorithmMetadata metadata;

    public boolean isSuccess() {
        return metadata != null && !metadata.isFailed();
    }
}
