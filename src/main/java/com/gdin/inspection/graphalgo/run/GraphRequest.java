package com.gdin.inspection.graphalgo.run;

import lombok.Builder;
import lombok.Value;

/**
 * 一次构图的参数。entityType / limit 为空时取配置里的默认值。
 */
@Value
@Builder
public class GraphRequest {

    String entityType;

    Integer limit;

    @Builder.Default
    boolean directed = false;

    @Builder.Default
    boolean includeSelfLoops = false;

    @Builder.Default
    int minDegree = 0;

    public static GraphRequest defaults() {
        return GraphRequest.builder().build();
    }
}
