package com.gdin.inspection.graphalgo.algorithm.community.cluster;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 发送给聚类服务的单条边。
 */
@Value
@AllArgsConstructor
public class ClusterEdge {
    String source;
    String target;
    Double weight;
}
