package com.gdin.inspection.graphalgo.algorithm.community.cluster;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 聚类服务返回的单个社区。
 */
@Value
@Builder
public class LeidenCluster {

    /**
     * 层级，从 0 开始，越大越粗。
     */
    int level;

    /**
     * 社区编号，同一层内唯一。
     */
    int communityId;

    /**
     * 成员节点 id。
     */
    List<String> nodeIds;
}
