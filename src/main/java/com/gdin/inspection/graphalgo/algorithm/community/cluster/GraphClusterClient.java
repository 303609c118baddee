package com.gdin.inspection.graphalgo.algorithm.community.cluster;

import java.util.List;

/**
 * 外部聚类服务客户端。服务端跑 Leiden，返回 (level, community, parent, [node ids])。
 */
public interface GraphClusterClient {

    /**
     * 服务是否已配置，未配置时调用方应自行退化到本地算法。
     */
    boolean isAvailable();

    List<LeidenCluster> clusterGraph(
            List<ClusterEdge> edges,
            double resolution,
            int iterations,
            Integer seed
    );
}
