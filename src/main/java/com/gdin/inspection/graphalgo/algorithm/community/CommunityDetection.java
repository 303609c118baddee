package com.gdin.inspection.graphalgo.algorithm.community;

import com.gdin.inspection.graphalgo.algorithm.AlgorithmRegistry;
import com.gdin.inspection.graphalgo.algorithm.GraphAlgorithm;
import com.gdin.inspection.graphalgo.algorithm.ManagedAlgorithm;
import com.gdin.inspection.graphalgo.algorithm.community.cluster.GraphClusterClient;
import com.gdin.inspection.graphalgo.config.properties.GraphAlgoProperties;
import lombok.extern.slf4j.Slf4j;

/**
 * 社区发现算法注册表，结果为 节点 -> 社区编号。
 */
@Slf4j
public class CommunityDetection extends AlgorithmRegistry<Integer> {

    private final int timeoutSeconds;

    public CommunityDetection(GraphAlgoProperties properties, GraphClusterClient clusterClient) {
        this.timeoutSeconds = properties.getDefaultAlgorithmTimeout();
        for (CommunityAlgorithmType type : CommunityAlgorithmType.values()) {
            if (type.isEnabled(properties.getAlgorithms())) {
                register(type.create(clusterClient));
            }
        }
        log.info("社区发现算法已注册：{}", availableNames());
    }

    protected void register(GraphAlgorithm<Integer> algorithm) {
        register(new ManagedAlgorithm<>(algorithm, timeoutSeconds));
    }
}
