package com.gdin.inspection.graphalgo.algorithm.centrality;

import com.gdin.inspection.graphalgo.algorithm.AlgorithmRegistry;
import com.gdin.inspection.graphalgo.algorithm.GraphAlgorithm;
import com.gdin.inspection.graphalgo.algorithm.ManagedAlgorithm;
import com.gdin.inspection.graphalgo.config.properties.GraphAlgoProperties;
import lombok.extern.slf4j.Slf4j;

/**
 * 中心性算法注册表，按配置开关注册，结果为 节点 -> 分值。
 * 中心性结果不是划分，永远不创建社区节点。
 */
@Slf4j
public class CentralityAlgorithms extends AlgorithmRegistry<Double> {

    private final int timeoutSeconds;

    public CentralityAlgorithms(GraphAlgoProperties properties) {
        this.timeoutSeconds = properties.getDefaultAlgorithmTimeout();
        for (CentralityAlgorithmType type : CentralityAlgorithmType.values()) {
            if (type.isEnabled(properties.getAlgorithms())) {
                register(type.create());
            }
        }
        log.info("中心性算法已注册：{}", availableNames());
    }

    protected void register(GraphAlgorithm<Double> algorithm) {
        register(new ManagedAlgorithm<>(algorithm, timeoutSeconds));
    }

    @Override
    protected boolean supportsCommunityNodes() {
        return false;
    }
}
