package com.gdin.inspection.graphalgo.run;

import cn.hutool.core.util.StrUtil;

/**
 * 一次任务跑哪些算法。
 */
public enum AlgorithmScope {
    ALL,
    CENTRALITY,
    COMMUNITY;

    /**
     * centrality / community 之外的值（包括空）一律按 all 处理。
     */
    public static AlgorithmScope from(String value) {
        if (StrUtil.equalsIgnoreCase(value, "centrality")) return CENTRALITY;
        if (StrUtil.equalsIgnoreCase(value, "community")) return COMMUNITY;
        return ALL;
    }

    public boolean includesCentrality() {
        return this != COMMUNITY;
    }

    public boolean includesCommunity() {
        return this != CENTRALITY;
    }
}
