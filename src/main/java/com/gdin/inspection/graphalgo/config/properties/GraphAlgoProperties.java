package com.gdin.inspection.graphalgo.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

@Data
@ConfigurationProperties(prefix = "gdin.ai.graph-algo")
@Component
public class GraphAlgoProperties implements Serializable {
    // 单个算法的超时（秒），只做统计展示，调用方负责在整个流水线外层限时
    private Integer defaultAlgorithmTimeout = 300;
    // 一次拉取的最大实体数
    private Integer maxGraphSize = 100_000;
    // 默认拉取的实体类型
    private String defaultEntityType = "Entity";
    // 标量结果写回时每批 mutation 的条数
    private Integer writeBatchSize = 100;

    private Algorithms algorithms = new Algorithms();
    private Leiden leiden = new Leiden();
    private Scheduler scheduler = new Scheduler();

    @Data
    public static class Algorithms implements Serializable {
        // =============== centrality ================
        private boolean pagerank = true;
        private boolean betweenness = true;
        private boolean closeness = true;
        private boolean eigenvector = true;

        // =============== community ================
        // greedy_modularity 始终启用，作为兜底
        private boolean louvain = true;
        private boolean labelPropagation = true;
        private boolean leiden = true;
    }

    @Data
    public static class Leiden implements Serializable {
        // 聚类服务地址，为空时 leiden 退化为 louvain
        private String baseUrl;
        private Integer timeout = 300;
    }

    @Data
    public static class Scheduler implements Serializable {
        private boolean enabled = false;
        // Spring 六段式 cron
        private String cron = "0 0 */6 * * *";
        private String timezone = "UTC";
        // all | centrality | community
        private String algorithmType = "all";
        private boolean createCommunityNodes = false;
    }
}
