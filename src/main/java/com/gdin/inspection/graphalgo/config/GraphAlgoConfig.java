package com.gdin.inspection.graphalgo.config;

import com.gdin.inspection.graphalgo.algorithm.centrality.CentralityAlgorithms;
import com.gdin.inspection.graphalgo.algorithm.community.CommunityDetection;
import com.gdin.inspection.graphalgo.algorithm.community.cluster.GraphClusterClient;
import com.gdin.inspection.graphalgo.config.properties.GraphAlgoProperties;
import jakarta.annotation.Resource;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class GraphAlgoConfig {
    @Resource
    private GraphAlgoProperties graphAlgoProperties;

    @Bean
    public CentralityAlgorithms centralityAlgorithms() {
        return new CentralityAlgorithms(graphAlgoProperties);
    }

    @Bean
    public CommunityDetection communityDetection(GraphClusterClient graphClusterClient) {
        return new CommunityDetection(graphAlgoProperties, graphClusterClient);
    }

    // 聚类服务一次可能跑很久，读超时按 leiden.timeout
    @Bean("clusterRestTemplate")
    public RestTemplate clusterRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(graphAlgoProperties.getLeiden().getTimeout()))
                .build();
    }
}
