package com.gdin.inspection.graphalgo.algorithm.community.cluster;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gdin.inspection.graphalgo.config.properties.GraphAlgoProperties;
import jakarta.annotation.Resource;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Slf4j
@Component
public class HttpGraphClusterClient implements GraphClusterClient {

    @Resource(name = "clusterRestTemplate")
    private RestTemplate restTemplate;

    @Resource
    private GraphAlgoProperties graphAlgoProperties;

    @Override
    public boolean isAvailable() {
        return StrUtil.isNotBlank(graphAlgoProperties.getLeiden().getBaseUrl());
    }

    @Override
    public List<LeidenCluster> clusterGraph(
            List<ClusterEdge> edges,
            double resolution,
            int iterations,
            Integer seed
    ) {
        if (CollectionUtil.isEmpty(edges)) {
            return Collections.emptyList();
        }

        ClusterRequest request = new ClusterRequest(edges, resolution, iterations, seed);
        String url = StrUtil.removeSuffix(graphAlgoProperties.getLeiden().getBaseUrl(), "/") + "/cluster";
        log.info("请求聚类服务：url={}, edges={}", url, edges.size());

        ClusterResponse response = restTemplate.postForObject(url, request, ClusterResponse.class);

        if (response == null || response.getClusters() == null) {
            return Collections.emptyList();
        }

        return response.getClusters().stream()
                .filter(Objects::nonNull)
                .map(item -> LeidenCluster.builder()
                        .level(item.getLevel())
                        .communityId(item.getCommunityId())
                        .nodeIds(item.getNodes())
                        .build()
                )
                .collect(Collectors.toList());
    }

    /**
     * 发送给聚类服务的请求结构。
     */
    @Value
    @AllArgsConstructor
    static class ClusterRequest {
        List<ClusterEdge> relationships;

        double resolution;

        @JsonProperty("n_iterations")
        int nIterations;

        Integer seed;
    }

    /**
     * 聚类服务返回的单个社区。
     */
    @Data
    public static class ClusterItem {

        private int level;

        @JsonProperty("community_id")
        private int communityId;

        private List<String> nodes;
    }

    @Data
    public static class ClusterResponse {
        private List<ClusterItem> clusters;
    }
}
