package com.gdin.inspection.graphalgo.storage;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gdin.inspection.graphalgo.models.EdgeRecord;
import com.gdin.inspection.graphalgo.models.GraphData;
import com.gdin.inspection.graphalgo.models.NodeRecord;
import com.gdin.inspection.graphalgo.util.IOUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 基于 Dgraph HTTP 接口的实现：/query 走 DQL，/mutate 以 JSON set 提交并立即提交事务。
 * 认证头由注入的 RestTemplate 统一添加。
 */
@Slf4j
@Component
public class DgraphGraphStore implements GraphStore {

    static final MediaType APPLICATION_DQL = MediaType.parseMediaType("application/dql");

    // 实体类型会拼进 DQL，只允许标识符
    private static final Pattern TYPE_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.]*$");

    private static final String FETCH_QUERY = """
            {
              entities(func: type(%s), first: %d) {
                uid
                name
                type
                relatedTo @facets {
                  uid
                  name
                  type
                }
              }
            }
            """;

    private final RestTemplate restTemplate;

    private final DgraphConnection connection;

    public DgraphGraphStore(@Qualifier("dgraphRestTemplate") RestTemplate restTemplate, DgraphConnection connection) {
        this.restTemplate = restTemplate;
        this.connection = connection;
    }

    @Override
    public GraphData fetchGraphData(String entityType, int limit) {
        if (StrUtil.isBlank(entityType) || !TYPE_NAME.matcher(entityType).matches()) {
            throw new IllegalArgumentException("Invalid entity type: " + entityType);
        }

        JsonNode data = query(String.format(FETCH_QUERY, entityType, limit));

        List<NodeRecord> nodes = new ArrayList<>();
        List<EdgeRecord> edges = new ArrayList<>();
        for (JsonNode entity : data.path("entities")) {
            String uid = entity.path("uid").asText(null);
            if (StrUtil.isBlank(uid)) continue;

            nodes.add(NodeRecord.builder()
                    .uid(uid)
                    .nodeId(uid)
                    .name(entity.path("name").asText(""))
                    .type(entity.path("type").asText(""))
                    .build());

            for (JsonNode related : entity.path("relatedTo")) {
                String target = related.path("uid").asText(null);
                if (StrUtil.isBlank(target)) continue;
                edges.add(EdgeRecord.builder()
                        .source(uid)
                        .target(target)
                        .relationshipType(related.path("relatedTo|type").asText(null))
                        .build());
            }
        }

        log.info("从 Dgraph 拉取 {} 个实体、{} 条关系（type={}）", nodes.size(), edges.size(), entityType);
        return GraphData.of(nodes, edges);
    }

    @Override
    public Map<String, String> persist(List<Map<String, Object>> mutations) {
        if (CollectionUtil.isEmpty(mutations)) return Map.of();

        String body;
        try {
            body = IOUtil.jsonSerialize(Map.of("set", mutations));
        } catch (JsonProcessingException e) {
            throw new GraphStoreException("Failed to serialize mutation", e);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        JsonNode root = post(connection.baseUrl() + "/mutate?commitNow=true", new HttpEntity<>(body, headers));

        Map<String, String> uids = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.path("data").path("uids").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            uids.put(entry.getKey(), entry.getValue().asText());
        }
        log.debug("mutation 提交完成：{} 条，新 uid {} 个", mutations.size(), uids.size());
        return uids;
    }

    @Override
    public boolean ping() {
        try {
            restTemplate.getForObject(connection.baseUrl() + "/health", String.class);
            return true;
        } catch (RestClientException e) {
            log.warn("Dgraph 不可用：{}，{}", connection, e.getMessage());
            return false;
        }
    }

    JsonNode query(String dql) {
        log.debug("执行 DQL：{}", StrUtil.subPre(dql, 200));
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(APPLICATION_DQL);
        return post(connection.baseUrl() + "/query", new HttpEntity<>(dql, headers)).path("data");
    }

    private JsonNode post(String url, HttpEntity<String> request) {
        String response;
        try {
            response = restTemplate.postForObject(url, request, String.class);
        } catch (RestClientException e) {
            throw new GraphStoreException("Dgraph request failed: " + url, e);
        }

        JsonNode root;
        try {
            root = IOUtil.readTree(response);
        } catch (JsonProcessingException e) {
            throw new GraphStoreException("Unreadable Dgraph response from " + url, e);
        }

        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new GraphStoreException("Dgraph returned errors: " + errors.get(0).path("message").asText(errors.toString()));
        }
        return root;
    }
}
