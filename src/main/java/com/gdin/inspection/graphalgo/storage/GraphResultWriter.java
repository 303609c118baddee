package com.gdin.inspection.graphalgo.storage;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.graphalgo.config.properties.GraphAlgoProperties;
import com.gdin.inspection.graphalgo.models.AlgorithmMetadata;
import com.gdin.inspection.graphalgo.models.CommunityEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 把算法结果写回 {@link GraphStore}。
 *
 * 标量结果按 writeBatchSize 分批顺序提交，某一批失败即返回 false，已提交的批次保留；
 * 社区节点逐个提交，任何一个失败都直接抛出。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphResultWriter implements ResultWriter {

    static final String COMMUNITY_BLANK_NODE = "community";

    static final String COMMUNITY_TYPE = "Community";

    private final GraphStore graphStore;

    private final GraphAlgoProperties graphAlgoProperties;

    @Override
    public boolean writeScalarResults(String algorithm, Map<String, ? extends Number> results, AlgorithmMetadata metadata) {
        if (CollectionUtil.isEmpty(results)) {
            log.info("[{}] 没有需要写回的结果", algorithm);
            return true;
        }

        Map<String, Object> prefixed = prefixed(algorithm, metadata);
        List<Map<String, Object>> mutations = new ArrayList<>(results.size());
        results.forEach((uid, value) -> {
            Map<String, Object> mutation = new LinkedHashMap<>();
            mutation.put("uid", uid);
            mutation.put(algorithm + "_score", value);
            mutation.putAll(prefixed);
            mutations.add(mutation);
        });

        int batchSize = Math.max(1, graphAlgoProperties.getWriteBatchSize());
        int total = mutations.size();
        for (int i = 0; i < total; i += batchSize) {
            int end = Math.min(i + batchSize, total);
            List<Map<String, Object>> batch = mutations.subList(i, end);
            try {
                graphStore.persist(batch);
            } catch (Exception e) {
                log.error("[{}] 写回第 {}-{} 条失败（共 {} 条），之前的批次已提交", algorithm, i, end, total, e);
                return false;
            }
        }

        log.info("[{}] 已写回 {} 条结果", algorithm, total);
        return true;
    }

    @Override
    public Map<Integer, String> createCommunityEntities(
            String algorithm,
            Map<String, ? extends Number> partition,
            AlgorithmMetadata metadata
    ) {
        List<CommunityEntity> entities = toEntities(algorithm, partition, metadata);
        log.info("[{}] 准备新建 {} 个社区节点", algorithm, entities.size());

        Map<Integer, String> communityUids = new LinkedHashMap<>();
        for (CommunityEntity entity : entities) {
            Map<String, String> uids;
            try {
                uids = graphStore.persist(List.of(toMutation(entity)));
            } catch (RuntimeException e) {
                log.error("[{}] 社区 {} 创建失败", algorithm, entity.getCommunityId(), e);
                throw e;
            }

            String uid = uids.get(COMMUNITY_BLANK_NODE);
            if (uid == null && !uids.isEmpty()) uid = uids.values().iterator().next();
            if (uid == null) {
                log.warn("[{}] 社区 {} 提交后没有返回 uid，跳过", algorithm, entity.getCommunityId());
                continue;
            }
            communityUids.put(entity.getCommunityId(), uid);
            log.debug("[{}] 社区 {} -> {}，成员 {} 个", algorithm, entity.getCommunityId(), uid, entity.memberCount());
        }

        log.info("[{}] 成功新建 {} 个社区节点", algorithm, communityUids.size());
        return communityUids;
    }

    List<CommunityEntity> toEntities(String algorithm, Map<String, ? extends Number> partition, AlgorithmMetadata metadata) {
        Map<Integer, List<String>> members = new TreeMap<>();
        partition.forEach((uid, community) ->
                members.computeIfAbsent(community.intValue(), k -> new ArrayList<>()).add(uid));

        Map<String, Object> attrs = prefixed(algorithm, metadata);
        List<CommunityEntity> entities = new ArrayList<>(members.size());
        members.forEach((communityId, memberIds) -> entities.add(CommunityEntity.builder()
                .algorithm(algorithm)
                .communityId(communityId)
                .memberIds(memberIds)
                .metadataAttributes(attrs)
                .build()));
        return entities;
    }

    Map<String, Object> toMutation(CommunityEntity entity) {
        Map<String, Object> mutation = new LinkedHashMap<>();
        mutation.put("uid", "_:" + COMMUNITY_BLANK_NODE);
        mutation.put("dgraph.type", COMMUNITY_TYPE);
        mutation.put("name", entity.name());
        mutation.put("algorithm", entity.getAlgorithm());
        mutation.put("community_id", entity.getCommunityId());
        mutation.put("member_count", entity.memberCount());

        List<Map<String, Object>> memberRefs = new ArrayList<>(entity.memberCount());
        for (String uid : entity.getMemberIds()) {
            memberRefs.add(Map.of("uid", uid));
        }
        mutation.put("members", memberRefs);
        mutation.putAll(entity.getMetadataAttributes());
        return mutation;
    }

    // 元数据字段加上 <algorithm>_ 前缀
    private static Map<String, Object> prefixed(String algorithm, AlgorithmMetadata metadata) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        if (metadata == null) return attrs;
        metadata.toAttributes().forEach((key, value) -> attrs.put(algorithm + "_" + key, value));
        return attrs;
    }
}
