package com.gdin.inspection.graphalgo.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 一个待新建的 Community 节点。每次运行都会新建，不覆盖旧的。
 */
@Value
@Builder
public class CommunityEntity {

    String algorithm;

    Integer communityId;

    // 成员实体 uid
    List<String> memberIds;

    // 运行元数据，写入时加上 <algorithm>_ 前缀
    Map<String, Object> metadataAttributes;

    public String name() {
        return algorithm + "_community_" + communityId;
    }

    public int memberCount() {
        return memberIds == null ? 0 : memberIds.size();
    }
}
