package com.gdin.inspection.graphalgo.models;

import cn.hutool.core.util.StrUtil;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * 从图库拉回来的原始实体记录。
 * uid 是主键，node_id 是备用 id，两者都为空的记录在构图时会被丢弃。
 */
@Value
@Builder
public class NodeRecord {

    String uid;

    String nodeId;

    String name;

    String type;

    // 其余字段原样保留
    @Singular
    Map<String, Object> attributes;

    public String id() {
        if (StrUtil.isNotBlank(uid)) return uid;
        if (StrUtil.isNotBlank(nodeId)) return nodeId;
        return null;
    }
}
