package com.gdin.inspection.graphalgo.models;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * 原始关系记录：source / target 为实体 uid。
 */
@Value
@Builder
public class EdgeRecord {

    String source;

    String target;

    String relationshipType;

    @Singular
    Map<String, Object> attributes;
}
