package com.gdin.inspection.graphalgo.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class GraphNode {

    String id;

    @Builder.Default
    String name = "";

    @Builder.Default
    String type = "";

    @Singular
    Map<String, Object> attributes;

    /**
     * 按属性名取值，name / type 也当作属性参与匹配。
     */
    public Object attribute(String key) {
        if ("name".equals(key)) return name;
        if ("type".equals(key)) return type;
        return attributes.get(key);
    }
}
