package com.gdin.inspection.graphalgo.graph;

import cn.hutool.core.convert.Convert;
import cn.hutool.core.util.StrUtil;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 图中的一条边。JGraphT 按对象身份区分边，所以这里不重写 equals / hashCode。
 */
@Getter
public class GraphEdge {

    public static final String DEFAULT_RELATIONSHIP_TYPE = "related_to";

    private final String source;

    private final String target;

    private String relationshipType;

    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public GraphEdge(String source, String target, String relationshipType, Map<String, Object> attributes) {
        this.source = source;
        this.target = target;
        this.relationshipType = StrUtil.isBlank(relationshipType) ? DEFAULT_RELATIONSHIP_TYPE : relationshipType;
        if (attributes != null) this.attributes.putAll(attributes);
    }

    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Object attribute(String key) {
        if ("relationship_type".equals(key)) return relationshipType;
        return attributes.get(key);
    }

    /**
     * 边的权重，属性不存在或无法转换时按 1.0 处理。
     */
    public double weight(String attribute) {
        if (StrUtil.isBlank(attribute)) return 1.0;
        return Convert.toDouble(attributes.get(attribute), 1.0);
    }

    /**
     * 重复提交同一条边时覆盖属性，不新增平行边。
     */
    void merge(String relationshipType, Map<String, Object> attributes) {
        if (StrUtil.isNotBlank(relationshipType)) this.relationshipType = relationshipType;
        if (attributes != null) this.attributes.putAll(attributes);
    }

    public GraphEdge copy() {
        return new GraphEdge(source, target, relationshipType, attributes);
    }

    @Override
    public String toString() {
        return "(" + source + " -[" + relationshipType + "]-> " + target + ")";
    }
}
