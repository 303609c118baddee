package com.gdin.inspection.graphalgo.algorithm;

import cn.hutool.core.convert.Convert;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 算法参数，key 与配置 / 调用方传入的 snake_case 名称一致，如 max_iter、random_state。
 * 取值时按需要的类型转换，缺失或无法转换时用默认值。
 */
public final class AlgorithmParameters {

    private static final AlgorithmParameters EMPTY = new AlgorithmParameters(Map.of());

    private final Map<String, Object> values;

    private AlgorithmParameters(Map<String, Object> values) {
        this.values = values;
    }

    public static AlgorithmParameters empty() {
        return EMPTY;
    }

    public static AlgorithmParameters of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) return EMPTY;
        return new AlgorithmParameters(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public boolean contains(String key) {
        return values.get(key) != null;
    }

    public Double getDouble(String key, Double defaultValue) {
        return Convert.toDouble(values.get(key), defaultValue);
    }

    public Integer getInt(String key, Integer defaultValue) {
        return Convert.toInt(values.get(key), defaultValue);
    }

    public Long getLong(String key, Long defaultValue) {
        return Convert.toLong(values.get(key), defaultValue);
    }

    public Boolean getBoolean(String key, Boolean defaultValue) {
        return Convert.toBool(values.get(key), defaultValue);
    }

    public String getString(String key, String defaultValue) {
        return Convert.toStr(values.get(key), defaultValue);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
