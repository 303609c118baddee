package com.gdin.inspection.graphalgo.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class IOUtil {
    private static final ObjectMapper simpleMapper = new ObjectMapper();

    static {
        simpleMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        simpleMapper.registerModule(new JavaTimeModule());
        // 避免写成时间戳（否则 Instant 会变成 long）
        simpleMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public static String jsonSerialize(Object obj) throws JsonProcessingException {
        return jsonSerialize(obj, false);
    }

    public static String jsonSerialize(Object obj, boolean pretty) throws JsonProcessingException {
        if (obj == null) return null;
        if (pretty) return simpleMapper.writerWithDefaultPrettyPrinter().writeValueAsString(obj);
        else return simpleMapper.writeValueAsString(obj);
    }

    public static <T> T jsonDeserialize(String content, Class<T> clazz) throws JsonProcessingException {
        return content == null ? null : simpleMapper.readValue(content, clazz);
    }

    /**
     * 解析为 JsonNode，空串返回 MissingNode。
     */
    public static JsonNode readTree(String content) throws JsonProcessingException {
        if (content == null || content.isBlank()) return simpleMapper.missingNode();
        return simpleMapper.readTree(content);
    }
}
