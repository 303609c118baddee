package com.gdin.inspection.graphalgo.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.gdin.inspection.graphalgo.util.IOUtil;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AlgorithmMetadataTest {

    private static AlgorithmMetadata sample() {
        return AlgorithmMetadata.builder()
                .algorithm("louvain")
                .durationSeconds(1.25)
                .resultCount(3)
                .graphNodes(3)
                .graphEdges(2)
                .timestamp(Instant.parse("2024-05-01T08:00:00Z"))
                .build();
    }

    @Test
    public void testJsonOmitsUnsetFields() throws Exception {
        AlgorithmMetadata metadata = sample();
        metadata.setCommunityUids(Map.of(0, "0x10"));

        JsonNode json = IOUtil.readTree(IOUtil.jsonSerialize(metadata));

        assertEquals("louvain", json.path("algorithm").asText());
        assertEquals(1.25, json.path("duration_seconds").asDouble(), 1e-12);
        assertEquals("2024-05-01T08:00:00Z", json.path("timestamp").asText());
        assertEquals("0x10", json.path("community_uids").path("0").asText());
        assertFalse(json.has("error"));
        assertFalse(json.has("written_back"));
        assertFalse(json.has("failed"));
    }

    @Test
    public void testJsonReadBack() throws Exception {
        String json = "{\"algorithm\":\"pagerank\",\"result_count\":7,\"error\":\"boom\",\"unknown\":1}";

        AlgorithmMetadata metadata = IOUtil.jsonDeserialize(json, AlgorithmMetadata.class);

        assertEquals("pagerank", metadata.getAlgorithm());
        assertEquals(7, metadata.getResultCount());
        assertTrue(metadata.isFailed());
    }

    @Test
    public void testAttributesAreScalarOnly() {
        AlgorithmMetadata metadata = sample();
        metadata.setWrittenBack(true);
        metadata.setCommunityUids(Map.of(0, "0x10"));

        Map<String, Object> attrs = metadata.toAttributes();

        assertEquals("louvain", attrs.get("algorithm"));
        assertEquals(3, attrs.get("result_count"));
        assertEquals("2024-05-01T08:00:00Z", attrs.get("timestamp"));
        assertFalse(attrs.containsKey("community_uids"));
        assertFalse(attrs.containsKey("written_back"));
        assertFalse(attrs.containsKey("error"));
    }
}
