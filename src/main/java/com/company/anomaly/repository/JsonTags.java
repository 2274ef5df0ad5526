package com.company.anomaly.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tag map ↔ JSONB text
 */
@Component
@RequiredArgsConstructor
@Slf4j
class JsonTags {

    private static final TypeReference<Map<String, String>> TAGS_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    String write(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(tags);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tags are not serializable", e);
        }
    }

    Map<String, String> read(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, TAGS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse stored tags", e);
            return Map.of();
        }
    }
}
