package com.contentorganizer.bot.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/** JSON text columns holding ordered string arrays (urls, hashtags, mentions). */
final class StringArrays {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> LIST_OF_STRINGS = new TypeReference<>() {};

    private StringArrays() {}

    static String encode(List<String> values) {
        try {
            return MAPPER.writeValueAsString(values == null ? List.of() : values);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to encode string array", e);
        }
    }

    static List<String> decode(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            List<String> values = MAPPER.readValue(json, LIST_OF_STRINGS);
            return values == null ? List.of() : values;
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to decode string array: " + json, e);
        }
    }
}
