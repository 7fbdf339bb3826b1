package net.pagewise.adapter.jdbc.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/** JobRecord.metadata ↔ METADATA(CLOB) JSON 문자열 */
public final class MetadataCodec {
    private static final TypeReference<LinkedHashMap<String, String>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public MetadataCodec() {
        this(new ObjectMapper());
    }

    public MetadataCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String write(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) return null;
        try {
            return mapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("metadata is not serialisable", e);
        }
    }

    public Map<String, String> read(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return mapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("METADATA column is not a JSON object of strings", e);
        }
    }
}
