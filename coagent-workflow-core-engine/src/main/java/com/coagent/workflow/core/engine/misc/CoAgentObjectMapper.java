package com.coagent.workflow.core.engine.misc;

import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared JSON mapper. Besides (de)serialization it produces deep copies of states and
 * checkpoints, so everything the engine stores or hands out has gone through the same JSON
 * representation a durable store would use.
 */
public class CoAgentObjectMapper {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private CoAgentObjectMapper() {}

    private static final class SingletonHolder {
        private static final CoAgentObjectMapper INSTANCE = new CoAgentObjectMapper();
    }

    public static CoAgentObjectMapper getInstance() {
        return SingletonHolder.INSTANCE;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public String toJson(Object value) {
        return objectMapper.writeValueAsString(value);
    }

    public byte[] toJsonBytes(Object value) {
        return objectMapper.writeValueAsBytes(value);
    }

    public <T> T fromJson(byte[] json, Class<T> type) {
        return objectMapper.readValue(json, type);
    }

    public Map<String, Object> toMap(String json) {
        return objectMapper.readValue(json, MAP_TYPE);
    }

    public <T> T deepCopy(T value, Class<T> type) {
        if (value == null) {
            return null;
        }
        return objectMapper.readValue(objectMapper.writeValueAsBytes(value), type);
    }

    public Map<String, Object> deepCopy(Map<String, ?> value) {
        if (value == null) {
            return new LinkedHashMap<>();
        }
        return objectMapper.readValue(objectMapper.writeValueAsBytes(value), MAP_TYPE);
    }

    public Object deepCopyValue(Object value) {
        if (value == null) {
            return null;
        }
        return objectMapper.readValue(objectMapper.writeValueAsBytes(value), Object.class);
    }
}
