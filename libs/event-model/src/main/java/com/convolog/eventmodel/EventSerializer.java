package com.convolog.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;

/**
 * JSON serialization for event payloads, metadata and snapshot data.
 *
 * <p>Payloads are stored as string-keyed JSON objects with snake_case keys. Typed payloads
 * (records) are converted to and from that form here, so field naming never leaks Java
 * identifiers into the log. {@code Instant} values are written as ISO-8601 strings.
 */
public final class EventSerializer {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final ObjectMapper MAPPER = createMapper();

    private EventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Converts a typed payload (usually a record) into a string-keyed map.
     *
     * @throws EventSerializationException if the payload cannot be converted
     */
    public static Map<String, Object> toData(Object payload) {
        try {
            return MAPPER.convertValue(payload, MAP_TYPE);
        } catch (IllegalArgumentException e) {
            throw new EventSerializationException(
                    "Failed to convert payload " + payload.getClass().getSimpleName(), e);
        }
    }

    /**
     * Converts a string-keyed map back into a typed payload.
     *
     * @throws EventSerializationException if the map does not fit the payload type
     */
    public static <T> T fromData(Map<String, Object> data, Class<T> payloadType) {
        try {
            return MAPPER.convertValue(data, payloadType);
        } catch (IllegalArgumentException e) {
            throw new EventSerializationException(
                    "Failed to convert data to " + payloadType.getSimpleName(), e);
        }
    }

    /**
     * Writes a string-keyed map as a JSON object.
     *
     * @throws EventSerializationException if serialization fails
     */
    public static String toJson(Map<String, Object> data) {
        try {
            return MAPPER.writeValueAsString(data == null ? Map.of() : data);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize event data", e);
        }
    }

    /**
     * Reads a JSON object into a string-keyed map.
     *
     * @throws EventSerializationException if the JSON is malformed or not an object
     */
    public static Map<String, Object> readMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to deserialize event data", e);
        }
    }

    /**
     * Exception thrown when event serialization/deserialization fails.
     */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
