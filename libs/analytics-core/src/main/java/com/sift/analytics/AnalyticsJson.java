package com.sift.analytics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Collection;

/**
 * Shared Jackson configuration for analytics payloads.
 * <p>
 * {@code Instant} values are written as ISO-8601 strings, never as numeric timestamps.
 */
public final class AnalyticsJson {

    private static final ObjectMapper MAPPER = createMapper();

    private AnalyticsJson() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /** Creates an empty JSON object. */
    public static ObjectNode object() {
        return MAPPER.createObjectNode();
    }

    /** Creates a JSON array of strings. */
    public static ArrayNode strings(Collection<String> values) {
        ArrayNode array = MAPPER.createArrayNode();
        values.forEach(array::add);
        return array;
    }

    /**
     * Serializes a value to a JSON string.
     *
     * @throws SerializationException if serialization fails
     */
    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Exception thrown when an analytics payload cannot be serialized.
     */
    public static class SerializationException extends RuntimeException {
        public SerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
