package com.spending.fraud.alert;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.spending.fraud.exception.ValidationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts typed alert evidence into the snake_case map stored on an alert.
 * Dates are written as ISO-8601 strings and null fields are omitted.
 */
public class EvidenceSerializer {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public EvidenceSerializer() {
        this.objectMapper = new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Map<String, Object> toMap(AlertEvidence evidence) {
        if (evidence == null) {
            return Map.of();
        }
        try {
            return objectMapper.convertValue(evidence, MAP_TYPE);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(
                    "Cannot serialize evidence of type " + evidence.getClass().getSimpleName(), e);
        }
    }

    /**
     * JSON form of stored evidence, for consumers that keep it as text.
     */
    public String toJson(Map<String, Object> evidence) {
        try {
            return objectMapper.writeValueAsString(evidence);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Cannot write evidence as JSON", e);
        }
    }
}
