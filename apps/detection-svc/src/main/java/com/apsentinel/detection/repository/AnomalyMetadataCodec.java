package com.apsentinel.detection.repository;

import com.apsentinel.detection.model.AnomalyKind;
import com.apsentinel.detection.model.AnomalyMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Stores {@link AnomalyMetadata} as JSON text. The anomaly kind column selects the variant on read.
 */
@Component
public class AnomalyMetadataCodec {

    private final ObjectMapper objectMapper;

    public AnomalyMetadataCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(AnomalyMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize " + metadata.kind() + " metadata", ex);
        }
    }

    public AnomalyMetadata decode(AnomalyKind kind, String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, kind.metadataType());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to deserialize " + kind.code() + " metadata", ex);
        }
    }
}
