package com.apsentinel.detection.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.util.UUID;

/**
 * Kind-specific details attached to an {@link Anomaly}. Each variant belongs to exactly one
 * {@link AnomalyKind}.
 */
@JsonIgnoreProperties("kind")
public sealed interface AnomalyMetadata
        permits AnomalyMetadata.Duplicate, AnomalyMetadata.PriceCreep, AnomalyMetadata.RoundNumber {

    AnomalyKind kind();

    /**
     * @param relatedBillId the other bill of the qualifying pair
     * @param duplicateOf   the bill the anomaly is recorded against
     */
    record Duplicate(
            @JsonProperty("related_bill_id") UUID relatedBillId,
            @JsonProperty("duplicate_of") UUID duplicateOf
    ) implements AnomalyMetadata {
        @Override
        public AnomalyKind kind() {
            return AnomalyKind.DUPLICATE;
        }
    }

    record PriceCreep(
            @JsonProperty("z_score") double zScore,
            @JsonProperty("baseline_avg") double baselineMean,
            @JsonProperty("baseline_std") double baselineStdDev
    ) implements AnomalyMetadata {
        @Override
        public AnomalyKind kind() {
            return AnomalyKind.PRICE_CREEP;
        }
    }

    record RoundNumber(@JsonProperty("round_value") BigDecimal roundValue) implements AnomalyMetadata {
        @Override
        public AnomalyKind kind() {
            return AnomalyKind.ROUND_NUMBER;
        }
    }
}
