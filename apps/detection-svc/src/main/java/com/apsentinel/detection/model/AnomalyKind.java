package com.apsentinel.detection.model;

public enum AnomalyKind {
    DUPLICATE("duplicate", AnomalyMetadata.Duplicate.class),
    PRICE_CREEP("price_creep", AnomalyMetadata.PriceCreep.class),
    ROUND_NUMBER("round_number", AnomalyMetadata.RoundNumber.class);

    private final String code;
    private final Class<? extends AnomalyMetadata> metadataType;

    AnomalyKind(String code, Class<? extends AnomalyMetadata> metadataType) {
        this.code = code;
        this.metadataType = metadataType;
    }

    public String code() {
        return code;
    }

    public Class<? extends AnomalyMetadata> metadataType() {
        return metadataType;
    }

    public static AnomalyKind fromCode(String code) {
        for (AnomalyKind kind : values()) {
            if (kind.code.equals(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown anomaly kind: " + code);
    }
}
