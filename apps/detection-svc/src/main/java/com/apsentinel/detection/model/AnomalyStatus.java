package com.apsentinel.detection.model;

public enum AnomalyStatus {
    OPEN("open"),
    ACKNOWLEDGED("acknowledged"),
    DISMISSED("dismissed");

    private final String code;

    AnomalyStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isTerminal() {
        return this != OPEN;
    }

    public static AnomalyStatus fromCode(String code) {
        for (AnomalyStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("status must be one of: open, acknowledged, dismissed");
    }
}
