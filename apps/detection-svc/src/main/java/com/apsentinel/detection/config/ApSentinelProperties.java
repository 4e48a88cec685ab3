package com.apsentinel.detection.config;

import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "apsentinel")
public record ApSentinelProperties(
        Detection detection,
        Alerts alerts
) {

    @ConstructorBinding
    public ApSentinelProperties {
        if (detection == null) {
            detection = new Detection(null, null, null, null);
        }
        if (alerts == null) {
            alerts = new Alerts(null);
        }
    }

    /**
     * Thresholds shared by the baseline calculator and the detectors. Missing values fall back
     * to the defaults used in production.
     */
    public record Detection(
            BigDecimal alertMinAmount,
            Double alertSigmaThreshold,
            Integer duplicateDayWindow,
            Integer baselineDays
    ) {
        public Detection {
            if (alertMinAmount == null) {
                alertMinAmount = BigDecimal.valueOf(500);
            }
            if (alertSigmaThreshold == null) {
                alertSigmaThreshold = 2.0d;
            }
            if (duplicateDayWindow == null) {
                duplicateDayWindow = 7;
            }
            if (baselineDays == null) {
                baselineDays = 90;
            }
            if (alertMinAmount.signum() < 0) {
                throw new IllegalArgumentException("alertMinAmount must not be negative");
            }
            if (!(alertSigmaThreshold > 0)) {
                throw new IllegalArgumentException("alertSigmaThreshold must be positive");
            }
            if (duplicateDayWindow < 0) {
                throw new IllegalArgumentException("duplicateDayWindow must not be negative");
            }
            if (baselineDays <= 0) {
                throw new IllegalArgumentException("baselineDays must be positive");
            }
        }
    }

    public record Alerts(Integer maxBatch) {
        public Alerts {
            if (maxBatch == null) {
                maxBatch = 50;
            }
            if (maxBatch <= 0) {
                throw new IllegalArgumentException("maxBatch must be positive");
            }
        }
    }
}
