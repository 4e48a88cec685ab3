package com.apsentinel.detection.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final ApSentinelProperties props;

    public StartupDiagnostics(ApSentinelProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        var detection = props.detection();
        log.info("Detection config: alertMinAmount={}, alertSigmaThreshold={}, duplicateDayWindow={}d, baselineDays={}d",
                detection.alertMinAmount(), detection.alertSigmaThreshold(),
                detection.duplicateDayWindow(), detection.baselineDays());
        log.info("Alert config: maxBatch={}", props.alerts().maxBatch());
    }
}
