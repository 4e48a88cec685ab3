package com.apsentinel.detection.health;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness check for load balancers. Reports only that the web layer is up; database health
 * stays on the Actuator side.
 */
@RestController
public class HealthzController {

    private final String serviceName;

    public HealthzController(@Value("${spring.application.name:detection-svc}") String serviceName) {
        this.serviceName = serviceName;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> healthz() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("service", serviceName);
        return body;
    }
}
