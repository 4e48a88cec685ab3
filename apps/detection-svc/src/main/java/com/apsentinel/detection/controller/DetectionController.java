package com.apsentinel.detection.controller;

import com.apsentinel.detection.controller.dto.DetectionResultDto;
import com.apsentinel.detection.service.DetectionService;
import com.apsentinel.detection.trace.RequestContextHolder;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/tenants/{tenantId}")
public class DetectionController {

    private final DetectionService detectionService;

    public DetectionController(DetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @PostMapping("/detect")
    public ResponseEntity<DetectionResultDto> detect(@PathVariable("tenantId") UUID tenantId) {
        RequestContextHolder.setTenantId(tenantId);
        int found = detectionService.runDetection(tenantId);
        return ResponseEntity.ok(new DetectionResultDto(tenantId.toString(), found, RequestContextHolder.currentTraceId()));
    }
}
