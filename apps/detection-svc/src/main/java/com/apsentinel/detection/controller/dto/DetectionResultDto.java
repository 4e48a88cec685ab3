package com.apsentinel.detection.controller.dto;

public record DetectionResultDto(String tenantId, int anomaliesFound, String traceId) {
}
