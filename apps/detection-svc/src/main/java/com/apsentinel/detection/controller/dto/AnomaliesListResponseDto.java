package com.apsentinel.detection.controller.dto;

import java.util.List;

public record AnomaliesListResponseDto(
        String status,
        int limit,
        int offset,
        List<AnomalyResponseDto> anomalies,
        String traceId
) {
}
