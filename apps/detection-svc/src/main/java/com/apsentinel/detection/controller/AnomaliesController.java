package com.apsentinel.detection.controller;

import com.apsentinel.detection.controller.dto.AnomaliesListResponseDto;
import com.apsentinel.detection.controller.dto.AnomalyResponseDto;
import com.apsentinel.detection.controller.dto.AnomalyUpdateRequestDto;
import com.apsentinel.detection.controller.dto.DashboardResponseDto;
import com.apsentinel.detection.model.Anomaly;
import com.apsentinel.detection.service.AnomalyService;
import com.apsentinel.detection.service.AnomalyView;
import com.apsentinel.detection.service.DashboardStats;
import com.apsentinel.detection.trace.RequestContextHolder;
import jakarta.validation.Valid;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/tenants/{tenantId}")
public class AnomaliesController {

    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final AnomalyService anomalyService;

    public AnomaliesController(AnomalyService anomalyService) {
        this.anomalyService = anomalyService;
    }

    @GetMapping("/anomalies")
    public ResponseEntity<AnomaliesListResponseDto> listAnomalies(
            @PathVariable("tenantId") UUID tenantId,
            @RequestParam(value = "status", required = false, defaultValue = "open") String status,
            @RequestParam(value = "limit", required = false, defaultValue = "100") Integer limit,
            @RequestParam(value = "offset", required = false, defaultValue = "0") Integer offset
    ) {
        RequestContextHolder.setTenantId(tenantId);
        List<AnomalyView> views = anomalyService.listAnomalies(tenantId, status, limit, offset);
        return ResponseEntity.ok(new AnomaliesListResponseDto(
                status,
                limit,
                offset,
                views.stream().map(this::map).toList(),
                RequestContextHolder.currentTraceId()
        ));
    }

    @PatchMapping("/anomalies/{anomalyId}")
    public ResponseEntity<AnomalyResponseDto> updateAnomaly(
            @PathVariable("tenantId") UUID tenantId,
            @PathVariable("anomalyId") UUID anomalyId,
            @RequestBody @Valid AnomalyUpdateRequestDto request
    ) {
        RequestContextHolder.setTenantId(tenantId);
        AnomalyView updated = anomalyService.updateStatus(tenantId, anomalyId, request.status(), request.resolutionNotes());
        return ResponseEntity.ok(map(updated));
    }

    @GetMapping("/anomalies/export")
    public ResponseEntity<String> exportAnomalies(@PathVariable("tenantId") UUID tenantId) {
        RequestContextHolder.setTenantId(tenantId);
        String csv = anomalyService.exportCsv(tenantId);
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(anomalyService.exportFilename())
                        .build()
                        .toString())
                .body(csv);
    }

    @GetMapping("/alerts")
    public ResponseEntity<List<AnomalyResponseDto>> openAlerts(@PathVariable("tenantId") UUID tenantId) {
        RequestContextHolder.setTenantId(tenantId);
        return ResponseEntity.ok(anomalyService.openAlerts(tenantId).stream().map(this::map).toList());
    }

    @GetMapping("/dashboard")
    public ResponseEntity<DashboardResponseDto> dashboard(@PathVariable("tenantId") UUID tenantId) {
        RequestContextHolder.setTenantId(tenantId);
        DashboardStats stats = anomalyService.dashboard(tenantId);
        return ResponseEntity.ok(new DashboardResponseDto(
                stats.vendorCount(),
                stats.billCount(),
                stats.anomalyCount(),
                stats.totalAnomalyAmount(),
                stats.highConfidenceCount()
        ));
    }

    private AnomalyResponseDto map(AnomalyView view) {
        Anomaly anomaly = view.anomaly();
        return new AnomalyResponseDto(
                anomaly.id().toString(),
                anomaly.billId() != null ? anomaly.billId().toString() : null,
                view.vendorName(),
                view.billNumber(),
                anomaly.kind().code(),
                anomaly.severity().code(),
                anomaly.amount(),
                anomaly.confidenceScore(),
                anomaly.description(),
                anomaly.metadata(),
                anomaly.shouldAlert(),
                anomaly.status().code(),
                anomaly.resolutionNotes(),
                anomaly.createdAt(),
                anomaly.acknowledgedAt()
        );
    }
}
