package com.apsentinel.detection.controller;

import com.apsentinel.detection.controller.dto.ErrorResponseDto;
import com.apsentinel.detection.engine.DetectionRunException;
import com.apsentinel.detection.service.AnomalyNotFoundException;
import com.apsentinel.detection.trace.RequestContextHolder;
import jakarta.validation.ConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponseDto> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", "Invalid value for " + ex.getName(), Map.of());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidBody(MethodArgumentNotValidException ex) {
        Map<String, Object> fields = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach(error -> fields.putIfAbsent(error.getField(), error.getDefaultMessage()));
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request body failed validation", fields);
    }

    @ExceptionHandler({ConstraintViolationException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(AnomalyNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleNotFound(AnomalyNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "ANOMALY_NOT_FOUND", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(DetectionRunException.class)
    public ResponseEntity<ErrorResponseDto> handleDetectionFailure(DetectionRunException ex) {
        Throwable cause = ex.getCause();
        return build(HttpStatus.SERVICE_UNAVAILABLE, "DETECTION_FAILED", "Detection run failed; no anomalies were recorded", Map.of(
                "tenantId", String.valueOf(ex.getTenantId()),
                "reason", cause != null && cause.getMessage() != null ? cause.getMessage() : ex.getMessage()
        ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error",
                Map.of("reason", String.valueOf(ex.getMessage())));
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details, RequestContextHolder.currentTraceId()));
    }
}
