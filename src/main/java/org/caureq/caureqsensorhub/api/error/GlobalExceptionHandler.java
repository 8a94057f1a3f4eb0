package org.caureq.caureqsensorhub.api.error;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqsensorhub.service.alerts.AlertNotFoundException;
import org.caureq.caureqsensorhub.service.ingest.RejectionReason;
import org.caureq.caureqsensorhub.store.TransientStorageException;
import org.springframework.http.*;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private ApiError build(ErrorCode code, String msg, String cid, Map<String,Object> details) {
        return new ApiError(Instant.now(), code, msg, cid, details);
    }

    private String cid(HttpServletRequest req) {
        return req.getHeader("X-Correlation-Id");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex,
                                                     HttpServletRequest req) {
        var fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> Map.of("field", fe.getField(), "message", String.valueOf(fe.getDefaultMessage())))
                .toList();
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, "Validation error", cid(req), Map.of("fieldErrors", fieldErrors))
        );
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex,
                                                     HttpServletRequest req) {
        return ResponseEntity.badRequest().body(
                build(ErrorCode.MALFORMED_PAYLOAD, "Request body is not valid JSON for this endpoint", cid(req), Map.of())
        );
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                       HttpServletRequest req) {
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, "Invalid value for parameter " + ex.getName(), cid(req),
                        Map.of("parameter", ex.getName()))
        );
    }

    @ExceptionHandler(ReadingRejectedException.class)
    public ResponseEntity<ApiError> handleRejected(ReadingRejectedException ex, HttpServletRequest req) {
        var status = ex.reason() == RejectionReason.PIPELINE_UNAVAILABLE
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(
                build(ErrorCode.of(ex.reason()), ex.getMessage(), cid(req), Map.of("reason", ex.reason().name()))
        );
    }

    @ExceptionHandler(SensorNotFoundException.class)
    public ResponseEntity<ApiError> handleSensorNotFound(SensorNotFoundException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                build(ErrorCode.SENSOR_NOT_FOUND, ex.getMessage(), cid(req), Map.of())
        );
    }

    @ExceptionHandler(AlertNotFoundException.class)
    public ResponseEntity<ApiError> handleAlertNotFound(AlertNotFoundException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                build(ErrorCode.ALERT_NOT_FOUND, ex.getMessage(), cid(req), Map.of())
        );
    }

    @ExceptionHandler(TransientStorageException.class)
    public ResponseEntity<ApiError> handleStorage(TransientStorageException ex, HttpServletRequest req) {
        log.warn("storage unavailable on {}: {}", req.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                build(ErrorCode.SERVICE_UNAVAILABLE, "Storage temporarily unavailable", cid(req), Map.of())
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArg(IllegalArgumentException ex,
                                                     HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
                build(ErrorCode.BAD_REQUEST, ex.getMessage(), cid(req), Map.of())
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleAny(Exception ex, HttpServletRequest req) {
        log.error("unhandled error on {}", req.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                build(ErrorCode.INTERNAL_ERROR, ex.getMessage(), cid(req), Map.of())
        );
    }
}
