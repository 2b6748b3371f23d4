package com.proxycare.common.exception;

import com.proxycare.common.trace.TraceIdFilter;
import com.proxycare.pool.dto.common.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.*;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String RETRY_AFTER_SECONDS = "5";

    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(BadRequestException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(buildError(ex.getMessage(), ex.getErrorCode(), ex.getDetails()));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(buildError(ex.getMessage(), ex.getErrorCode(), ex.getDetails()));
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ConflictException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(buildError(ex.getMessage(), ex.getErrorCode(), ex.getDetails()));
    }

    @ExceptionHandler(PoolFailureException.class)
    public ResponseEntity<ErrorResponse> handlePoolFailure(PoolFailureException ex) {
        // Exhausted and unavailable are both "come back later"; the errorCode tells them apart
        HttpStatus status = switch (ex.getReason()) {
            case EXHAUSTED, UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case UNKNOWN_STATUS -> HttpStatus.UNPROCESSABLE_ENTITY;
        };

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", ex.getReason().name());
        details.put("retryable", ex.isRetryable());
        if (ex.getDetails() != null && !ex.getDetails().isEmpty()) {
            details.putAll(ex.getDetails());
        }

        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        if (ex.isRetryable()) {
            builder.header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS);
        }
        return builder.body(buildError(ex.getMessage(), ex.getErrorCode(), details));
    }

    // Admin and summary reads go to the repositories directly; an outage there is still UNAVAILABLE
    @ExceptionHandler({
            CannotCreateTransactionException.class,
            DataAccessResourceFailureException.class,
            TransientDataAccessException.class,
            RecoverableDataAccessException.class
    })
    public ResponseEntity<ErrorResponse> handleStoreOutage(Exception ex) {
        log.warn("Proxy store unavailable: {}", ex.getMessage());
        return handlePoolFailure(
                new PoolFailureException("Proxy store unavailable", PoolFailureReason.UNAVAILABLE, null, ex));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        List<Map<String, Object>> errors = new ArrayList<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            Map<String, Object> e = new LinkedHashMap<>();
            e.put("field", fe.getField());
            e.put("message", fe.getDefaultMessage());
            e.put("rejectedValue", fe.getRejectedValue());
            errors.add(e);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("errors", errors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(buildError("Validation failed", "BAD_REQUEST", details));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableJson(HttpMessageNotReadableException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("timestamp", Instant.now().toString());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(buildError("Malformed request body", "BAD_REQUEST", details));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex) {
        log.error("Unhandled error", ex);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("timestamp", Instant.now().toString());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildError("Unexpected error", "INTERNAL_SERVER_ERROR", details));
    }

    private ErrorResponse buildError(String message, String errorCode, Map<String, Object> details) {
        return ErrorResponse.builder()
                .message(message)
                .errorCode(errorCode)
                .details((details == null || details.isEmpty()) ? null : details)
                .traceId(getOrCreateTraceId())
                .build();
    }

    private String getOrCreateTraceId() {
        String traceId = MDC.get(TraceIdFilter.TRACE_ID_KEY);
        if (traceId == null || traceId.isBlank()) {
            traceId = UUID.randomUUID().toString();
            MDC.put(TraceIdFilter.TRACE_ID_KEY, traceId);
        }
        return traceId;
    }
}
