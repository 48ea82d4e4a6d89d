package com.raffleapp.common.exception;

import com.raffleapp.raffle.dto.common.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.*;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({BadRequestException.class, InsufficientFeeException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RaffleException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<ErrorResponse> handleForbidden(ForbiddenException ex) {
        return respond(HttpStatus.FORBIDDEN, ex);
    }

    // Round is in the wrong state for the call; the caller may retry once it changes
    @ExceptionHandler({
            RoundNotOpenException.class,
            UpkeepNotNeededException.class,
            UnknownOrStaleRequestException.class,
            NoEntrantsException.class,
            DrawNotStalledException.class
    })
    public ResponseEntity<ErrorResponse> handleConflict(RaffleException ex) {
        return respond(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler({OracleRequestFailedException.class, PayoutFailedException.class})
    public ResponseEntity<ErrorResponse> handleUpstreamFailure(RaffleException ex) {
        log.warn("Upstream failure {}: {} {}", ex.getErrorCode(), ex.getMessage(), ex.getDetails());
        return respond(HttpStatus.BAD_GATEWAY, ex);
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

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex) {
        List<Map<String, Object>> errors = new ArrayList<>();
        for (ConstraintViolation<?> v : ex.getConstraintViolations()) {
            Map<String, Object> e = new LinkedHashMap<>();
            e.put("path", String.valueOf(v.getPropertyPath()));
            e.put("message", v.getMessage());
            Object invalid = v.getInvalidValue();
            if (invalid != null) e.put("invalidValue", invalid);
            errors.add(e);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("errors", errors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(buildError("Validation failed", "BAD_REQUEST", details));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(buildError("Missing header " + ex.getHeaderName(), "FORBIDDEN", null));
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
        log.error("Unhandled exception", ex);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("timestamp", Instant.now().toString());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildError("Unexpected error", "INTERNAL_SERVER_ERROR", details));
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, RaffleException ex) {
        return ResponseEntity.status(status)
                .body(buildError(ex.getMessage(), ex.getErrorCode(), ex.getDetails()));
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
        String traceId = MDC.get("traceId");
        if (traceId == null || traceId.isBlank()) {
            traceId = UUID.randomUUID().toString();
            MDC.put("traceId", traceId);
        }
        return traceId;
    }
}
