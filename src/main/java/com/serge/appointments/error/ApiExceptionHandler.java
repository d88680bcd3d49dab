package com.serge.appointments.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders every failure as {@code {"error": CODE, "message": text}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(BookingException.class)
    public ResponseEntity<Map<String, Object>> handleBooking(BookingException e) {
        switch (e.getCode()) {
            case "NOT_FOUND" -> log.debug("api.error code={} message={}", e.getCode(), e.getMessage());
            case "BOOKING_TIMEOUT", "TRANSIENT_STORE_ERROR" ->
                    log.warn("api.error code={} message={} cause={}", e.getCode(), e.getMessage(), String.valueOf(e.getCause()));
            default -> log.info("api.error code={} message={}", e.getCode(), e.getMessage());
        }
        Map<String, Object> body = body(e.getCode(), e.getMessage());
        if (e instanceof InvalidTransitionException) {
            InvalidTransitionException it = (InvalidTransitionException) e;
            body.put("current", it.getCurrent().name());
            if (it.getAttempted() != null) body.put("attempted", it.getAttempted().name());
        }
        return ResponseEntity.status(e.getStatus()).body(body);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleForbidden(AccessDeniedException e) {
        log.info("api.error code=FORBIDDEN message={}", e.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(body("FORBIDDEN", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.info("api.error code=VALIDATION_ERROR message={}", message);
        return ResponseEntity.badRequest().body(body("VALIDATION_ERROR", message));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            MissingRequestHeaderException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception e) {
        // hours rejected while parsing the body carry their own message
        Throwable cause = e;
        while (cause.getCause() != null && !(cause instanceof InvalidHoursException)) {
            cause = cause.getCause();
        }
        String message = cause instanceof InvalidHoursException ? cause.getMessage() : e.getMessage();
        log.info("api.error code=VALIDATION_ERROR message={}", message);
        return ResponseEntity.badRequest().body(body("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        if (e instanceof ErrorResponse) {
            // framework errors such as unknown routes or methods keep their own status
            HttpStatusCode status = ((ErrorResponse) e).getStatusCode();
            log.debug("api.error status={} message={}", status.value(), e.getMessage());
            String code = status.value() == 404 ? "NOT_FOUND" : status.is4xxClientError() ? "BAD_REQUEST" : "INTERNAL_ERROR";
            return ResponseEntity.status(status).body(body(code, e.getMessage()));
        }
        log.error("api.error code=INTERNAL_ERROR", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("INTERNAL_ERROR", "Unexpected error"));
    }

    private static Map<String, Object> body(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message == null ? "" : message);
        return body;
    }
}
