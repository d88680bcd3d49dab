package com.serge.appointments.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base of every failure the engine reports to callers. Carries the stable error code that
 * ends up in the response body and the HTTP status it maps to.
 */
@Getter
public abstract class BookingException extends RuntimeException {
    private final String code;
    private final HttpStatus status;

    protected BookingException(String code, HttpStatus status, String message) {
        super(message);
        this.code = code;
        this.status = status;
    }

    protected BookingException(String code, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }
}
