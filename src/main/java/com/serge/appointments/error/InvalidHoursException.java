package com.serge.appointments.error;

import org.springframework.http.HttpStatus;

/** Malformed opening hours rejected at ingestion. */
public class InvalidHoursException extends BookingException {
    public InvalidHoursException(String message) {
        super("VALIDATION_ERROR", HttpStatus.BAD_REQUEST, message);
    }
}
