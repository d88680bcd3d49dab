package com.serge.appointments.error;

import org.springframework.http.HttpStatus;

public class ValidationException extends BookingException {
    public ValidationException(String message) {
        super("VALIDATION_ERROR", HttpStatus.BAD_REQUEST, message);
    }
}
