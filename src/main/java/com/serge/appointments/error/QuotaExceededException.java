package com.serge.appointments.error;

import org.springframework.http.HttpStatus;

public class QuotaExceededException extends BookingException {
    public QuotaExceededException(String message) {
        super("QUOTA_EXCEEDED", HttpStatus.TOO_MANY_REQUESTS, message);
    }
}
