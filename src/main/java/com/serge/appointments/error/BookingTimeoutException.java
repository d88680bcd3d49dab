package com.serge.appointments.error;

import org.springframework.http.HttpStatus;

/** The booking transaction ran past its deadline and was rolled back. Safe to resubmit. */
public class BookingTimeoutException extends BookingException {
    public BookingTimeoutException(String message, Throwable cause) {
        super("BOOKING_TIMEOUT", HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }
}
