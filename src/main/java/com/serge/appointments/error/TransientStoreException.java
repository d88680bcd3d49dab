package com.serge.appointments.error;

import org.springframework.http.HttpStatus;

/** Lock timeouts, deadlocks or serialization failures that outlived the internal retries. */
public class TransientStoreException extends BookingException {
    public TransientStoreException(String message, Throwable cause) {
        super("TRANSIENT_STORE_ERROR", HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }
}
