package com.serge.appointments.error;

import org.springframework.http.HttpStatus;

/** Requested start violates opening hours or the advance-booking bounds of the service. */
public class OutOfPolicyWindowException extends BookingException {
    public OutOfPolicyWindowException(String message) {
        super("OUT_OF_POLICY_WINDOW", HttpStatus.UNPROCESSABLE_ENTITY, message);
    }
}
