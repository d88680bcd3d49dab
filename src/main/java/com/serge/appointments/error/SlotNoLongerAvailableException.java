package com.serge.appointments.error;

import org.springframework.http.HttpStatus;

/** Another appointment holds an overlapping interval on the same resource. Never retried. */
public class SlotNoLongerAvailableException extends BookingException {
    public SlotNoLongerAvailableException(String message) {
        super("SLOT_NO_LONGER_AVAILABLE", HttpStatus.CONFLICT, message);
    }

    public SlotNoLongerAvailableException(String message, Throwable cause) {
        super("SLOT_NO_LONGER_AVAILABLE", HttpStatus.CONFLICT, message, cause);
    }
}
