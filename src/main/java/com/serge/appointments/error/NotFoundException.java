package com.serge.appointments.error;

import org.springframework.http.HttpStatus;

public class NotFoundException extends BookingException {
    public NotFoundException(String message) {
        super("NOT_FOUND", HttpStatus.NOT_FOUND, message);
    }

    public static NotFoundException of(String what, Object id) {
        return new NotFoundException(what + " " + id + " not found");
    }
}
