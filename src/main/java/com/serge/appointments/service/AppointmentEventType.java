package com.serge.appointments.service;

import com.serge.appointments.domain.AppointmentStatus;

public enum AppointmentEventType {
    BOOKED,
    RESCHEDULED,
    CONFIRMED,
    COMPLETED,
    CANCELED,
    NO_SHOW;

    public static AppointmentEventType of(AppointmentStatus status) {
        return switch (status) {
            case CONFIRMED -> CONFIRMED;
            case COMPLETED -> COMPLETED;
            case CANCELED -> CANCELED;
            case NO_SHOW -> NO_SHOW;
            case PENDING -> throw new IllegalArgumentException("nothing transitions into PENDING");
        };
    }
}
