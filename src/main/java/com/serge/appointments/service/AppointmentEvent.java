package com.serge.appointments.service;

import com.serge.appointments.domain.Appointment;
import com.serge.appointments.domain.AppointmentStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public record AppointmentEvent(AppointmentEventType type,
                               UUID appointmentId,
                               UUID businessId,
                               String customerId,
                               AppointmentStatus status,
                               OffsetDateTime occurredAt) {

    public static AppointmentEvent of(AppointmentEventType type, Appointment a, OffsetDateTime at) {
        return new AppointmentEvent(type, a.getId(), a.getBusinessId(), a.getCustomerId(), a.getStatus(), at);
    }
}
