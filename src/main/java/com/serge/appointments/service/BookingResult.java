package com.serge.appointments.service;

import com.serge.appointments.domain.Appointment;

/**
 * @param replayed true when an earlier submission with the same idempotency key is returned
 */
public record BookingResult(Appointment appointment, boolean replayed) {
}
