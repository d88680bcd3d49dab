package com.serge.appointments.service;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Plan limits owned by the subscription side. Asked once per booking, before any transaction.
 */
public interface BookingQuotaGate {

    boolean mayAcceptAppointment(UUID businessId, LocalDate date);
}
