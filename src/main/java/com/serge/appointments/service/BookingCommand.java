package com.serge.appointments.service;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A request to reserve exactly {@code start}. {@code staffId} and {@code idempotencyKey} may be null.
 */
public record BookingCommand(UUID businessId,
                             UUID serviceId,
                             UUID staffId,
                             String customerId,
                             OffsetDateTime start,
                             String customerNotes,
                             String idempotencyKey) {
}
