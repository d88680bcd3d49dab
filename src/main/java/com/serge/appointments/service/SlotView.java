package com.serge.appointments.service;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One start time of the day. {@code staffId} is the first free staff member, null when the slot
 * is taken or when the service has no staff.
 */
public record SlotView(OffsetDateTime start, OffsetDateTime end, boolean available, UUID staffId) {
}
