package com.serge.appointments.schedule;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Raw {@code (start, start + duration)} pair on the wall clock of the business.
 */
public record CandidateSlot(LocalTime start, LocalTime end) {

    public Instant startAt(LocalDate date, ZoneId zone) {
        return date.atTime(start).atZone(zone).toInstant();
    }

    public Instant endAt(LocalDate date, ZoneId zone) {
        return date.atTime(end).atZone(zone).toInstant();
    }
}
