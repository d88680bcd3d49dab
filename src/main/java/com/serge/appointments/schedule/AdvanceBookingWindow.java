package com.serge.appointments.schedule;

import java.time.Duration;
import java.time.Instant;

/**
 * How early and how far ahead a service may be booked, relative to "now".
 */
public record AdvanceBookingWindow(Duration minAdvance, Duration maxAdvance) {

    public enum Verdict { OK, IN_PAST, TOO_SOON, TOO_FAR }

    public static AdvanceBookingWindow of(int minAdvanceHours, int maxAdvanceDays) {
        return new AdvanceBookingWindow(Duration.ofHours(minAdvanceHours), Duration.ofDays(maxAdvanceDays));
    }

    public Verdict check(Instant start, Instant now) {
        if (start.isBefore(now)) return Verdict.IN_PAST;
        if (start.isBefore(now.plus(minAdvance))) return Verdict.TOO_SOON;
        if (start.isAfter(now.plus(maxAdvance))) return Verdict.TOO_FAR;
        return Verdict.OK;
    }

    public boolean permits(Instant start, Instant now) {
        return check(start, now) == Verdict.OK;
    }
}
