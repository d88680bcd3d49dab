package com.serge.appointments.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Absolute half-open interval {@code [start, end)}.
 */
public record Interval(Instant start, Instant end) {

    public Interval {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end " + end + " is before start " + start);
        }
    }

    public boolean isEmpty() {
        return start.equals(end);
    }

    public Interval widen(Duration before, Duration after) {
        return new Interval(start.minus(before), end.plus(after));
    }
}
