package com.serge.appointments.schedule;

import java.util.Collection;
import java.util.Optional;

/**
 * Decides whether two time ranges conflict. Both the availability listing and the booking
 * transaction go through here, so what is offered and what is honoured cannot drift apart.
 */
public final class ConflictDetector {

    private ConflictDetector() {
    }

    /** Half-open overlap: a range ending at T does not conflict with one starting at T. */
    public static boolean overlaps(Interval a, Interval b) {
        return a.start().isBefore(b.end()) && b.start().isBefore(a.end());
    }

    public static boolean isFree(Interval candidate, Collection<Interval> occupied) {
        return firstConflict(candidate, occupied).isEmpty();
    }

    public static Optional<Interval> firstConflict(Interval candidate, Collection<Interval> occupied) {
        for (Interval o : occupied) {
            if (overlaps(candidate, o)) return Optional.of(o);
        }
        return Optional.empty();
    }
}
