package com.serge.appointments.domain;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public enum AppointmentStatus {
    PENDING,
    CONFIRMED,
    COMPLETED,
    CANCELED,
    NO_SHOW;

    /** Statuses whose interval blocks the resource. */
    public static final Set<AppointmentStatus> OCCUPYING = EnumSet.of(PENDING, CONFIRMED, COMPLETED);

    public static final List<String> OCCUPYING_NAMES = OCCUPYING.stream().map(Enum::name).toList();

    public boolean occupiesTime() {
        return OCCUPYING.contains(this);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELED || this == NO_SHOW;
    }
}
