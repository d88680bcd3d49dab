package com.serge.appointments.domain;

import com.serge.appointments.error.InvalidTransitionException;
import com.serge.appointments.error.ValidationException;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Allowed status moves and the timestamp each one stamps.
 * <pre>
 * PENDING   -> CONFIRMED | CANCELED | NO_SHOW
 * CONFIRMED -> COMPLETED | CANCELED | NO_SHOW
 * </pre>
 * COMPLETED, CANCELED and NO_SHOW are terminal.
 */
public final class AppointmentStateMachine {

    private static final Map<AppointmentStatus, Set<AppointmentStatus>> ALLOWED = new EnumMap<>(AppointmentStatus.class);

    static {
        ALLOWED.put(AppointmentStatus.PENDING, EnumSet.of(
                AppointmentStatus.CONFIRMED, AppointmentStatus.CANCELED, AppointmentStatus.NO_SHOW));
        ALLOWED.put(AppointmentStatus.CONFIRMED, EnumSet.of(
                AppointmentStatus.COMPLETED, AppointmentStatus.CANCELED, AppointmentStatus.NO_SHOW));
        ALLOWED.put(AppointmentStatus.COMPLETED, EnumSet.noneOf(AppointmentStatus.class));
        ALLOWED.put(AppointmentStatus.CANCELED, EnumSet.noneOf(AppointmentStatus.class));
        ALLOWED.put(AppointmentStatus.NO_SHOW, EnumSet.noneOf(AppointmentStatus.class));
    }

    private AppointmentStateMachine() {
    }

    public static Set<AppointmentStatus> targetsOf(AppointmentStatus from) {
        return Collections.unmodifiableSet(ALLOWED.get(from));
    }

    public static boolean canTransition(AppointmentStatus from, AppointmentStatus to) {
        return ALLOWED.get(from).contains(to);
    }

    /**
     * Moves the appointment to {@code target}.
     *
     * @return false when it already was in {@code target} (nothing touched), true otherwise
     * @throws InvalidTransitionException when the move is not in the graph
     * @throws ValidationException when cancelling without a reason
     */
    public static boolean apply(Appointment a, AppointmentStatus target, String reason, OffsetDateTime now) {
        AppointmentStatus current = a.getStatus();
        if (current == target) return false;
        if (!canTransition(current, target)) {
            throw new InvalidTransitionException(current, target);
        }
        switch (target) {
            case CONFIRMED -> {
                if (a.getConfirmedAt() == null) a.setConfirmedAt(now);
            }
            case COMPLETED -> {
                if (a.getCompletedAt() == null) a.setCompletedAt(now);
            }
            case CANCELED -> {
                if (reason == null || reason.isBlank()) {
                    throw new ValidationException("A cancellation reason is required");
                }
                a.setCancelReason(reason.trim());
                if (a.getCanceledAt() == null) a.setCanceledAt(now);
            }
            case NO_SHOW -> {
                if (a.getCanceledAt() == null) a.setCanceledAt(now);
            }
            default -> throw new InvalidTransitionException(current, target);
        }
        a.setStatus(target);
        a.setUpdatedAt(now);
        return true;
    }
}
