package com.serge.appointments.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.serge.appointments.schedule.TimeWindow;

import java.time.LocalTime;
import java.util.Optional;

/**
 * Opening hours of one day: {@code {isOpen, openTime, closeTime, breakStart?, breakEnd?}}.
 * Times are wall-clock {@code HH:mm} in the business timezone.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"isOpen", "openTime", "closeTime", "breakStart", "breakEnd"})
public record DayHours(
        @JsonProperty("isOpen") boolean open,
        @JsonFormat(pattern = "HH:mm") LocalTime openTime,
        @JsonFormat(pattern = "HH:mm") LocalTime closeTime,
        @JsonFormat(pattern = "HH:mm") LocalTime breakStart,
        @JsonFormat(pattern = "HH:mm") LocalTime breakEnd) {

    public static DayHours closed() {
        return new DayHours(false, null, null, null, null);
    }

    public static DayHours open(LocalTime from, LocalTime to) {
        return new DayHours(true, from, to, null, null);
    }

    public DayHours withBreak(LocalTime from, LocalTime to) {
        return new DayHours(open, openTime, closeTime, from, to);
    }

    /** Problem with the open/close pair, if any. Closed days never have one. */
    public Optional<String> windowProblem() {
        if (!open) return Optional.empty();
        if (openTime == null || closeTime == null) return Optional.of("openTime and closeTime are required when open");
        if (!openTime.isBefore(closeTime)) return Optional.of("openTime " + openTime + " is not before closeTime " + closeTime);
        return Optional.empty();
    }

    /** Problem with the break, if any. Assumes the window itself is valid. */
    public Optional<String> breakProblem() {
        if (!open || (breakStart == null && breakEnd == null)) return Optional.empty();
        if (breakStart == null || breakEnd == null) return Optional.of("breakStart and breakEnd must be given together");
        if (!breakStart.isBefore(breakEnd)) return Optional.of("breakStart " + breakStart + " is not before breakEnd " + breakEnd);
        if (breakStart.isBefore(openTime) || breakEnd.isAfter(closeTime)) {
            return Optional.of("break " + breakStart + "-" + breakEnd + " is outside " + openTime + "-" + closeTime);
        }
        return Optional.empty();
    }

    public Optional<String> problem() {
        return windowProblem().or(this::breakProblem);
    }

    public TimeWindow window() {
        return new TimeWindow(openTime, closeTime);
    }

    public Optional<TimeWindow> breakWindow() {
        return breakStart == null || breakEnd == null ? Optional.empty() : Optional.of(new TimeWindow(breakStart, breakEnd));
    }
}
