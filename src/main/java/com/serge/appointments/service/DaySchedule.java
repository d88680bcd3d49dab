package com.serge.appointments.service;

import com.serge.appointments.schedule.TimeWindow;

import java.time.LocalDate;
import java.util.List;

/**
 * Resolved opening of one business day: the open sub-windows in order, empty when closed.
 */
public record DaySchedule(LocalDate date, List<TimeWindow> windows, Source source) {

    public enum Source { OVERRIDE, WEEKLY, FALLBACK }

    public DaySchedule {
        windows = List.copyOf(windows);
    }

    public static DaySchedule closed(LocalDate date, Source source) {
        return new DaySchedule(date, List.of(), source);
    }

    public boolean isClosed() {
        return windows.isEmpty();
    }
}
