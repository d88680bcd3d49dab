package com.serge.appointments.schedule;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks each open window in fixed steps and emits every start at which the service plus its
 * trailing buffer still fits before the window closes. Knows nothing about appointments.
 */
public final class SlotGenerator {

    private SlotGenerator() {
    }

    public static List<CandidateSlot> generate(List<TimeWindow> windows, int durationMinutes,
                                               int bufferMinutes, int granularityMinutes) {
        if (durationMinutes <= 0) throw new IllegalArgumentException("durationMinutes must be > 0");
        if (bufferMinutes < 0) throw new IllegalArgumentException("bufferMinutes must be >= 0");
        if (granularityMinutes <= 0) throw new IllegalArgumentException("granularityMinutes must be > 0");

        List<CandidateSlot> out = new ArrayList<>();
        for (TimeWindow w : windows) {
            if (w.isEmpty()) continue;
            // minute-of-day arithmetic so that nothing wraps past midnight
            int open = w.start().toSecondOfDay() / 60;
            int close = w.end().toSecondOfDay() / 60;
            for (int s = open; s + durationMinutes + bufferMinutes <= close; s += granularityMinutes) {
                out.add(new CandidateSlot(minuteOfDay(s), minuteOfDay(s + durationMinutes)));
            }
        }
        return out;
    }

    private static LocalTime minuteOfDay(int minutes) {
        return LocalTime.of(minutes / 60, minutes % 60);
    }
}
