package com.serge.appointments.schedule;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Wall-clock window {@code [start, end)} inside a single calendar day, in the business timezone.
 */
public record TimeWindow(LocalTime start, LocalTime end) {

    public static final Comparator<TimeWindow> BY_START = Comparator.comparing(TimeWindow::start);

    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public static TimeWindow parse(String hhmmFrom, String hhmmTo) {
        return new TimeWindow(LocalTime.parse(hhmmFrom), LocalTime.parse(hhmmTo));
    }

    public boolean isEmpty() {
        return !start.isBefore(end);
    }

    public long minutes() {
        return isEmpty() ? 0 : (end.toSecondOfDay() - start.toSecondOfDay()) / 60;
    }

    /** True when {@code [from, to)} lies entirely inside this window. */
    public boolean encloses(LocalTime from, LocalTime to) {
        return !from.isBefore(start) && !to.isAfter(end) && from.isBefore(to);
    }

    public Optional<TimeWindow> intersect(TimeWindow other) {
        LocalTime s = start.isAfter(other.start) ? start : other.start;
        LocalTime e = end.isBefore(other.end) ? end : other.end;
        TimeWindow w = new TimeWindow(s, e);
        return w.isEmpty() ? Optional.empty() : Optional.of(w);
    }

    /** Removes {@code cut} from this window, leaving zero, one or two pieces. */
    public List<TimeWindow> minus(TimeWindow cut) {
        if (cut.isEmpty() || !cut.start.isBefore(end) || !start.isBefore(cut.end)) {
            return isEmpty() ? List.of() : List.of(this);
        }
        List<TimeWindow> out = new ArrayList<>(2);
        if (start.isBefore(cut.start)) out.add(new TimeWindow(start, cut.start));
        if (cut.end.isBefore(end)) out.add(new TimeWindow(cut.end, end));
        return out;
    }

    public static List<TimeWindow> subtract(List<TimeWindow> windows, TimeWindow cut) {
        List<TimeWindow> out = new ArrayList<>();
        for (TimeWindow w : windows) {
            out.addAll(w.minus(cut));
        }
        out.sort(BY_START);
        return out;
    }

    public static List<TimeWindow> intersect(List<TimeWindow> windows, TimeWindow limit) {
        List<TimeWindow> out = new ArrayList<>();
        for (TimeWindow w : windows) {
            w.intersect(limit).ifPresent(out::add);
        }
        out.sort(BY_START);
        return out;
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
