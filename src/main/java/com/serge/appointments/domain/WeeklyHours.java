package com.serge.appointments.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.serge.appointments.error.InvalidHoursException;
import lombok.EqualsAndHashCode;

import java.time.DayOfWeek;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Weekly recurring hours, one {@link DayHours} per weekday. Keys on the wire are lowercase day
 * names or {@code "0".."6"} with 0 = Sunday. A weekday without an entry is closed.
 */
@EqualsAndHashCode
public final class WeeklyHours {

    private static final List<DayOfWeek> SUNDAY_FIRST = List.of(
            DayOfWeek.SUNDAY, DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY,
            DayOfWeek.THURSDAY, DayOfWeek.FRIDAY, DayOfWeek.SATURDAY);

    private final Map<DayOfWeek, DayHours> days = new EnumMap<>(DayOfWeek.class);

    public WeeklyHours(Map<DayOfWeek, DayHours> days) {
        days.forEach((d, h) -> {
            if (h != null) this.days.put(d, h);
        });
    }

    public static WeeklyHours of(Map<DayOfWeek, DayHours> days) {
        return new WeeklyHours(days);
    }

    /** Same hours Monday to Friday, weekend closed. */
    public static WeeklyHours weekdays(DayHours hours) {
        Map<DayOfWeek, DayHours> m = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek d : DayOfWeek.values()) {
            m.put(d, d == DayOfWeek.SATURDAY || d == DayOfWeek.SUNDAY ? DayHours.closed() : hours);
        }
        return new WeeklyHours(m);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static WeeklyHours fromJson(Map<String, DayHours> raw) {
        Map<DayOfWeek, DayHours> parsed = new EnumMap<>(DayOfWeek.class);
        if (raw != null) {
            for (Map.Entry<String, DayHours> e : raw.entrySet()) {
                DayOfWeek day = parseDay(e.getKey());
                if (parsed.containsKey(day)) {
                    throw new InvalidHoursException("weekday " + day + " is given more than once");
                }
                if (e.getValue() != null) parsed.put(day, e.getValue());
            }
        }
        return new WeeklyHours(parsed);
    }

    @JsonValue
    public Map<String, DayHours> toJson() {
        Map<String, DayHours> out = new LinkedHashMap<>();
        for (DayOfWeek d : SUNDAY_FIRST) {
            DayHours h = days.get(d);
            if (h != null) out.put(d.name().toLowerCase(Locale.ROOT), h);
        }
        return out;
    }

    static DayOfWeek parseDay(String key) {
        if (key == null) throw new InvalidHoursException("weekday key is missing");
        String k = key.trim().toUpperCase(Locale.ROOT);
        if (k.length() == 1 && Character.isDigit(k.charAt(0))) {
            int idx = k.charAt(0) - '0';
            if (idx > 6) throw new InvalidHoursException("weekday index " + key + " is not in 0..6");
            return SUNDAY_FIRST.get(idx);
        }
        try {
            return DayOfWeek.valueOf(k);
        } catch (IllegalArgumentException e) {
            throw new InvalidHoursException("unknown weekday '" + key + "'");
        }
    }

    public Optional<DayHours> forDay(DayOfWeek day) {
        return Optional.ofNullable(days.get(day));
    }

    public boolean isEmpty() {
        return days.isEmpty();
    }

    /** Strict check used when hours are written; stored hours are only checked leniently on read. */
    public WeeklyHours requireValid() {
        for (DayOfWeek d : SUNDAY_FIRST) {
            DayHours h = days.get(d);
            if (h == null) continue;
            h.problem().ifPresent(p -> {
                throw new InvalidHoursException(d.name().toLowerCase(Locale.ROOT) + ": " + p);
            });
        }
        return this;
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
