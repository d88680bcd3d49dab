package com.serge.appointments.domain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.serge.appointments.error.InvalidHoursException;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WeeklyHoursTest {

    private final ObjectMapper om = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    void parses_day_names_and_sunday_based_indexes() throws Exception {
        WeeklyHours h = om.readValue("""
                {"monday": {"isOpen": true, "openTime": "09:00", "closeTime": "17:00", "breakStart": "12:00", "breakEnd": "13:00"},
                 "0": {"isOpen": false},
                 "6": {"isOpen": true, "openTime": "10:00", "closeTime": "14:00"}}
                """, WeeklyHours.class);

        assertThat(h.forDay(DayOfWeek.MONDAY)).contains(
                DayHours.open(LocalTime.of(9, 0), LocalTime.of(17, 0)).withBreak(LocalTime.of(12, 0), LocalTime.of(13, 0)));
        assertThat(h.forDay(DayOfWeek.SUNDAY)).contains(DayHours.closed());
        assertThat(h.forDay(DayOfWeek.SATURDAY).orElseThrow().openTime()).isEqualTo(LocalTime.of(10, 0));
        assertThat(h.forDay(DayOfWeek.TUESDAY)).isEmpty();
    }

    @Test
    void writes_lowercase_names_sunday_first() throws Exception {
        WeeklyHours h = WeeklyHours.of(Map.of(
                DayOfWeek.MONDAY, DayHours.open(LocalTime.of(9, 0), LocalTime.of(17, 0)),
                DayOfWeek.SUNDAY, DayHours.closed()));

        String json = om.writeValueAsString(h);
        assertThat(json).isEqualTo("{\"sunday\":{\"isOpen\":false},"
                + "\"monday\":{\"isOpen\":true,\"openTime\":\"09:00\",\"closeTime\":\"17:00\"}}");
        assertThat(om.readValue(json, WeeklyHours.class)).isEqualTo(h);
    }

    @Test
    void unknown_or_duplicate_weekday_is_rejected() {
        assertThatThrownBy(() -> om.readValue("{\"funday\": {\"isOpen\": false}}", WeeklyHours.class))
                .isInstanceOf(ValueInstantiationException.class)
                .hasRootCauseInstanceOf(InvalidHoursException.class);
        assertThatThrownBy(() -> om.readValue("{\"7\": {\"isOpen\": false}}", WeeklyHours.class))
                .hasRootCauseInstanceOf(InvalidHoursException.class);
        assertThatThrownBy(() -> om.readValue("{\"1\": {\"isOpen\": false}, \"monday\": {\"isOpen\": false}}", WeeklyHours.class))
                .hasRootCauseInstanceOf(InvalidHoursException.class);
    }

    @Test
    void strict_validation_names_the_bad_day() {
        WeeklyHours inverted = WeeklyHours.of(Map.of(DayOfWeek.TUESDAY, DayHours.open(LocalTime.of(18, 0), LocalTime.of(9, 0))));
        assertThatThrownBy(inverted::requireValid)
                .isInstanceOf(InvalidHoursException.class)
                .hasMessageStartingWith("tuesday:");

        WeeklyHours breakOutside = WeeklyHours.of(Map.of(DayOfWeek.FRIDAY,
                DayHours.open(LocalTime.of(9, 0), LocalTime.of(12, 0)).withBreak(LocalTime.of(11, 30), LocalTime.of(12, 30))));
        assertThatThrownBy(breakOutside::requireValid).hasMessageContaining("outside");

        WeeklyHours halfBreak = WeeklyHours.of(Map.of(DayOfWeek.FRIDAY,
                new DayHours(true, LocalTime.of(9, 0), LocalTime.of(12, 0), LocalTime.of(10, 0), null)));
        assertThatThrownBy(halfBreak::requireValid).hasMessageContaining("together");

        WeeklyHours missingTimes = WeeklyHours.of(Map.of(DayOfWeek.MONDAY, new DayHours(true, null, null, null, null)));
        assertThatThrownBy(missingTimes::requireValid).isInstanceOf(InvalidHoursException.class);
    }

    @Test
    void closed_days_and_sane_hours_pass() {
        WeeklyHours h = WeeklyHours.weekdays(DayHours.open(LocalTime.of(9, 0), LocalTime.of(17, 0)));
        assertThat(h.requireValid()).isSameAs(h);
        assertThat(h.forDay(DayOfWeek.SATURDAY)).contains(DayHours.closed());
    }
}
