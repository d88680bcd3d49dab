package com.serge.appointments.schedule;

import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlotGeneratorTest {

    @Test
    void walks_window_in_granularity_steps_until_service_and_buffer_no_longer_fit() {
        List<CandidateSlot> slots = SlotGenerator.generate(
                List.of(TimeWindow.parse("09:00", "17:00")), 30, 10, 15);

        assertThat(slots.get(0)).isEqualTo(new CandidateSlot(LocalTime.of(9, 0), LocalTime.of(9, 30)));
        assertThat(slots.get(1).start()).isEqualTo(LocalTime.of(9, 15));
        // 16:15 + 30 + 10 = 16:55 fits, 16:30 + 40 = 17:10 does not
        assertThat(slots.get(slots.size() - 1)).isEqualTo(new CandidateSlot(LocalTime.of(16, 15), LocalTime.of(16, 45)));
        assertThat(slots).hasSize(30);
    }

    @Test
    void last_start_lands_on_the_exact_close_when_the_step_allows_it() {
        List<CandidateSlot> slots = SlotGenerator.generate(
                List.of(TimeWindow.parse("09:00", "17:00")), 30, 10, 5);

        assertThat(slots.get(slots.size() - 1).start()).isEqualTo(LocalTime.of(16, 20));
    }

    @Test
    void each_window_is_walked_on_its_own() {
        List<CandidateSlot> slots = SlotGenerator.generate(
                List.of(TimeWindow.parse("09:00", "10:00"), TimeWindow.parse("13:10", "14:00")), 30, 0, 30);

        assertThat(slots).extracting(CandidateSlot::start).containsExactly(
                LocalTime.of(9, 0), LocalTime.of(9, 30), LocalTime.of(13, 10));
    }

    @Test
    void window_shorter_than_service_yields_nothing() {
        assertThat(SlotGenerator.generate(List.of(TimeWindow.parse("09:00", "09:20")), 30, 0, 15)).isEmpty();
        assertThat(SlotGenerator.generate(List.of(), 30, 0, 15)).isEmpty();
    }

    @Test
    void rejects_non_positive_duration_and_step() {
        List<TimeWindow> day = List.of(TimeWindow.parse("09:00", "17:00"));
        assertThatThrownBy(() -> SlotGenerator.generate(day, 0, 0, 15)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SlotGenerator.generate(day, 30, 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SlotGenerator.generate(day, 30, -1, 15)).isInstanceOf(IllegalArgumentException.class);
    }
}
