package com.serge.appointments.schedule;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static com.serge.appointments.schedule.AdvanceBookingWindow.Verdict.*;
import static org.assertj.core.api.Assertions.assertThat;

class AdvanceBookingWindowTest {

    private final Instant now = Instant.parse("2030-03-04T08:00:00Z");
    private final AdvanceBookingWindow policy = AdvanceBookingWindow.of(2, 30);

    @Test
    void classifies_starts_relative_to_now() {
        assertThat(policy.check(now.minusSeconds(60), now)).isEqualTo(IN_PAST);
        assertThat(policy.check(now.plus(Duration.ofMinutes(119)), now)).isEqualTo(TOO_SOON);
        assertThat(policy.check(now.plus(Duration.ofHours(2)), now)).isEqualTo(OK);
        assertThat(policy.check(now.plus(Duration.ofDays(30)), now)).isEqualTo(OK);
        assertThat(policy.check(now.plus(Duration.ofDays(30)).plusSeconds(1), now)).isEqualTo(TOO_FAR);
    }

    @Test
    void zero_minimum_accepts_now() {
        assertThat(AdvanceBookingWindow.of(0, 1).permits(now, now)).isTrue();
    }
}
