package com.serge.appointments.service;

import com.serge.appointments.domain.Business;
import com.serge.appointments.domain.BusinessClosure;
import com.serge.appointments.domain.ClosureType;
import com.serge.appointments.domain.DayHours;
import com.serge.appointments.domain.HoursOverride;
import com.serge.appointments.domain.Staff;
import com.serge.appointments.domain.WeeklyHours;
import com.serge.appointments.repo.BusinessClosureRepository;
import com.serge.appointments.repo.HoursOverrideRepository;
import com.serge.appointments.schedule.TimeWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class CalendarResolverTest {

    // 2030-03-04 is a Monday
    private static final LocalDate MONDAY = LocalDate.of(2030, 3, 4);

    private final HoursOverrideRepository overrides = mock(HoursOverrideRepository.class);
    private final BusinessClosureRepository closures = mock(BusinessClosureRepository.class);
    private final CalendarCache cache = mock(CalendarCache.class);
    private final CalendarResolver resolver = new CalendarResolver(overrides, closures, cache, "09:00", "18:00");

    private Business business;

    @BeforeEach
    void setUp() {
        business = Business.builder()
                .id(UUID.randomUUID())
                .timezone("Europe/Paris")
                .active(true)
                .weeklyHours(WeeklyHours.weekdays(DayHours.open(LocalTime.of(9, 0), LocalTime.of(17, 0))
                        .withBreak(LocalTime.of(12, 0), LocalTime.of(13, 0))))
                .build();
        when(overrides.findByBusinessIdAndDate(any(), any())).thenReturn(Optional.empty());
        when(closures.findActiveCovering(any(), any())).thenReturn(List.of());
        when(cache.version(any())).thenReturn(4L);
        when(cache.get(any(), anyLong(), any())).thenReturn(Optional.empty());
    }

    @Test
    void weekly_hours_are_split_by_the_break() {
        DaySchedule day = resolver.resolve(business, MONDAY, false);

        assertThat(day.source()).isEqualTo(DaySchedule.Source.WEEKLY);
        assertThat(day.windows()).containsExactly(TimeWindow.parse("09:00", "12:00"), TimeWindow.parse("13:00", "17:00"));
        verify(cache).put(business.getId(), 4L, day);
    }

    @Test
    void closed_weekday_and_missing_hours_give_an_empty_day() {
        assertThat(resolver.resolve(business, MONDAY.plusDays(5), false).isClosed()).isTrue();

        business.setWeeklyHours(null);
        assertThat(resolver.resolve(business, MONDAY, false).isClosed()).isTrue();
    }

    @Test
    void override_replaces_the_weekly_entry() {
        HoursOverride o = HoursOverride.builder().business(business).date(MONDAY)
                .open(true).openTime(LocalTime.of(14, 0)).closeTime(LocalTime.of(20, 0)).build();
        when(overrides.findByBusinessIdAndDate(business.getId(), MONDAY)).thenReturn(Optional.of(o));

        DaySchedule day = resolver.resolve(business, MONDAY, false);
        assertThat(day.source()).isEqualTo(DaySchedule.Source.OVERRIDE);
        assertThat(day.windows()).containsExactly(TimeWindow.parse("14:00", "20:00"));
    }

    @Test
    void closed_override_closes_an_open_weekday() {
        HoursOverride o = HoursOverride.builder().business(business).date(MONDAY).open(false).reason("inventory").build();
        when(overrides.findByBusinessIdAndDate(business.getId(), MONDAY)).thenReturn(Optional.of(o));

        assertThat(resolver.resolve(business, MONDAY, false).isClosed()).isTrue();
    }

    @Test
    void inverted_hours_fall_back_to_the_default_window() {
        business.setWeeklyHours(WeeklyHours.of(Map.of(DayOfWeek.MONDAY, DayHours.open(LocalTime.of(18, 0), LocalTime.of(9, 0)))));

        DaySchedule day = resolver.resolve(business, MONDAY, false);
        assertThat(day.source()).isEqualTo(DaySchedule.Source.FALLBACK);
        assertThat(day.windows()).containsExactly(TimeWindow.parse("09:00", "18:00"));
    }

    @Test
    void break_outside_the_window_is_ignored() {
        business.setWeeklyHours(WeeklyHours.of(Map.of(DayOfWeek.MONDAY,
                DayHours.open(LocalTime.of(9, 0), LocalTime.of(12, 0)).withBreak(LocalTime.of(13, 0), LocalTime.of(14, 0)))));

        assertThat(resolver.resolve(business, MONDAY, false).windows()).containsExactly(TimeWindow.parse("09:00", "12:00"));
    }

    @Test
    void full_day_closure_closes_and_partial_closure_carves_out() {
        BusinessClosure partial = closure(MONDAY, null, LocalTime.of(15, 0), LocalTime.of(16, 0));
        when(closures.findActiveCovering(business.getId(), MONDAY)).thenReturn(List.of(partial));
        assertThat(resolver.resolve(business, MONDAY, false).windows()).containsExactly(
                TimeWindow.parse("09:00", "12:00"), TimeWindow.parse("13:00", "15:00"), TimeWindow.parse("16:00", "17:00"));

        BusinessClosure vacation = closure(MONDAY.minusDays(2), MONDAY.plusDays(2), null, null);
        when(closures.findActiveCovering(business.getId(), MONDAY)).thenReturn(List.of(partial, vacation));
        assertThat(resolver.resolve(business, MONDAY, false).isClosed()).isTrue();
    }

    @Test
    void overlapping_partial_closures_are_all_applied() {
        when(closures.findActiveCovering(business.getId(), MONDAY)).thenReturn(List.of(
                closure(MONDAY, MONDAY, LocalTime.of(8, 0), LocalTime.of(10, 0)),
                closure(MONDAY, MONDAY, LocalTime.of(9, 30), LocalTime.of(11, 0))));

        assertThat(resolver.resolve(business, MONDAY, false).windows())
                .containsExactly(TimeWindow.parse("11:00", "12:00"), TimeWindow.parse("13:00", "17:00"));
    }

    @Test
    void cached_day_is_returned_without_touching_the_database() {
        DaySchedule cached = new DaySchedule(MONDAY, List.of(TimeWindow.parse("10:00", "11:00")), DaySchedule.Source.WEEKLY);
        when(cache.get(business.getId(), 4L, MONDAY)).thenReturn(Optional.of(cached));

        assertThat(resolver.resolve(business, MONDAY, false)).isEqualTo(cached);
        verifyNoInteractions(overrides, closures);
    }

    @Test
    void bypass_skips_the_cache_read() {
        resolver.resolve(business, MONDAY, true);

        verify(cache, never()).get(any(), anyLong(), any());
        verify(overrides).findByBusinessIdAndDate(business.getId(), MONDAY);
    }

    @Test
    void staff_hours_narrow_the_business_day() {
        DaySchedule day = resolver.resolve(business, MONDAY, true);

        Staff morning = Staff.builder().id(UUID.randomUUID()).active(true)
                .workingHours(WeeklyHours.of(Map.of(DayOfWeek.MONDAY, DayHours.open(LocalTime.of(8, 0), LocalTime.of(12, 30)))))
                .build();
        assertThat(resolver.windowsForStaff(day, morning)).containsExactly(TimeWindow.parse("09:00", "12:00"));

        Staff off = Staff.builder().id(UUID.randomUUID()).active(true)
                .workingHours(WeeklyHours.of(Map.of(DayOfWeek.MONDAY, DayHours.closed()))).build();
        assertThat(resolver.windowsForStaff(day, off)).isEmpty();

        Staff tuesdayOnly = Staff.builder().id(UUID.randomUUID()).active(true)
                .workingHours(WeeklyHours.of(Map.of(DayOfWeek.TUESDAY, DayHours.closed()))).build();
        assertThat(resolver.windowsForStaff(day, tuesdayOnly)).isEqualTo(day.windows());

        Staff misconfigured = Staff.builder().id(UUID.randomUUID()).active(true)
                .workingHours(WeeklyHours.of(Map.of(DayOfWeek.MONDAY, DayHours.open(LocalTime.of(17, 0), LocalTime.of(8, 0)))))
                .build();
        assertThat(resolver.windowsForStaff(day, misconfigured)).isEqualTo(day.windows());
    }

    private BusinessClosure closure(LocalDate from, LocalDate to, LocalTime fromTime, LocalTime untilTime) {
        return BusinessClosure.builder().id(UUID.randomUUID()).business(business)
                .startDate(from).endDate(to).fromTime(fromTime).untilTime(untilTime)
                .type(ClosureType.MAINTENANCE).active(true).build();
    }
}
