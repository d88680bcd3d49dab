package com.serge.appointments.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.serge.appointments.domain.Business;
import com.serge.appointments.domain.DayHours;
import com.serge.appointments.domain.HoursOverride;
import com.serge.appointments.domain.WeeklyHours;
import com.serge.appointments.repo.BusinessClosureRepository;
import com.serge.appointments.repo.HoursOverrideRepository;
import com.serge.appointments.schedule.TimeWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@SuppressWarnings("unchecked")
class CalendarCacheTest {

    private static final LocalDate DAY = LocalDate.of(2030, 3, 4);

    private final StringRedisTemplate redis = mock(StringRedisTemplate.class);
    private final ValueOperations<String, String> values = mock(ValueOperations.class);
    private final CalendarCache cache = new CalendarCache(redis, new ObjectMapper(), Duration.ofMinutes(10));
    private final UUID businessId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        when(redis.opsForValue()).thenReturn(values);
    }

    @Test
    void written_day_is_read_back_under_the_same_version() {
        when(values.get("calendar:ver:" + businessId)).thenReturn("3");
        DaySchedule day = new DaySchedule(DAY, List.of(TimeWindow.parse("09:00", "12:00"), TimeWindow.parse("13:00", "17:00")),
                DaySchedule.Source.WEEKLY);

        long version = cache.version(businessId);
        cache.put(businessId, version, day);

        String key = "calendar:" + businessId + ":v3:2030-03-04";
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(values).set(eq(key), json.capture(), eq(Duration.ofMinutes(10)));

        when(values.get(key)).thenReturn(json.getValue());
        assertThat(cache.get(businessId, version, DAY)).contains(day);
    }

    @Test
    void missing_version_means_version_zero() {
        assertThat(cache.version(businessId)).isZero();
        assertThat(cache.get(businessId, 0L, DAY)).isEmpty();
        verify(values).get("calendar:" + businessId + ":v0:2030-03-04");
    }

    @Test
    void invalidate_outside_a_transaction_bumps_immediately() {
        cache.invalidate(businessId);
        verify(values).increment("calendar:ver:" + businessId);
    }

    @Test
    void redis_failures_are_not_propagated() {
        when(values.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));
        when(values.increment(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        long version = cache.version(businessId);
        assertThat(version).isEqualTo(CalendarCache.UNAVAILABLE);
        assertThat(cache.get(businessId, version, DAY)).isEqualTo(Optional.empty());
        cache.put(businessId, version, DaySchedule.closed(DAY, DaySchedule.Source.OVERRIDE));
        cache.invalidate(businessId);
        verify(values, never()).set(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void day_computed_before_an_invalidation_is_not_served_afterwards() {
        Map<String, String> store = new HashMap<>();
        when(values.get(anyString())).thenAnswer(inv -> store.get(inv.<String>getArgument(0)));
        doAnswer(inv -> store.put(inv.getArgument(0), inv.getArgument(1)))
                .when(values).set(anyString(), anyString(), any(Duration.class));
        when(values.increment(anyString())).thenAnswer(inv -> {
            String k = inv.getArgument(0);
            long next = Long.parseLong(store.getOrDefault(k, "0")) + 1;
            store.put(k, Long.toString(next));
            return next;
        });

        HoursOverrideRepository overrides = mock(HoursOverrideRepository.class);
        BusinessClosureRepository closures = mock(BusinessClosureRepository.class);
        when(closures.findActiveCovering(any(), any())).thenReturn(List.of());
        CalendarResolver resolver = new CalendarResolver(overrides, closures, cache, "09:00", "18:00");
        Business business = Business.builder().id(businessId).timezone("UTC").active(true)
                .weeklyHours(WeeklyHours.weekdays(DayHours.open(LocalTime.of(9, 0), LocalTime.of(17, 0))))
                .build();
        HoursOverride closedDay = HoursOverride.builder().business(business).date(DAY).open(false).build();

        // the reader loads the old rows, then the closing override commits and invalidates
        when(overrides.findByBusinessIdAndDate(businessId, DAY)).thenAnswer(inv -> {
            cache.invalidate(businessId);
            return Optional.empty();
        }).thenReturn(Optional.of(closedDay));

        assertThat(resolver.resolve(business, DAY, false).isClosed()).isFalse();
        assertThat(resolver.resolve(business, DAY, false).isClosed()).isTrue();
    }
}
