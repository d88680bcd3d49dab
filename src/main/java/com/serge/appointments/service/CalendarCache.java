package com.serge.appointments.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.serge.appointments.schedule.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis cache of resolved business days. Keys embed a per-business version number, so bumping
 * the version drops every cached date of that business at once. Failures never reach callers.
 */
@Component
public class CalendarCache {
    private static final Logger log = LoggerFactory.getLogger(CalendarCache.class);
    public static final long UNAVAILABLE = -1L;

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public CalendarCache(StringRedisTemplate redis,
                         ObjectMapper objectMapper,
                         @Value("${calendar.cache-ttl:10m}") Duration ttl) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
    }

    record CachedDay(DaySchedule.Source source, List<String> windows) {
    }

    private String versionKey(UUID businessId) {
        return "calendar:ver:%s".formatted(businessId);
    }

    private String key(UUID businessId, long version, LocalDate date) {
        return "calendar:%s:v%d:%s".formatted(businessId, version, date);
    }

    /**
     * Current cache version of the business, or {@link #UNAVAILABLE} when Redis cannot be read.
     * Read it before loading the calendar inputs and hand the same value to {@link #get} and
     * {@link #put}: a day computed before an invalidation then lands under the old version.
     */
    public long version(UUID businessId) {
        try {
            String v = redis.opsForValue().get(versionKey(businessId));
            return v == null ? 0L : Long.parseLong(v);
        } catch (Exception e) {
            log.warn("calendar.cache.version_failed businessId={} err={}", businessId, e.toString());
            return UNAVAILABLE;
        }
    }

    public Optional<DaySchedule> get(UUID businessId, long version, LocalDate date) {
        if (version == UNAVAILABLE) return Optional.empty();
        String cacheKey = key(businessId, version, date);
        try {
            String json = redis.opsForValue().get(cacheKey);
            if (json == null) {
                log.trace("calendar.cache.miss key={}", cacheKey);
                return Optional.empty();
            }
            CachedDay cached = objectMapper.readValue(json, CachedDay.class);
            List<TimeWindow> windows = cached.windows().stream()
                    .map(s -> s.split("-", 2))
                    .map(p -> TimeWindow.parse(p[0], p[1]))
                    .toList();
            log.trace("calendar.cache.hit key={} windows={}", cacheKey, windows);
            return Optional.of(new DaySchedule(date, windows, cached.source()));
        } catch (Exception e) {
            log.warn("calendar.cache.read_failed businessId={} key={} err={}", businessId, cacheKey, e.toString());
            return Optional.empty();
        }
    }

    public void put(UUID businessId, long version, DaySchedule day) {
        if (version == UNAVAILABLE) return;
        String cacheKey = key(businessId, version, day.date());
        try {
            CachedDay cached = new CachedDay(day.source(), day.windows().stream().map(TimeWindow::toString).toList());
            redis.opsForValue().set(cacheKey, objectMapper.writeValueAsString(cached), ttl);
            log.trace("calendar.cache.write key={}", cacheKey);
        } catch (Exception e) {
            log.warn("calendar.cache.write_failed businessId={} key={} err={}", businessId, cacheKey, e.toString());
        }
    }

    /**
     * Drops every cached day of the business. Inside a transaction the bump waits for the
     * commit, so a reader that sees the new version also sees the new calendar rows.
     */
    public void invalidate(UUID businessId) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    bumpVersion(businessId);
                }
            });
        } else {
            bumpVersion(businessId);
        }
    }

    private void bumpVersion(UUID businessId) {
        try {
            Long v = redis.opsForValue().increment(versionKey(businessId));
            log.debug("calendar.cache.invalidated businessId={} version={}", businessId, v);
        } catch (Exception e) {
            log.warn("calendar.cache.invalidate_failed businessId={} err={}", businessId, e.toString());
        }
    }
}
