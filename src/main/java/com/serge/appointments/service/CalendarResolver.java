package com.serge.appointments.service;

import com.serge.appointments.domain.Business;
import com.serge.appointments.domain.BusinessClosure;
import com.serge.appointments.domain.DayHours;
import com.serge.appointments.domain.HoursOverride;
import com.serge.appointments.domain.Staff;
import com.serge.appointments.domain.WeeklyHours;
import com.serge.appointments.repo.BusinessClosureRepository;
import com.serge.appointments.repo.HoursOverrideRepository;
import com.serge.appointments.schedule.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Turns weekly hours, date overrides, breaks and closures into the open windows of one day.
 */
@Service
public class CalendarResolver {
    private static final Logger log = LoggerFactory.getLogger(CalendarResolver.class);

    private final HoursOverrideRepository overrideRepository;
    private final BusinessClosureRepository closureRepository;
    private final CalendarCache cache;
    private final TimeWindow fallback;

    public CalendarResolver(HoursOverrideRepository overrideRepository,
                            BusinessClosureRepository closureRepository,
                            CalendarCache cache,
                            @Value("${calendar.fallback-open:09:00}") String fallbackOpen,
                            @Value("${calendar.fallback-close:18:00}") String fallbackClose) {
        this.overrideRepository = overrideRepository;
        this.closureRepository = closureRepository;
        this.cache = cache;
        this.fallback = TimeWindow.parse(fallbackOpen, fallbackClose);
    }

    public DaySchedule resolve(Business business, LocalDate date, boolean bypassCache) {
        // version first: whatever compute() reads is at least as new as this version
        long version = cache.version(business.getId());
        if (!bypassCache) {
            Optional<DaySchedule> cached = cache.get(business.getId(), version, date);
            if (cached.isPresent()) return cached.get();
        }
        DaySchedule day = compute(business, date);
        cache.put(business.getId(), version, day);
        log.debug("calendar.resolved businessId={} date={} source={} windows={}",
                business.getId(), date, day.source(), day.windows());
        return day;
    }

    DaySchedule compute(Business business, LocalDate date) {
        DaySchedule.Source source;
        DayHours hours;
        Optional<HoursOverride> override = overrideRepository.findByBusinessIdAndDate(business.getId(), date);
        if (override.isPresent()) {
            source = DaySchedule.Source.OVERRIDE;
            hours = override.get().toDayHours();
        } else {
            source = DaySchedule.Source.WEEKLY;
            WeeklyHours weekly = business.getWeeklyHours();
            hours = weekly == null ? DayHours.closed() : weekly.forDay(date.getDayOfWeek()).orElse(DayHours.closed());
        }
        if (!hours.open()) {
            return DaySchedule.closed(date, source);
        }

        List<TimeWindow> windows;
        Optional<String> problem = hours.windowProblem();
        if (problem.isPresent()) {
            log.warn("calendar.invalid_configuration businessId={} date={} source={} problem=\"{}\" fallback={}",
                    business.getId(), date, source, problem.get(), fallback);
            source = DaySchedule.Source.FALLBACK;
            windows = List.of(fallback);
        } else {
            windows = applyBreak(List.of(hours.window()), hours, "business=" + business.getId(), date);
        }

        for (BusinessClosure c : closureRepository.findActiveCovering(business.getId(), date)) {
            if (!c.covers(date)) continue;
            if (c.isFullDay()) {
                log.debug("calendar.closed businessId={} date={} closureId={} type={}", business.getId(), date, c.getId(), c.getType());
                return DaySchedule.closed(date, source);
            }
            TimeWindow cut = c.window();
            if (cut.isEmpty()) {
                log.warn("calendar.invalid_closure businessId={} closureId={} from={} until={}",
                        business.getId(), c.getId(), c.getFromTime(), c.getUntilTime());
                continue;
            }
            windows = TimeWindow.subtract(windows, cut);
        }
        return new DaySchedule(date, windows, source);
    }

    /**
     * Narrows a business day to the personal hours of a staff member. A weekday the staff member
     * has no entry for follows the business.
     */
    public List<TimeWindow> windowsForStaff(DaySchedule day, Staff staff) {
        if (day.isClosed() || staff.getWorkingHours() == null) return day.windows();
        Optional<DayHours> personal = staff.getWorkingHours().forDay(day.date().getDayOfWeek());
        if (personal.isEmpty()) return day.windows();
        DayHours h = personal.get();
        if (!h.open()) return List.of();
        Optional<String> problem = h.windowProblem();
        if (problem.isPresent()) {
            log.warn("calendar.invalid_staff_hours staffId={} date={} problem=\"{}\"", staff.getId(), day.date(), problem.get());
            return day.windows();
        }
        List<TimeWindow> narrowed = TimeWindow.intersect(day.windows(), h.window());
        return applyBreak(narrowed, h, "staff=" + staff.getId(), day.date());
    }

    private List<TimeWindow> applyBreak(List<TimeWindow> windows, DayHours hours, String owner, LocalDate date) {
        Optional<String> problem = hours.breakProblem();
        if (problem.isPresent()) {
            log.warn("calendar.invalid_break {} date={} problem=\"{}\"", owner, date, problem.get());
            return windows;
        }
        return hours.breakWindow().map(b -> TimeWindow.subtract(windows, b)).orElse(windows);
    }
}
