package com.serge.appointments.service;

import com.serge.appointments.domain.Business;
import com.serge.appointments.domain.BusinessClosure;
import com.serge.appointments.domain.ClosureType;
import com.serge.appointments.domain.DayHours;
import com.serge.appointments.domain.HoursOverride;
import com.serge.appointments.domain.WeeklyHours;
import com.serge.appointments.error.InvalidHoursException;
import com.serge.appointments.error.NotFoundException;
import com.serge.appointments.repo.BusinessClosureRepository;
import com.serge.appointments.repo.BusinessRepository;
import com.serge.appointments.repo.HoursOverrideRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Writes the calendar inputs of a business (weekly hours, date overrides, closures).
 * Every change drops the cached calendar of that business.
 */
@Service
@RequiredArgsConstructor
public class BusinessCalendarAdminService {
    private static final Logger log = LoggerFactory.getLogger(BusinessCalendarAdminService.class);

    private final BusinessRepository businessRepository;
    private final HoursOverrideRepository overrideRepository;
    private final BusinessClosureRepository closureRepository;
    private final CalendarResolver calendarResolver;
    private final CalendarCache calendarCache;
    private final Clock clock;

    @Transactional(readOnly = true)
    public DaySchedule calendarFor(UUID businessId, LocalDate date) {
        return calendarResolver.resolve(requireBusiness(businessId), date, false);
    }

    @Transactional
    public WeeklyHours updateWeeklyHours(UUID businessId, WeeklyHours hours) {
        if (hours == null) throw new InvalidHoursException("weekly hours are required");
        hours.requireValid();
        Business b = requireBusiness(businessId);
        b.setWeeklyHours(hours);
        b.setUpdatedAt(OffsetDateTime.now(clock));
        businessRepository.save(b);
        calendarCache.invalidate(businessId);
        log.info("calendar.hours.updated businessId={} hours={}", businessId, hours);
        return hours;
    }

    @Transactional
    public HoursOverride upsertOverride(UUID businessId, LocalDate date, DayHours hours, String reason) {
        if (hours == null) throw new InvalidHoursException("hours are required");
        hours.problem().ifPresent(p -> {
            throw new InvalidHoursException(date + ": " + p);
        });
        Business b = requireBusiness(businessId);
        HoursOverride o = overrideRepository.findByBusinessIdAndDate(businessId, date)
                .orElseGet(() -> HoursOverride.builder().business(b).date(date).build());
        o.setOpen(hours.open());
        o.setOpenTime(hours.openTime());
        o.setCloseTime(hours.closeTime());
        o.setBreakStart(hours.breakStart());
        o.setBreakEnd(hours.breakEnd());
        o.setReason(reason);
        overrideRepository.save(o);
        calendarCache.invalidate(businessId);
        log.info("calendar.override.saved businessId={} date={} open={}", businessId, date, hours.open());
        return o;
    }

    @Transactional
    public void deleteOverride(UUID businessId, LocalDate date) {
        HoursOverride o = overrideRepository.findByBusinessIdAndDate(businessId, date)
                .orElseThrow(() -> new NotFoundException("No override for " + date));
        overrideRepository.delete(o);
        calendarCache.invalidate(businessId);
        log.info("calendar.override.deleted businessId={} date={}", businessId, date);
    }

    @Transactional
    public BusinessClosure addClosure(UUID businessId, ClosureCommand cmd) {
        if (cmd.startDate() == null) throw new InvalidHoursException("startDate is required");
        if (cmd.endDate() != null && cmd.endDate().isBefore(cmd.startDate())) {
            throw new InvalidHoursException("endDate " + cmd.endDate() + " is before startDate " + cmd.startDate());
        }
        if ((cmd.fromTime() == null) != (cmd.untilTime() == null)) {
            throw new InvalidHoursException("fromTime and untilTime must be given together");
        }
        if (cmd.fromTime() != null && !cmd.fromTime().isBefore(cmd.untilTime())) {
            throw new InvalidHoursException("fromTime " + cmd.fromTime() + " is not before untilTime " + cmd.untilTime());
        }
        Business b = requireBusiness(businessId);
        BusinessClosure c = BusinessClosure.builder()
                .business(b)
                .startDate(cmd.startDate())
                .endDate(cmd.endDate())
                .fromTime(cmd.fromTime())
                .untilTime(cmd.untilTime())
                .type(cmd.type() == null ? ClosureType.OTHER : cmd.type())
                .reason(cmd.reason())
                .active(true)
                .createdAt(OffsetDateTime.now(clock))
                .build();
        closureRepository.save(c);
        calendarCache.invalidate(businessId);
        log.info("calendar.closure.added businessId={} closureId={} type={} from={} to={}",
                businessId, c.getId(), c.getType(), c.getStartDate(), c.getEndDate());
        return c;
    }

    @Transactional
    public void deactivateClosure(UUID businessId, UUID closureId) {
        BusinessClosure c = closureRepository.findByIdAndBusinessId(closureId, businessId)
                .orElseThrow(() -> NotFoundException.of("Closure", closureId));
        c.setActive(false);
        closureRepository.save(c);
        calendarCache.invalidate(businessId);
        log.info("calendar.closure.deactivated businessId={} closureId={}", businessId, closureId);
    }

    private Business requireBusiness(UUID businessId) {
        return businessRepository.findById(businessId)
                .orElseThrow(() -> NotFoundException.of("Business", businessId));
    }
}
