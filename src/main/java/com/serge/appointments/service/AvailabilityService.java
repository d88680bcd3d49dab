package com.serge.appointments.service;

import com.serge.appointments.domain.Business;
import com.serge.appointments.domain.ServiceOffering;
import com.serge.appointments.domain.Staff;
import com.serge.appointments.error.NotFoundException;
import com.serge.appointments.repo.BusinessRepository;
import com.serge.appointments.repo.ServiceOfferingRepository;
import com.serge.appointments.schedule.AdvanceBookingWindow;
import com.serge.appointments.schedule.CandidateSlot;
import com.serge.appointments.schedule.ConflictDetector;
import com.serge.appointments.schedule.Interval;
import com.serge.appointments.schedule.SlotGenerator;
import com.serge.appointments.schedule.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

@Service
public class AvailabilityService {
    private static final Logger log = LoggerFactory.getLogger(AvailabilityService.class);

    private final BusinessRepository businessRepository;
    private final ServiceOfferingRepository serviceRepository;
    private final StaffEligibility staffEligibility;
    private final CalendarResolver calendarResolver;
    private final OccupancyIndex occupancyIndex;
    private final Clock clock;
    private final int granularityMinutes;

    public AvailabilityService(BusinessRepository businessRepository,
                               ServiceOfferingRepository serviceRepository,
                               StaffEligibility staffEligibility,
                               CalendarResolver calendarResolver,
                               OccupancyIndex occupancyIndex,
                               Clock clock,
                               @Value("${booking.slot-granularity-minutes:15}") int granularityMinutes) {
        this.businessRepository = businessRepository;
        this.serviceRepository = serviceRepository;
        this.staffEligibility = staffEligibility;
        this.calendarResolver = calendarResolver;
        this.occupancyIndex = occupancyIndex;
        this.clock = clock;
        this.granularityMinutes = granularityMinutes;
    }

    /**
     * Start times of the service on {@code date}, in chronological order. A start is available
     * when at least one resource is free for {@code [start, end + buffer)}.
     */
    @Transactional(readOnly = true)
    public List<SlotView> getAvailableSlots(UUID businessId, UUID serviceId, LocalDate date, UUID staffId) {
        log.debug("availability.slots businessId={} serviceId={} date={} staffId={}", businessId, serviceId, date, staffId);
        Business business = businessRepository.findById(businessId)
                .filter(Business::isActive)
                .orElseThrow(() -> NotFoundException.of("Business", businessId));
        ServiceOffering service = serviceRepository.findByIdAndBusinessId(serviceId, businessId)
                .filter(ServiceOffering::isActive)
                .orElseThrow(() -> NotFoundException.of("Service", serviceId));
        List<Staff> staff = staffEligibility.candidates(businessId, serviceId, staffId);

        DaySchedule day = calendarResolver.resolve(business, date, false);
        if (day.isClosed()) {
            log.debug("availability.closed businessId={} date={} source={}", businessId, date, day.source());
            return List.of();
        }

        ZoneId zone = business.zone();
        Instant now = clock.instant();
        AdvanceBookingWindow policy = AdvanceBookingWindow.of(service.getMinAdvanceHours(), service.getMaxAdvanceDays());
        Duration buffer = Duration.ofMinutes(service.getBufferMinutes());
        OccupancySnapshot occupancy = occupancyIndex.forBusiness(businessId, date, zone);

        Map<Instant, SlotView> byStart = new TreeMap<>();
        if (staff.isEmpty()) {
            collect(byStart, null, day.windows(), service, date, zone, now, policy, buffer, occupancy);
        } else {
            for (Staff s : staff) {
                collect(byStart, s.getId(), calendarResolver.windowsForStaff(day, s),
                        service, date, zone, now, policy, buffer, occupancy);
            }
        }
        List<SlotView> out = new ArrayList<>(byStart.values());
        log.debug("availability.slots.done businessId={} date={} resources={} slots={} available={}",
                businessId, date, Math.max(1, staff.size()), out.size(), out.stream().filter(SlotView::available).count());
        return out;
    }

    private void collect(Map<Instant, SlotView> byStart, UUID staffId, List<TimeWindow> windows,
                         ServiceOffering service, LocalDate date, ZoneId zone, Instant now,
                         AdvanceBookingWindow policy, Duration buffer, OccupancySnapshot occupancy) {
        List<Interval> occupied = occupancy.intervalsFor(staffId);
        for (CandidateSlot c : SlotGenerator.generate(windows, service.getDurationMinutes(),
                service.getBufferMinutes(), granularityMinutes)) {
            Instant start = c.startAt(date, zone);
            if (!policy.permits(start, now)) continue;
            Instant end = c.endAt(date, zone);
            boolean free = ConflictDetector.isFree(new Interval(start, end.plus(buffer)), occupied);
            SlotView seen = byStart.get(start);
            if (seen == null || (!seen.available() && free)) {
                byStart.put(start, new SlotView(
                        start.atZone(zone).toOffsetDateTime(),
                        end.atZone(zone).toOffsetDateTime(),
                        free,
                        free ? staffId : null));
            }
        }
    }
}
