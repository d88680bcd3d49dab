package com.serge.appointments.service;

import com.serge.appointments.domain.Appointment;
import com.serge.appointments.domain.AppointmentStatus;
import com.serge.appointments.domain.Business;
import com.serge.appointments.domain.ServiceOffering;
import com.serge.appointments.domain.Staff;
import com.serge.appointments.error.BookingTimeoutException;
import com.serge.appointments.error.InvalidTransitionException;
import com.serge.appointments.error.NotFoundException;
import com.serge.appointments.error.OutOfPolicyWindowException;
import com.serge.appointments.error.QuotaExceededException;
import com.serge.appointments.error.SlotNoLongerAvailableException;
import com.serge.appointments.error.TransientStoreException;
import com.serge.appointments.error.ValidationException;
import com.serge.appointments.repo.AppointmentRepository;
import com.serge.appointments.repo.BusinessRepository;
import com.serge.appointments.repo.ServiceOfferingRepository;
import com.serge.appointments.repo.StaffRepository;
import com.serge.appointments.schedule.AdvanceBookingWindow;
import com.serge.appointments.schedule.ConflictDetector;
import com.serge.appointments.schedule.Interval;
import com.serge.appointments.schedule.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Reserves exactly the requested start or fails. Everything that decides the outcome is
 * re-checked in one READ COMMITTED transaction after the row lock of the booked resource
 * (staff row, or business row for the unassigned resource) is held; the exclusion constraint
 * on {@code appointments} backs this up.
 */
@Service
public class BookingService {
    private static final Logger log = LoggerFactory.getLogger(BookingService.class);

    static final String OVERLAP_CONSTRAINT = "appointments_no_overlap_per_resource";
    static final String IDEMPOTENCY_CONSTRAINT = "appointments_business_idempotency_key_uq";
    private static final String SQLSTATE_EXCLUSION_VIOLATION = "23P01";

    private final BusinessRepository businessRepository;
    private final ServiceOfferingRepository serviceRepository;
    private final StaffRepository staffRepository;
    private final AppointmentRepository appointmentRepository;
    private final StaffEligibility staffEligibility;
    private final CalendarResolver calendarResolver;
    private final OccupancyIndex occupancyIndex;
    private final BookingQuotaGate quotaGate;
    private final ApplicationEventPublisher events;
    private final Clock clock;
    private final TransactionTemplate tx;
    private final int maxAttempts;
    private final long backoffMs;

    public BookingService(BusinessRepository businessRepository,
                          ServiceOfferingRepository serviceRepository,
                          StaffRepository staffRepository,
                          AppointmentRepository appointmentRepository,
                          StaffEligibility staffEligibility,
                          CalendarResolver calendarResolver,
                          OccupancyIndex occupancyIndex,
                          BookingQuotaGate quotaGate,
                          ApplicationEventPublisher events,
                          Clock clock,
                          PlatformTransactionManager transactionManager,
                          @Value("${booking.transaction-timeout-seconds:5}") int timeoutSeconds,
                          @Value("${booking.max-attempts:3}") int maxAttempts,
                          @Value("${booking.retry-backoff-ms:50}") long backoffMs) {
        this.businessRepository = businessRepository;
        this.serviceRepository = serviceRepository;
        this.staffRepository = staffRepository;
        this.appointmentRepository = appointmentRepository;
        this.staffEligibility = staffEligibility;
        this.calendarResolver = calendarResolver;
        this.occupancyIndex = occupancyIndex;
        this.quotaGate = quotaGate;
        this.events = events;
        this.clock = clock;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMs = backoffMs;
        this.tx = new TransactionTemplate(transactionManager);
        this.tx.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.tx.setTimeout(timeoutSeconds);
    }

    public BookingResult bookAppointment(BookingCommand cmd) {
        log.info("booking.create businessId={} serviceId={} staffId={} start={} idem_key={}",
                cmd.businessId(), cmd.serviceId(), cmd.staffId(), cmd.start(), cmd.idempotencyKey());
        if (cmd.start() == null) throw new ValidationException("start is required");

        Business business = businessRepository.findById(cmd.businessId())
                .filter(Business::isActive)
                .orElseThrow(() -> NotFoundException.of("Business", cmd.businessId()));
        LocalDate date = cmd.start().atZoneSameInstant(business.zone()).toLocalDate();
        if (!quotaGate.mayAcceptAppointment(cmd.businessId(), date)) {
            log.info("booking.quota_refused businessId={} date={}", cmd.businessId(), date);
            throw new QuotaExceededException("Business " + cmd.businessId() + " cannot accept more appointments on " + date);
        }

        return withRetry("booking", cmd.businessId(), cmd.start(),
                status -> bookOnce(cmd),
                e -> onIntegrityViolation(cmd, e));
    }

    /**
     * Moves an occupying appointment to {@code newStart}, keeping its resource, duration and
     * buffer. The move is checked like a new booking, except that the appointment's own current
     * interval does not count as occupied.
     */
    public Appointment reschedule(UUID businessId, UUID appointmentId, OffsetDateTime newStart) {
        log.info("booking.reschedule businessId={} appointmentId={} start={}", businessId, appointmentId, newStart);
        if (newStart == null) throw new ValidationException("start is required");
        return withRetry("booking.reschedule", businessId, newStart,
                status -> rescheduleOnce(businessId, appointmentId, newStart),
                e -> {
                    if (isOverlapViolation(e)) {
                        log.info("booking.reschedule.conflict.constraint businessId={} appointmentId={} start={}",
                                businessId, appointmentId, newStart);
                        throw new SlotNoLongerAvailableException("The requested time is no longer available", e);
                    }
                    throw e;
                });
    }

    private <T> T withRetry(String op, UUID businessId, OffsetDateTime start,
                            TransactionCallback<T> work,
                            Function<DataIntegrityViolationException, T> onViolation) {
        for (int attempt = 1; ; attempt++) {
            try {
                return tx.execute(work);
            } catch (DataIntegrityViolationException e) {
                return onViolation.apply(e);
            } catch (TransactionTimedOutException | QueryTimeoutException e) {
                log.warn("{}.timeout businessId={} start={} attempt={} err={}",
                        op, businessId, start, attempt, e.toString());
                throw new BookingTimeoutException("Booking did not complete in time, nothing was saved", e);
            } catch (TransientDataAccessException e) {
                if (attempt >= maxAttempts) {
                    log.warn("{}.transient_exhausted businessId={} start={} attempts={} err={}",
                            op, businessId, start, attempt, e.toString());
                    throw new TransientStoreException("Booking store is busy, try again", e);
                }
                long sleep = backoffMs << (attempt - 1);
                log.warn("{}.retry businessId={} start={} attempt={} backoff_ms={} err={}",
                        op, businessId, start, attempt, sleep, e.toString());
                pause(sleep, e);
            }
        }
    }

    private BookingResult bookOnce(BookingCommand cmd) {
        Optional<BookingResult> prior = replayIfKnown(cmd);
        if (prior.isPresent()) return prior.get();

        Business business = businessRepository.findById(cmd.businessId())
                .filter(Business::isActive)
                .orElseThrow(() -> NotFoundException.of("Business", cmd.businessId()));
        ServiceOffering service = serviceRepository.findByIdAndBusinessId(cmd.serviceId(), cmd.businessId())
                .filter(ServiceOffering::isActive)
                .orElseThrow(() -> NotFoundException.of("Service", cmd.serviceId()));

        ZoneId zone = business.zone();
        Instant now = clock.instant();
        Instant start = cmd.start().toInstant();
        Instant end = start.plus(Duration.ofMinutes(service.getDurationMinutes()));
        Interval candidate = new Interval(start, end.plus(Duration.ofMinutes(service.getBufferMinutes())));
        checkAdvanceWindow(service, start, now);

        ZonedDateTime localStart = start.atZone(zone);
        ZonedDateTime localOccupiedEnd = candidate.end().atZone(zone);
        LocalDate date = localStart.toLocalDate();
        if (!localOccupiedEnd.toLocalDate().equals(date)) {
            throw new OutOfPolicyWindowException("Appointment would run past the end of " + date);
        }
        LocalTime from = localStart.toLocalTime();
        LocalTime to = localOccupiedEnd.toLocalTime();

        List<Staff> staff = staffEligibility.candidates(cmd.businessId(), cmd.serviceId(), cmd.staffId());
        DaySchedule day = calendarResolver.resolve(business, date, true);

        if (staff.isEmpty()) {
            requireOneWindow(day.windows(), from, to, date);
            businessRepository.findByIdForUpdate(business.getId())
                    .orElseThrow(() -> NotFoundException.of("Business", business.getId()));
            List<Interval> occupied = occupancyIndex.forUnassigned(business.getId(), date, zone);
            if (ConflictDetector.isFree(candidate, occupied)) {
                return insert(cmd, business, service, null, date, start, end, now);
            }
            return conflict(cmd, null);
        }

        boolean fitsSomeone = false;
        // locks follow the repository order, so concurrent pool bookings cannot deadlock
        for (Staff s : staff) {
            if (!fitsOneWindow(calendarResolver.windowsForStaff(day, s), from, to)) continue;
            fitsSomeone = true;
            staffRepository.findByIdForUpdate(s.getId())
                    .orElseThrow(() -> NotFoundException.of("Staff", s.getId()));
            List<Interval> occupied = occupancyIndex.forStaff(business.getId(), s.getId(), date, zone);
            if (ConflictDetector.isFree(candidate, occupied)) {
                return insert(cmd, business, service, s.getId(), date, start, end, now);
            }
            log.debug("booking.staff_busy staffId={} start={}", s.getId(), start);
        }
        if (!fitsSomeone) {
            throw new OutOfPolicyWindowException("Requested time " + from + "-" + to + " on " + date + " is outside working hours");
        }
        return conflict(cmd, cmd.staffId());
    }

    private Appointment rescheduleOnce(UUID businessId, UUID appointmentId, OffsetDateTime newStart) {
        Appointment a = appointmentRepository.findByIdAndBusinessIdForUpdate(appointmentId, businessId)
                .orElseThrow(() -> NotFoundException.of("Appointment", appointmentId));
        if (!a.getStatus().occupiesTime()) {
            throw new InvalidTransitionException(a.getStatus(),
                    "Cannot reschedule an appointment that is " + a.getStatus());
        }
        Instant start = newStart.toInstant();
        if (start.equals(a.getStartTs().toInstant())) {
            log.debug("booking.reschedule.noop appointmentId={} start={}", appointmentId, newStart);
            return a;
        }
        Business business = businessRepository.findById(businessId)
                .filter(Business::isActive)
                .orElseThrow(() -> NotFoundException.of("Business", businessId));
        ServiceOffering service = serviceRepository.findByIdAndBusinessId(a.getServiceId(), businessId)
                .orElseThrow(() -> NotFoundException.of("Service", a.getServiceId()));

        ZoneId zone = business.zone();
        Instant now = clock.instant();
        Instant end = start.plus(Duration.ofMinutes(a.getDurationMinutes()));
        Interval candidate = new Interval(start, end.plus(Duration.ofMinutes(a.getBufferMinutes())));
        checkAdvanceWindow(service, start, now);

        ZonedDateTime localStart = start.atZone(zone);
        ZonedDateTime localOccupiedEnd = candidate.end().atZone(zone);
        LocalDate date = localStart.toLocalDate();
        if (!localOccupiedEnd.toLocalDate().equals(date)) {
            throw new OutOfPolicyWindowException("Appointment would run past the end of " + date);
        }
        LocalTime from = localStart.toLocalTime();
        LocalTime to = localOccupiedEnd.toLocalTime();
        DaySchedule day = calendarResolver.resolve(business, date, true);

        List<Interval> occupied;
        if (a.getStaffId() == null) {
            requireOneWindow(day.windows(), from, to, date);
            businessRepository.findByIdForUpdate(businessId)
                    .orElseThrow(() -> NotFoundException.of("Business", businessId));
            occupied = occupancyIndex.forUnassigned(businessId, date, zone, a.getId());
        } else {
            Staff staff = staffRepository.findByIdForUpdate(a.getStaffId())
                    .orElseThrow(() -> NotFoundException.of("Staff", a.getStaffId()));
            if (!fitsOneWindow(calendarResolver.windowsForStaff(day, staff), from, to)) {
                throw new OutOfPolicyWindowException("Requested time " + from + "-" + to + " on " + date + " is outside working hours");
            }
            occupied = occupancyIndex.forStaff(businessId, staff.getId(), date, zone, a.getId());
        }
        if (!ConflictDetector.isFree(candidate, occupied)) {
            log.info("booking.reschedule.conflict appointmentId={} staffId={} start={}", appointmentId, a.getStaffId(), newStart);
            throw new SlotNoLongerAvailableException("The requested time is no longer available");
        }

        OffsetDateTime previous = a.getStartTs();
        OffsetDateTime nowTs = now.atOffset(ZoneOffset.UTC);
        OffsetDateTime startTs = start.atOffset(ZoneOffset.UTC);
        OffsetDateTime endTs = end.atOffset(ZoneOffset.UTC);
        a.setDate(date);
        a.setStartTs(startTs);
        a.setEndTs(endTs);
        a.setOccupiedRange(Appointment.occupiedRange(startTs, endTs, a.getBufferMinutes()));
        a.setUpdatedAt(nowTs);
        appointmentRepository.saveAndFlush(a);
        events.publishEvent(AppointmentEvent.of(AppointmentEventType.RESCHEDULED, a, nowTs));
        log.info("booking.reschedule.saved appointmentId={} staffId={} from={} to={}",
                appointmentId, a.getStaffId(), previous, startTs);
        return a;
    }

    private BookingResult insert(BookingCommand cmd, Business business, ServiceOffering service, UUID staffId,
                                 LocalDate date, Instant start, Instant end, Instant now) {
        OffsetDateTime nowTs = now.atOffset(ZoneOffset.UTC);
        OffsetDateTime startTs = start.atOffset(ZoneOffset.UTC);
        OffsetDateTime endTs = end.atOffset(ZoneOffset.UTC);
        AppointmentStatus status = business.isRequiresApproval() ? AppointmentStatus.PENDING : AppointmentStatus.CONFIRMED;

        Appointment a = Appointment.builder()
                .businessId(business.getId())
                .serviceId(service.getId())
                .staffId(staffId)
                .customerId(cmd.customerId())
                .date(date)
                .startTs(startTs)
                .endTs(endTs)
                .durationMinutes(service.getDurationMinutes())
                .bufferMinutes(service.getBufferMinutes())
                .occupiedRange(Appointment.occupiedRange(startTs, endTs, service.getBufferMinutes()))
                .status(status)
                .customerNotes(cmd.customerNotes())
                .idempotencyKey(cmd.idempotencyKey())
                .bookedAt(nowTs)
                .confirmedAt(status == AppointmentStatus.CONFIRMED ? nowTs : null)
                .createdAt(nowTs)
                .updatedAt(nowTs)
                .build();
        appointmentRepository.saveAndFlush(a);
        events.publishEvent(AppointmentEvent.of(AppointmentEventType.BOOKED, a, nowTs));
        log.info("booking.create.saved appointmentId={} businessId={} staffId={} status={} start={}",
                a.getId(), a.getBusinessId(), staffId, status, startTs);
        return new BookingResult(a, false);
    }

    private BookingResult conflict(BookingCommand cmd, UUID staffId) {
        Optional<BookingResult> prior = replayIfKnown(cmd);
        if (prior.isPresent()) return prior.get();
        log.info("booking.conflict businessId={} staffId={} start={}", cmd.businessId(), staffId, cmd.start());
        throw new SlotNoLongerAvailableException("The requested time is no longer available");
    }

    private Optional<BookingResult> replayIfKnown(BookingCommand cmd) {
        if (cmd.idempotencyKey() == null) return Optional.empty();
        return appointmentRepository.findByBusinessIdAndIdempotencyKey(cmd.businessId(), cmd.idempotencyKey())
                .map(a -> {
                    if (!a.getCustomerId().equals(cmd.customerId())) {
                        throw new ValidationException("Idempotency-Key was already used for another booking");
                    }
                    log.info("booking.replay appointmentId={} idem_key={}", a.getId(), cmd.idempotencyKey());
                    return new BookingResult(a, true);
                });
    }

    private BookingResult onIntegrityViolation(BookingCommand cmd, DataIntegrityViolationException e) {
        if (cmd.idempotencyKey() != null && mentions(e, IDEMPOTENCY_CONSTRAINT)) {
            // a concurrent submission with the same key won; hand back its row
            BookingResult replay = tx.execute(status -> replayIfKnown(cmd).orElse(null));
            if (replay != null) return replay;
        }
        if (isOverlapViolation(e)) {
            log.info("booking.conflict.constraint businessId={} staffId={} start={}",
                    cmd.businessId(), cmd.staffId(), cmd.start());
            throw new SlotNoLongerAvailableException("The requested time is no longer available", e);
        }
        throw e;
    }

    private static void checkAdvanceWindow(ServiceOffering service, Instant start, Instant now) {
        switch (AdvanceBookingWindow.of(service.getMinAdvanceHours(), service.getMaxAdvanceDays()).check(start, now)) {
            case IN_PAST -> throw new OutOfPolicyWindowException("Requested start is in the past");
            case TOO_SOON -> throw new OutOfPolicyWindowException(
                    "Service must be booked at least " + service.getMinAdvanceHours() + " hours ahead");
            case TOO_FAR -> throw new OutOfPolicyWindowException(
                    "Service can be booked at most " + service.getMaxAdvanceDays() + " days ahead");
            case OK -> {
            }
        }
    }

    private static boolean fitsOneWindow(List<TimeWindow> windows, LocalTime from, LocalTime to) {
        return windows.stream().anyMatch(w -> w.encloses(from, to));
    }

    private static void requireOneWindow(List<TimeWindow> windows, LocalTime from, LocalTime to, LocalDate date) {
        if (!fitsOneWindow(windows, from, to)) {
            throw new OutOfPolicyWindowException("Requested time " + from + "-" + to + " on " + date + " is outside opening hours");
        }
    }

    private static boolean isOverlapViolation(DataIntegrityViolationException e) {
        return mentions(e, OVERLAP_CONSTRAINT) || SQLSTATE_EXCLUSION_VIOLATION.equals(sqlState(e));
    }

    private static boolean mentions(Throwable e, String constraint) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t.getMessage() != null && t.getMessage().contains(constraint)) return true;
        }
        return false;
    }

    private static String sqlState(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException && ((SQLException) t).getSQLState() != null) {
                return ((SQLException) t).getSQLState();
            }
        }
        return null;
    }

    private static void pause(long millis, RuntimeException cause) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransientStoreException("Interrupted while retrying booking", cause);
        }
    }
}
