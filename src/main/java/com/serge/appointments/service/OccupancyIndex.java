package com.serge.appointments.service;

import com.serge.appointments.domain.Appointment;
import com.serge.appointments.domain.AppointmentStatus;
import com.serge.appointments.repo.AppointmentRepository;
import com.serge.appointments.schedule.Interval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Loads the appointments that can collide with a business day and widens each one to
 * {@code [start - preBuffer, end + buffer)}. Cancelled and no-show appointments never appear.
 */
@Component
public class OccupancyIndex {
    private static final Logger log = LoggerFactory.getLogger(OccupancyIndex.class);

    private final AppointmentRepository appointmentRepository;
    private final Duration preBuffer;

    public OccupancyIndex(AppointmentRepository appointmentRepository,
                          @Value("${booking.pre-buffer-minutes:5}") int preBufferMinutes) {
        this.appointmentRepository = appointmentRepository;
        this.preBuffer = Duration.ofMinutes(preBufferMinutes);
    }

    public List<Interval> forStaff(UUID businessId, UUID staffId, LocalDate date, ZoneId zone) {
        return forStaff(businessId, staffId, date, zone, null);
    }

    /** Same as {@link #forStaff(UUID, UUID, LocalDate, ZoneId)} without the interval of {@code excludedId}. */
    public List<Interval> forStaff(UUID businessId, UUID staffId, LocalDate date, ZoneId zone, UUID excludedId) {
        OffsetDateTime[] range = loadRange(date, zone);
        List<Appointment> found = appointmentRepository.findOccupyingForStaff(
                businessId, staffId, range[0], range[1], AppointmentStatus.OCCUPYING);
        log.trace("occupancy.staff businessId={} staffId={} date={} count={}", businessId, staffId, date, found.size());
        return expand(found, excludedId);
    }

    public List<Interval> forUnassigned(UUID businessId, LocalDate date, ZoneId zone) {
        return forUnassigned(businessId, date, zone, null);
    }

    public List<Interval> forUnassigned(UUID businessId, LocalDate date, ZoneId zone, UUID excludedId) {
        OffsetDateTime[] range = loadRange(date, zone);
        List<Appointment> found = appointmentRepository.findOccupyingUnassigned(
                businessId, range[0], range[1], AppointmentStatus.OCCUPYING);
        log.trace("occupancy.unassigned businessId={} date={} count={}", businessId, date, found.size());
        return expand(found, excludedId);
    }

    public OccupancySnapshot forBusiness(UUID businessId, LocalDate date, ZoneId zone) {
        OffsetDateTime[] range = loadRange(date, zone);
        List<Appointment> found = appointmentRepository.findOccupying(
                businessId, range[0], range[1], AppointmentStatus.OCCUPYING);
        Map<UUID, List<Interval>> byStaff = new HashMap<>();
        List<Interval> unassigned = new ArrayList<>();
        for (Appointment a : found) {
            if (!a.getStatus().occupiesTime()) continue;
            Interval i = occupied(a);
            if (a.getStaffId() == null) unassigned.add(i);
            else byStaff.computeIfAbsent(a.getStaffId(), k -> new ArrayList<>()).add(i);
        }
        log.trace("occupancy.business businessId={} date={} count={}", businessId, date, found.size());
        return new OccupancySnapshot(byStaff, unassigned);
    }

    // one day of slack on each side covers buffers and offset changes around the day
    private static OffsetDateTime[] loadRange(LocalDate date, ZoneId zone) {
        OffsetDateTime from = date.minusDays(1).atStartOfDay(zone).toOffsetDateTime().withOffsetSameInstant(ZoneOffset.UTC);
        OffsetDateTime to = date.plusDays(2).atStartOfDay(zone).toOffsetDateTime().withOffsetSameInstant(ZoneOffset.UTC);
        return new OffsetDateTime[]{from, to};
    }

    private List<Interval> expand(List<Appointment> found, UUID excludedId) {
        List<Interval> out = new ArrayList<>(found.size());
        for (Appointment a : found) {
            if (excludedId != null && excludedId.equals(a.getId())) continue;
            if (a.getStatus().occupiesTime()) out.add(occupied(a));
        }
        return out;
    }

    Interval occupied(Appointment a) {
        return new Interval(a.getStartTs().toInstant(), a.getEndTs().toInstant())
                .widen(preBuffer, Duration.ofMinutes(a.getBufferMinutes()));
    }
}
