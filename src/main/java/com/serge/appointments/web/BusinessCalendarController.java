package com.serge.appointments.web;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.serge.appointments.domain.BusinessClosure;
import com.serge.appointments.domain.ClosureType;
import com.serge.appointments.domain.DayHours;
import com.serge.appointments.domain.HoursOverride;
import com.serge.appointments.domain.WeeklyHours;
import com.serge.appointments.service.BusinessAccessGate;
import com.serge.appointments.service.BusinessCalendarAdminService;
import com.serge.appointments.service.ClosureCommand;
import com.serge.appointments.service.DaySchedule;
import com.serge.appointments.schedule.TimeWindow;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Business owner view of the calendar inputs: weekly hours, date overrides and closures.
 */
@RestController
@RequestMapping("/api/businesses/{businessId}")
@RequiredArgsConstructor
public class BusinessCalendarController {
    private static final Logger log = LoggerFactory.getLogger(BusinessCalendarController.class);
    private final BusinessCalendarAdminService adminService;
    private final BusinessAccessGate accessGate;

    @GetMapping("/calendar")
    public CalendarDay calendar(@PathVariable UUID businessId,
                                @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                @AuthenticationPrincipal Jwt jwt) {
        accessGate.requireAccess(jwt, businessId);
        log.debug("business.calendar businessId={} date={}", businessId, date);
        return CalendarDay.from(adminService.calendarFor(businessId, date));
    }

    @PutMapping("/hours")
    public WeeklyHours updateHours(@PathVariable UUID businessId,
                                   @RequestBody WeeklyHours hours,
                                   @AuthenticationPrincipal Jwt jwt) {
        accessGate.requireAccess(jwt, businessId);
        log.info("business.hours.update businessId={}", businessId);
        return adminService.updateWeeklyHours(businessId, hours);
    }

    @PutMapping("/overrides/{date}")
    public OverrideItem upsertOverride(@PathVariable UUID businessId,
                                       @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                       @RequestBody OverrideRequest body,
                                       @AuthenticationPrincipal Jwt jwt) {
        accessGate.requireAccess(jwt, businessId);
        log.info("business.override.upsert businessId={} date={} open={}", businessId, date, body.isOpen());
        DayHours hours = new DayHours(body.isOpen(), body.getOpenTime(), body.getCloseTime(), body.getBreakStart(), body.getBreakEnd());
        return OverrideItem.from(adminService.upsertOverride(businessId, date, hours, body.getReason()));
    }

    @DeleteMapping("/overrides/{date}")
    public ResponseEntity<Void> deleteOverride(@PathVariable UUID businessId,
                                               @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                               @AuthenticationPrincipal Jwt jwt) {
        accessGate.requireAccess(jwt, businessId);
        log.info("business.override.delete businessId={} date={}", businessId, date);
        adminService.deleteOverride(businessId, date);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/closures")
    public ResponseEntity<ClosureItem> addClosure(@PathVariable UUID businessId,
                                                  @Valid @RequestBody ClosureRequest body,
                                                  @AuthenticationPrincipal Jwt jwt) {
        accessGate.requireAccess(jwt, businessId);
        log.info("business.closure.add businessId={} start={} end={} type={}", businessId, body.getStartDate(), body.getEndDate(), body.getType());
        BusinessClosure c = adminService.addClosure(businessId, new ClosureCommand(
                body.getStartDate(), body.getEndDate(), body.getFromTime(), body.getUntilTime(), body.getType(), body.getReason()));
        return ResponseEntity.status(201).body(ClosureItem.from(c));
    }

    @DeleteMapping("/closures/{closureId}")
    public ResponseEntity<Map<String, Object>> deactivateClosure(@PathVariable UUID businessId,
                                                                 @PathVariable UUID closureId,
                                                                 @AuthenticationPrincipal Jwt jwt) {
        accessGate.requireAccess(jwt, businessId);
        log.info("business.closure.deactivate businessId={} closureId={}", businessId, closureId);
        adminService.deactivateClosure(businessId, closureId);
        return ResponseEntity.ok(Map.of("closureId", closureId, "active", false));
    }

    // DTOs
    @Data
    public static class CalendarDay {
        private LocalDate date;
        private boolean open;
        private String source;
        private List<String> windows;

        public static CalendarDay from(DaySchedule d) {
            CalendarDay c = new CalendarDay();
            c.date = d.date();
            c.open = !d.isClosed();
            c.source = d.source().name();
            c.windows = d.windows().stream().map(TimeWindow::toString).collect(Collectors.toList());
            return c;
        }
    }

    @Data
    public static class OverrideRequest {
        @JsonProperty("isOpen")
        private boolean open;
        @JsonFormat(pattern = "HH:mm")
        private LocalTime openTime;
        @JsonFormat(pattern = "HH:mm")
        private LocalTime closeTime;
        @JsonFormat(pattern = "HH:mm")
        private LocalTime breakStart;
        @JsonFormat(pattern = "HH:mm")
        private LocalTime breakEnd;
        private String reason;
    }

    @Data
    public static class OverrideItem {
        private UUID overrideId;
        private LocalDate date;
        @JsonProperty("isOpen")
        private boolean open;
        @JsonFormat(pattern = "HH:mm")
        private LocalTime openTime;
        @JsonFormat(pattern = "HH:mm")
        private LocalTime closeTime;
        @JsonFormat(pattern = "HH:mm")
        private LocalTime breakStart;
        @JsonFormat(pattern = "HH:mm")
        private LocalTime breakEnd;
        private String reason;

        public static OverrideItem from(HoursOverride o) {
            OverrideItem i = new OverrideItem();
            i.overrideId = o.getId();
            i.date = o.getDate();
            i.open = o.isOpen();
            i.openTime = o.getOpenTime();
            i.closeTime = o.getCloseTime();
            i.breakStart = o.getBreakStart();
            i.breakEnd = o.getBreakEnd();
            i.reason = o.getReason();
            return i;
        }
    }

    @Data
    public static class ClosureRequest {
        @NotNull
        private LocalDate startDate;
        private LocalDate endDate;
        @JsonFormat(pattern = "HH:mm")
        private LocalTime fromTime;
        @JsonFormat(pattern = "HH:mm")
        private LocalTime untilTime;
        private ClosureType type;
        private String reason;
    }

    @Data
    public static class ClosureItem {
        private UUID closureId;
        private LocalDate startDate;
        private LocalDate endDate;
        @JsonFormat(pattern = "HH:mm")
        private LocalTime fromTime;
        @JsonFormat(pattern = "HH:mm")
        private LocalTime untilTime;
        private String type;
        private String reason;
        private boolean active;

        public static ClosureItem from(BusinessClosure c) {
            ClosureItem i = new ClosureItem();
            i.closureId = c.getId();
            i.startDate = c.getStartDate();
            i.endDate = c.getEndDate();
            i.fromTime = c.getFromTime();
            i.untilTime = c.getUntilTime();
            i.type = c.getType().name();
            i.reason = c.getReason();
            i.active = c.isActive();
            return i;
        }
    }
}
