package com.serge.appointments.web;

import com.serge.appointments.service.AppointmentLifecycleService;
import com.serge.appointments.service.BookingService;
import com.serge.appointments.service.BusinessAccessGate;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@RestController
@RequestMapping("/api/businesses/{businessId}/appointments")
@RequiredArgsConstructor
public class BusinessAppointmentController {
    private static final Logger log = LoggerFactory.getLogger(BusinessAppointmentController.class);
    private final AppointmentLifecycleService lifecycleService;
    private final BookingService bookingService;
    private final BusinessAccessGate accessGate;

    @PostMapping("/{id}/confirm")
    public AppointmentItem confirm(@PathVariable UUID businessId, @PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
        accessGate.requireAccess(jwt, businessId);
        log.info("business.appointments.confirm businessId={} id={}", businessId, id);
        return AppointmentItem.from(lifecycleService.confirm(businessId, id));
    }

    @PostMapping("/{id}/complete")
    public AppointmentItem complete(@PathVariable UUID businessId, @PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
        accessGate.requireAccess(jwt, businessId);
        log.info("business.appointments.complete businessId={} id={}", businessId, id);
        return AppointmentItem.from(lifecycleService.complete(businessId, id));
    }

    @PostMapping("/{id}/no-show")
    public AppointmentItem noShow(@PathVariable UUID businessId, @PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
        accessGate.requireAccess(jwt, businessId);
        log.info("business.appointments.no_show businessId={} id={}", businessId, id);
        return AppointmentItem.from(lifecycleService.markNoShow(businessId, id));
    }

    @PostMapping("/{id}/cancel")
    public AppointmentItem cancel(@PathVariable UUID businessId, @PathVariable UUID id,
                                  @Valid @RequestBody BookingController.CancelRequest body,
                                  @AuthenticationPrincipal Jwt jwt) {
        accessGate.requireAccess(jwt, businessId);
        log.info("business.appointments.cancel businessId={} id={}", businessId, id);
        return AppointmentItem.from(lifecycleService.cancel(businessId, id, body.getReason()));
    }

    @PostMapping("/{id}/reschedule")
    public AppointmentItem reschedule(@PathVariable UUID businessId, @PathVariable UUID id,
                                      @Valid @RequestBody RescheduleRequest body,
                                      @AuthenticationPrincipal Jwt jwt) {
        accessGate.requireAccess(jwt, businessId);
        log.info("business.appointments.reschedule businessId={} id={} start={}", businessId, id, body.getStart());
        return AppointmentItem.from(bookingService.reschedule(businessId, id, body.getStart()));
    }

    @Data
    public static class RescheduleRequest {
        @NotNull
        private OffsetDateTime start;
    }
}
