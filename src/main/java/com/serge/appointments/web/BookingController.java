package com.serge.appointments.web;

import com.serge.appointments.domain.Appointment;
import com.serge.appointments.service.AppointmentLifecycleService;
import com.serge.appointments.service.BookingCommand;
import com.serge.appointments.service.BookingResult;
import com.serge.appointments.service.BookingService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Customer side: book, look up and cancel own appointments. The customer is the JWT subject.
 */
@RestController
@RequestMapping("/api/bookings")
@RequiredArgsConstructor
public class BookingController {
    private static final Logger log = LoggerFactory.getLogger(BookingController.class);
    private final BookingService bookingService;
    private final AppointmentLifecycleService lifecycleService;

    @PostMapping
    public ResponseEntity<AppointmentItem> create(
            @Valid @RequestBody CreateBookingRequest body,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey,
            @AuthenticationPrincipal Jwt jwt
    ) {
        log.info("bookings.create businessId={} serviceId={} staffId={} start={}",
                body.getBusinessId(), body.getServiceId(), body.getStaffId(), body.getStart());
        BookingResult result = bookingService.bookAppointment(new BookingCommand(
                body.getBusinessId(),
                body.getServiceId(),
                body.getStaffId(),
                jwt.getSubject(),
                body.getStart(),
                body.getNotes(),
                idempotencyKey == null || idempotencyKey.isBlank() ? null : idempotencyKey.trim()));
        Appointment a = result.appointment();
        log.info("bookings.create.done appointmentId={} status={} replayed={}", a.getId(), a.getStatus(), result.replayed());
        return ResponseEntity.status(result.replayed() ? 200 : 201).body(AppointmentItem.from(a));
    }

    @GetMapping("/{id}")
    public AppointmentItem get(@PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
        log.debug("bookings.get id={}", id);
        return AppointmentItem.from(lifecycleService.getForCustomer(jwt.getSubject(), id));
    }

    @PostMapping("/{id}/cancel")
    public AppointmentItem cancel(@PathVariable UUID id,
                                  @Valid @RequestBody CancelRequest body,
                                  @AuthenticationPrincipal Jwt jwt) {
        log.info("bookings.cancel id={}", id);
        return AppointmentItem.from(lifecycleService.cancelByCustomer(jwt.getSubject(), id, body.getReason()));
    }

    // DTOs
    @Data
    public static class CreateBookingRequest {
        @NotNull
        private UUID businessId;
        @NotNull
        private UUID serviceId;
        private UUID staffId;
        @NotNull
        private OffsetDateTime start;
        @Size(max = 2000)
        private String notes;
    }

    @Data
    public static class CancelRequest {
        @NotBlank
        @Size(max = 500)
        private String reason;
    }
}
