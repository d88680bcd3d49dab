package com.serge.appointments.domain;

import io.hypersistence.utils.hibernate.type.range.PostgreSQLRangeType;
import io.hypersistence.utils.hibernate.type.range.Range;
import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

@Entity
@Table(name = "appointments")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Appointment {
    @Id
    @GeneratedValue
    private UUID id;

    @Column(name = "business_id", nullable = false)
    private UUID businessId;
    @Column(name = "service_id", nullable = false)
    private UUID serviceId;
    // null = the business-wide unassigned resource
    @Column(name = "staff_id")
    private UUID staffId;
    @Column(name = "customer_id", nullable = false)
    private String customerId;

    // calendar date in the business timezone
    @Column(name = "appointment_date", nullable = false)
    private LocalDate date;

    @Column(name = "start_ts", nullable = false)
    private OffsetDateTime startTs;
    @Column(name = "end_ts", nullable = false)
    private OffsetDateTime endTs;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;
    @Column(name = "buffer_minutes", nullable = false)
    private int bufferMinutes;

    // [start, end + buffer) in UTC, guarded by the exclusion constraint
    @Column(name = "occupied_range", columnDefinition = "tsrange", nullable = false)
    @org.hibernate.annotations.Type(PostgreSQLRangeType.class)
    private Range<LocalDateTime> occupiedRange;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AppointmentStatus status;

    @Column(name = "customer_notes", columnDefinition = "text")
    private String customerNotes;
    @Column(name = "cancel_reason", columnDefinition = "text")
    private String cancelReason;
    @Column(name = "idempotency_key", length = 128)
    private String idempotencyKey;

    @Column(name = "booked_at", nullable = false)
    private OffsetDateTime bookedAt;
    @Column(name = "confirmed_at")
    private OffsetDateTime confirmedAt;
    @Column(name = "completed_at")
    private OffsetDateTime completedAt;
    @Column(name = "canceled_at")
    private OffsetDateTime canceledAt;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Version
    private Long version;

    public static Range<LocalDateTime> occupiedRange(OffsetDateTime start, OffsetDateTime end, int bufferMinutes) {
        return Range.closedOpen(utc(start), utc(end.plus(Duration.ofMinutes(bufferMinutes))));
    }

    private static LocalDateTime utc(OffsetDateTime t) {
        return t.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
    }
}
