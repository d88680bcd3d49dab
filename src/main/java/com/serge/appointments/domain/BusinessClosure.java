package com.serge.appointments.domain;

import com.serge.appointments.schedule.TimeWindow;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Closure over a date range. Without an end date it stays in force until deactivated.
 * Without times it closes whole days; with both times it carves that range out of each day.
 */
@Entity
@Table(name = "business_closures")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BusinessClosure {
    @Id
    @GeneratedValue
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "business_id", nullable = false)
    private Business business;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;
    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(name = "from_time")
    private LocalTime fromTime;
    @Column(name = "until_time")
    private LocalTime untilTime;

    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ClosureType type;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    public boolean covers(LocalDate date) {
        return active && !date.isBefore(startDate) && (endDate == null || !date.isAfter(endDate));
    }

    public boolean isFullDay() {
        return fromTime == null || untilTime == null;
    }

    public TimeWindow window() {
        return new TimeWindow(fromTime, untilTime);
    }
}
