package com.serge.appointments.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

/**
 * Replaces the weekly entry for one calendar date.
 */
@Entity
@Table(name = "business_hours_overrides",
        uniqueConstraints = @UniqueConstraint(columnNames = {"business_id", "override_date"}))
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HoursOverride {
    @Id
    @GeneratedValue
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "business_id", nullable = false)
    private Business business;

    @Column(name = "override_date", nullable = false)
    private LocalDate date;

    @Column(name = "is_open", nullable = false)
    private boolean open;

    @Column(name = "open_time")
    private LocalTime openTime;
    @Column(name = "close_time")
    private LocalTime closeTime;
    @Column(name = "break_start")
    private LocalTime breakStart;
    @Column(name = "break_end")
    private LocalTime breakEnd;

    private String reason;

    public DayHours toDayHours() {
        return new DayHours(open, openTime, closeTime, breakStart, breakEnd);
    }
}
