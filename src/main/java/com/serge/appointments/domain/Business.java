package com.serge.appointments.domain;

import io.hypersistence.utils.hibernate.type.json.JsonType;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.UUID;

@Entity
@Table(name = "businesses")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Business {
    @Id
    @GeneratedValue
    private UUID id;

    @Column(nullable = false)
    private String name;

    // IANA zone id, e.g. Europe/Paris
    @Column(nullable = false, length = 64)
    private String timezone;

    @org.hibernate.annotations.Type(JsonType.class)
    @Column(name = "weekly_hours", columnDefinition = "jsonb")
    private WeeklyHours weeklyHours;

    @Column(name = "requires_approval", nullable = false)
    private boolean requiresApproval;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public ZoneId zone() {
        return ZoneId.of(timezone);
    }
}
