package com.serge.appointments.domain;

import io.hypersistence.utils.hibernate.type.json.JsonType;
import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Entity
@Table(name = "staff")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Staff {
    @Id
    @GeneratedValue
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "business_id", nullable = false)
    private Business business;

    @Column(name = "display_name", nullable = false)
    private String displayName;

    @Column(nullable = false)
    private boolean active;

    // Personal hours; a weekday missing here follows the business
    @org.hibernate.annotations.Type(JsonType.class)
    @Column(name = "working_hours", columnDefinition = "jsonb")
    private WeeklyHours workingHours;
}
