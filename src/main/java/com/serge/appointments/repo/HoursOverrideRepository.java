package com.serge.appointments.repo;

import com.serge.appointments.domain.HoursOverride;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

public interface HoursOverrideRepository extends JpaRepository<HoursOverride, UUID> {

    Optional<HoursOverride> findByBusinessIdAndDate(UUID businessId, LocalDate date);
}
