package com.serge.appointments.repo;

import com.serge.appointments.domain.BusinessClosure;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface BusinessClosureRepository extends JpaRepository<BusinessClosure, UUID> {

    @Query("""
        SELECT c FROM BusinessClosure c
        WHERE c.business.id = :businessId
          AND c.active = true
          AND c.startDate <= :date
          AND (c.endDate IS NULL OR c.endDate >= :date)
        ORDER BY c.startDate
        """)
    List<BusinessClosure> findActiveCovering(@Param("businessId") UUID businessId, @Param("date") LocalDate date);

    Optional<BusinessClosure> findByIdAndBusinessId(UUID id, UUID businessId);
}
