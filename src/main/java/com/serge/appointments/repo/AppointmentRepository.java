package com.serge.appointments.repo;

import com.serge.appointments.domain.Appointment;
import com.serge.appointments.domain.AppointmentStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AppointmentRepository extends JpaRepository<Appointment, UUID> {

    @Query("""
        SELECT a FROM Appointment a
        WHERE a.businessId = :businessId
          AND a.status IN :statuses
          AND a.startTs < :toTs AND a.endTs > :fromTs
        ORDER BY a.startTs
        """)
    List<Appointment> findOccupying(@Param("businessId") UUID businessId,
                                    @Param("fromTs") OffsetDateTime fromTs,
                                    @Param("toTs") OffsetDateTime toTs,
                                    @Param("statuses") Collection<AppointmentStatus> statuses);

    @Query("""
        SELECT a FROM Appointment a
        WHERE a.businessId = :businessId
          AND a.staffId = :staffId
          AND a.status IN :statuses
          AND a.startTs < :toTs AND a.endTs > :fromTs
        ORDER BY a.startTs
        """)
    List<Appointment> findOccupyingForStaff(@Param("businessId") UUID businessId,
                                            @Param("staffId") UUID staffId,
                                            @Param("fromTs") OffsetDateTime fromTs,
                                            @Param("toTs") OffsetDateTime toTs,
                                            @Param("statuses") Collection<AppointmentStatus> statuses);

    @Query("""
        SELECT a FROM Appointment a
        WHERE a.businessId = :businessId
          AND a.staffId IS NULL
          AND a.status IN :statuses
          AND a.startTs < :toTs AND a.endTs > :fromTs
        ORDER BY a.startTs
        """)
    List<Appointment> findOccupyingUnassigned(@Param("businessId") UUID businessId,
                                              @Param("fromTs") OffsetDateTime fromTs,
                                              @Param("toTs") OffsetDateTime toTs,
                                              @Param("statuses") Collection<AppointmentStatus> statuses);

    Optional<Appointment> findByIdAndBusinessId(UUID id, UUID businessId);

    Optional<Appointment> findByIdAndCustomerId(UUID id, String customerId);

    Optional<Appointment> findByBusinessIdAndIdempotencyKey(UUID businessId, String idempotencyKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("SELECT a FROM Appointment a WHERE a.id = :id AND a.businessId = :businessId")
    Optional<Appointment> findByIdAndBusinessIdForUpdate(@Param("id") UUID id, @Param("businessId") UUID businessId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("SELECT a FROM Appointment a WHERE a.id = :id AND a.customerId = :customerId")
    Optional<Appointment> findByIdAndCustomerIdForUpdate(@Param("id") UUID id, @Param("customerId") String customerId);

    /**
     * Pairs of time-blocking appointments of one business that share a resource and overlap.
     * Always 0 while the booking path and the exclusion constraint do their job.
     */
    @Query(value = """
        SELECT COUNT(*)
        FROM appointments a
        JOIN appointments b
          ON a.business_id = b.business_id
         AND a.id < b.id
         AND COALESCE(a.staff_id, '00000000-0000-0000-0000-000000000000'::uuid)
           = COALESCE(b.staff_id, '00000000-0000-0000-0000-000000000000'::uuid)
         AND a.occupied_range && b.occupied_range
        WHERE a.business_id = :businessId
          AND a.status IN (:statuses)
          AND b.status IN (:statuses)
        """, nativeQuery = true)
    long countOverlappingPairs(@Param("businessId") UUID businessId,
                               @Param("statuses") List<String> statuses);
}
