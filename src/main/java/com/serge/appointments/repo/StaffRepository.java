package com.serge.appointments.repo;

import com.serge.appointments.domain.Staff;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface StaffRepository extends JpaRepository<Staff, UUID> {

    Optional<Staff> findByIdAndBusinessId(UUID id, UUID businessId);

    /** Active staff assigned to the service, in the stable order used for assignment and locking. */
    @Query("""
        SELECT s FROM ServiceOffering o JOIN o.staff s
        WHERE o.id = :serviceId AND s.active = true
        ORDER BY s.id
        """)
    List<Staff> findActiveEligible(@Param("serviceId") UUID serviceId);

    @Query("""
        SELECT COUNT(s) > 0 FROM ServiceOffering o JOIN o.staff s
        WHERE o.id = :serviceId AND s.id = :staffId
        """)
    boolean isAssigned(@Param("serviceId") UUID serviceId, @Param("staffId") UUID staffId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("SELECT s FROM Staff s WHERE s.id = :id")
    Optional<Staff> findByIdForUpdate(@Param("id") UUID id);
}
