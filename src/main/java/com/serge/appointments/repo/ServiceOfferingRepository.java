package com.serge.appointments.repo;

import com.serge.appointments.domain.ServiceOffering;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface ServiceOfferingRepository extends JpaRepository<ServiceOffering, UUID> {

    Optional<ServiceOffering> findByIdAndBusinessId(UUID id, UUID businessId);
}
