package com.serge.appointments.service;

import com.serge.appointments.domain.Staff;
import com.serge.appointments.error.NotFoundException;
import com.serge.appointments.repo.StaffRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Which staff members can take a booking for a service. An empty list means the booking goes
 * to the business-wide unassigned resource.
 */
@Component
@RequiredArgsConstructor
public class StaffEligibility {
    private final StaffRepository staffRepository;

    public List<Staff> candidates(UUID businessId, UUID serviceId, UUID staffId) {
        if (staffId != null) {
            return List.of(requireEligible(businessId, serviceId, staffId));
        }
        return staffRepository.findActiveEligible(serviceId);
    }

    public Staff requireEligible(UUID businessId, UUID serviceId, UUID staffId) {
        Staff staff = staffRepository.findByIdAndBusinessId(staffId, businessId)
                .filter(Staff::isActive)
                .orElseThrow(() -> NotFoundException.of("Staff", staffId));
        if (!staffRepository.isAssigned(serviceId, staffId)) {
            throw new NotFoundException("Staff " + staffId + " does not perform service " + serviceId);
        }
        return staff;
    }
}
