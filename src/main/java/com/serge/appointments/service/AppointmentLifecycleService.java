package com.serge.appointments.service;

import com.serge.appointments.domain.Appointment;
import com.serge.appointments.domain.AppointmentStateMachine;
import com.serge.appointments.domain.AppointmentStatus;
import com.serge.appointments.error.NotFoundException;
import com.serge.appointments.repo.AppointmentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Status changes after booking. Business-side operations only see appointments of the business
 * in the path; anything else is reported as not found.
 */
@Service
@RequiredArgsConstructor
public class AppointmentLifecycleService {
    private static final Logger log = LoggerFactory.getLogger(AppointmentLifecycleService.class);

    private final AppointmentRepository appointmentRepository;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    @Transactional
    public Appointment confirm(UUID businessId, UUID appointmentId) {
        return transition(lockForBusiness(businessId, appointmentId), AppointmentStatus.CONFIRMED, null);
    }

    @Transactional
    public Appointment complete(UUID businessId, UUID appointmentId) {
        return transition(lockForBusiness(businessId, appointmentId), AppointmentStatus.COMPLETED, null);
    }

    @Transactional
    public Appointment markNoShow(UUID businessId, UUID appointmentId) {
        return transition(lockForBusiness(businessId, appointmentId), AppointmentStatus.NO_SHOW, null);
    }

    @Transactional
    public Appointment cancel(UUID businessId, UUID appointmentId, String reason) {
        return transition(lockForBusiness(businessId, appointmentId), AppointmentStatus.CANCELED, reason);
    }

    @Transactional
    public Appointment cancelByCustomer(String customerId, UUID appointmentId, String reason) {
        Appointment a = appointmentRepository.findByIdAndCustomerIdForUpdate(appointmentId, customerId)
                .orElseThrow(() -> NotFoundException.of("Appointment", appointmentId));
        return transition(a, AppointmentStatus.CANCELED, reason);
    }

    @Transactional(readOnly = true)
    public Appointment getForCustomer(String customerId, UUID appointmentId) {
        return appointmentRepository.findByIdAndCustomerId(appointmentId, customerId)
                .orElseThrow(() -> NotFoundException.of("Appointment", appointmentId));
    }

    private Appointment lockForBusiness(UUID businessId, UUID appointmentId) {
        return appointmentRepository.findByIdAndBusinessIdForUpdate(appointmentId, businessId)
                .orElseThrow(() -> NotFoundException.of("Appointment", appointmentId));
    }

    private Appointment transition(Appointment a, AppointmentStatus target, String reason) {
        AppointmentStatus from = a.getStatus();
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!AppointmentStateMachine.apply(a, target, reason, now)) {
            log.debug("appointments.transition.noop id={} status={}", a.getId(), target);
            return a;
        }
        appointmentRepository.save(a);
        events.publishEvent(AppointmentEvent.of(AppointmentEventType.of(target), a, now));
        log.info("appointments.transition id={} businessId={} from={} to={}", a.getId(), a.getBusinessId(), from, target);
        return a;
    }
}
