package com.serge.appointments.web;

import com.serge.appointments.domain.Appointment;
import lombok.Data;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

@Data
public class AppointmentItem {
    private UUID appointmentId;
    private UUID businessId;
    private UUID serviceId;
    private UUID staffId;
    private String customerId;
    private String status;
    private LocalDate date;
    private OffsetDateTime start;
    private OffsetDateTime end;
    private Integer durationMinutes;
    private Integer bufferMinutes;
    private String customerNotes;
    private String cancelReason;
    private OffsetDateTime bookedAt;
    private OffsetDateTime confirmedAt;
    private OffsetDateTime completedAt;
    private OffsetDateTime canceledAt;

    public static AppointmentItem from(Appointment a) {
        AppointmentItem i = new AppointmentItem();
        i.appointmentId = a.getId();
        i.businessId = a.getBusinessId();
        i.serviceId = a.getServiceId();
        i.staffId = a.getStaffId();
        i.customerId = a.getCustomerId();
        i.status = a.getStatus().name();
        i.date = a.getDate();
        i.start = a.getStartTs();
        i.end = a.getEndTs();
        i.durationMinutes = a.getDurationMinutes();
        i.bufferMinutes = a.getBufferMinutes();
        i.customerNotes = a.getCustomerNotes();
        i.cancelReason = a.getCancelReason();
        i.bookedAt = a.getBookedAt();
        i.confirmedAt = a.getConfirmedAt();
        i.completedAt = a.getCompletedAt();
        i.canceledAt = a.getCanceledAt();
        return i;
    }
}
