package com.serge.appointments.error;

import com.serge.appointments.domain.AppointmentStatus;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class InvalidTransitionException extends BookingException {
    private final AppointmentStatus current;
    private final AppointmentStatus attempted;

    public InvalidTransitionException(AppointmentStatus current, AppointmentStatus attempted) {
        super("INVALID_TRANSITION", HttpStatus.CONFLICT,
                "Cannot move appointment from " + current + " to " + attempted);
        this.current = current;
        this.attempted = attempted;
    }

    /** The appointment is in a status that does not allow the operation at all. */
    public InvalidTransitionException(AppointmentStatus current, String message) {
        super("INVALID_TRANSITION", HttpStatus.CONFLICT, message);
        this.current = current;
        this.attempted = null;
    }
}
