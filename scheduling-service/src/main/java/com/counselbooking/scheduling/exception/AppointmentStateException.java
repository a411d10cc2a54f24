package com.counselbooking.scheduling.exception;

import com.counselbooking.common.exception.ConflictException;
import com.counselbooking.scheduling.domain.model.Appointment.AppointmentStatus;
import lombok.Getter;

import java.util.Map;

/**
 * The appointment's current status does not allow the requested transition.
 */
@Getter
public class AppointmentStateException extends ConflictException {

    public static final String NOT_RESCHEDULABLE = "APPOINTMENT_NOT_RESCHEDULABLE";
    public static final String INVALID_TRANSITION = "INVALID_STATUS_TRANSITION";

    private final Long appointmentId;
    private final AppointmentStatus currentStatus;

    public AppointmentStateException(String message, String errorCode, Long appointmentId, AppointmentStatus currentStatus) {
        super(message, errorCode);
        this.appointmentId = appointmentId;
        this.currentStatus = currentStatus;
    }

    @Override
    public Object getDetails() {
        return Map.of("appointmentId", appointmentId, "status", currentStatus);
    }
}
