package com.counselbooking.scheduling.domain.model;

import java.time.Instant;

public record ConflictingAppointment(
        Long id,
        Instant dateTime,
        Appointment.AppointmentStatus status,
        Long userId,
        String serviceTitle,
        Integer serviceDuration
) {
    public static ConflictingAppointment from(Appointment appointment) {
        return new ConflictingAppointment(
                appointment.getId(),
                appointment.getDateTime(),
                appointment.getStatus(),
                appointment.getUserId(),
                appointment.getService().getTitle(),
                appointment.getService().getDurationMinutes()
        );
    }
}
