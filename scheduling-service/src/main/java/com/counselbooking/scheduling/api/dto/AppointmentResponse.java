package com.counselbooking.scheduling.api.dto;

import com.counselbooking.scheduling.domain.model.Appointment;

import java.time.Instant;

public record AppointmentResponse(
        Long id,
        Long userId,
        Long serviceId,
        String serviceTitle,
        Integer serviceDuration,
        Instant dateTime,
        Appointment.AppointmentStatus status,
        String notes,
        String cancellationReason,
        Instant createdAt,
        Instant updatedAt
) {
    public static AppointmentResponse from(Appointment appointment) {
        return new AppointmentResponse(
                appointment.getId(),
                appointment.getUserId(),
                appointment.getService().getId(),
                appointment.getService().getTitle(),
                appointment.getService().getDurationMinutes(),
                appointment.getDateTime(),
                appointment.getStatus(),
                appointment.getNotes(),
                appointment.getCancellationReason(),
                appointment.getCreatedAt(),
                appointment.getUpdatedAt()
        );
    }
}
