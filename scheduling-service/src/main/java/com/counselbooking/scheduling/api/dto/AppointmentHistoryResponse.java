package com.counselbooking.scheduling.api.dto;

import com.counselbooking.scheduling.domain.model.Appointment;
import com.counselbooking.scheduling.domain.model.AppointmentHistory;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AppointmentHistoryResponse(
        Long id,
        Long appointmentId,
        AppointmentHistory.HistoryAction action,
        Instant oldDateTime,
        Instant newDateTime,
        Appointment.AppointmentStatus oldStatus,
        Appointment.AppointmentStatus newStatus,
        String reason,
        String actorId,
        String actorName,
        Instant createdAt
) {
    public static AppointmentHistoryResponse from(AppointmentHistory history) {
        return new AppointmentHistoryResponse(
                history.getId(),
                history.getAppointmentId(),
                history.getAction(),
                history.getOldDateTime(),
                history.getNewDateTime(),
                history.getOldStatus(),
                history.getNewStatus(),
                history.getReason(),
                history.getActorId(),
                history.getActorName(),
                history.getCreatedAt()
        );
    }
}
