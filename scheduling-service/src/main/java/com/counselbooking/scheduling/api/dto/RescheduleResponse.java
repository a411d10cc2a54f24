package com.counselbooking.scheduling.api.dto;

import com.counselbooking.scheduling.domain.model.RescheduleResult;

public record RescheduleResponse(
        AppointmentHistoryResponse historyRecord,
        AppointmentResponse appointment
) {
    public static RescheduleResponse from(RescheduleResult result) {
        return new RescheduleResponse(
                AppointmentHistoryResponse.from(result.historyRecord()),
                AppointmentResponse.from(result.updatedAppointment())
        );
    }
}
