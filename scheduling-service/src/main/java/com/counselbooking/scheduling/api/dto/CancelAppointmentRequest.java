package com.counselbooking.scheduling.api.dto;

import jakarta.validation.constraints.Size;

public record CancelAppointmentRequest(
        @Size(max = 200, message = "Reason must be at most 200 characters")
        String reason
) {
}
