package com.counselbooking.scheduling.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;

public record BookAppointmentRequest(
        @NotNull(message = "User ID cannot be null")
        Long userId,

        @NotNull(message = "Service ID cannot be null")
        Long serviceId,

        @NotNull(message = "Date and time cannot be null")
        Instant dateTime,

        @Size(max = 500, message = "Notes must be at most 500 characters")
        String notes
) {
}
