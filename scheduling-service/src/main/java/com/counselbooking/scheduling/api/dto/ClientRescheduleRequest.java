package com.counselbooking.scheduling.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;

public record ClientRescheduleRequest(
        @NotNull(message = "User ID cannot be null")
        Long userId,

        @NotNull(message = "New date and time cannot be null")
        Instant newDateTime,

        @Size(max = 200, message = "Reason must be at most 200 characters")
        String reason
) {
}
