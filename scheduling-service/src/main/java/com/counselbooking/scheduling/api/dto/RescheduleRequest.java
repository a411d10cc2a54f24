package com.counselbooking.scheduling.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;

public record RescheduleRequest(
        @NotNull(message = "New date and time cannot be null")
        Instant newDateTime,

        @Size(max = 200, message = "Reason must be at most 200 characters")
        String reason
) {
}
