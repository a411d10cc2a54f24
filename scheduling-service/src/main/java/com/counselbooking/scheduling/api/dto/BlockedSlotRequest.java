package com.counselbooking.scheduling.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;

public record BlockedSlotRequest(
        @NotNull(message = "Date and time cannot be null")
        Instant dateTime,

        @NotNull(message = "Duration cannot be null")
        @Min(value = 15, message = "Duration must be at least 15 minutes")
        @Max(value = 480, message = "Duration must be at most 480 minutes")
        Integer duration,

        @Size(max = 200, message = "Reason must be at most 200 characters")
        String reason
) {
}
