package com.counselbooking.scheduling.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * @param excludeAppointmentId Optional. The appointment being moved, ignored when looking for conflicts.
 */
public record ConflictCheckRequest(
        @NotNull(message = "Date and time cannot be null")
        Instant dateTime,

        @NotNull(message = "Service ID cannot be null")
        Long serviceId,

        @NotNull(message = "Service duration cannot be null")
        @Min(value = 15, message = "Duration must be at least 15 minutes")
        @Max(value = 480, message = "Duration must be at most 480 minutes")
        Integer serviceDuration,

        Long excludeAppointmentId
) {
}
