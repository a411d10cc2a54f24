package com.counselbooking.scheduling.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.time.LocalTime;

public record AvailabilityWindowRequest(
        @NotNull(message = "Day of week cannot be null")
        @Min(value = 0, message = "Day of week must be between 0 and 6")
        @Max(value = 6, message = "Day of week must be between 0 and 6")
        Integer dayOfWeek,

        @NotNull(message = "Start time cannot be null")
        @JsonFormat(pattern = "HH:mm")
        LocalTime startTime,

        @NotNull(message = "End time cannot be null")
        @JsonFormat(pattern = "HH:mm")
        LocalTime endTime,

        Boolean active
) {
}
