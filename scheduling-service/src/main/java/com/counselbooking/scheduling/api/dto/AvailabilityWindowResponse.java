package com.counselbooking.scheduling.api.dto;

import com.counselbooking.scheduling.domain.model.AvailabilityWindow;
import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalTime;

public record AvailabilityWindowResponse(
        Long id,
        Integer dayOfWeek,
        @JsonFormat(pattern = "HH:mm")
        LocalTime startTime,
        @JsonFormat(pattern = "HH:mm")
        LocalTime endTime,
        boolean active
) {
    public static AvailabilityWindowResponse from(AvailabilityWindow window) {
        return new AvailabilityWindowResponse(
                window.getId(),
                window.getDayOfWeek(),
                window.getStartTime(),
                window.getEndTime(),
                window.isActive()
        );
    }
}
