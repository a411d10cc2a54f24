package com.counselbooking.scheduling.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * A candidate start time produced by the slot generator.
 * {@code reason} is null exactly when the slot is available.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimeSlot(
        Instant dateTime,
        boolean available,
        UnavailabilityReason reasonCode,
        String reason,
        String displayTime
) {
    public static TimeSlot available(Instant dateTime, String displayTime) {
        return new TimeSlot(dateTime, true, null, null, displayTime);
    }

    public static TimeSlot unavailable(Instant dateTime, UnavailabilityReason reasonCode, String displayTime) {
        return new TimeSlot(dateTime, false, reasonCode, reasonCode.getSlotLabel(), displayTime);
    }
}
