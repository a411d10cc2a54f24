package com.counselbooking.scheduling.domain.model;

import java.util.List;

/**
 * Outcome of a point availability check.
 */
public record AvailabilityResult(
        boolean available,
        UnavailabilityReason reasonCode,
        String reason,
        List<Long> conflictingAppointmentIds
) {
    public static AvailabilityResult ofAvailable() {
        return new AvailabilityResult(true, null, null, List.of());
    }

    public static AvailabilityResult unavailable(UnavailabilityReason reasonCode, String reason) {
        return new AvailabilityResult(false, reasonCode, reason, List.of());
    }

    public static AvailabilityResult conflicting(String reason, List<Long> conflictingAppointmentIds) {
        return new AvailabilityResult(false, UnavailabilityReason.APPOINTMENT_CONFLICT, reason,
                List.copyOf(conflictingAppointmentIds));
    }
}
