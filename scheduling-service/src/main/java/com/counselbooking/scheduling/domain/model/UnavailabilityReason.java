package com.counselbooking.scheduling.domain.model;

import lombok.Getter;

/**
 * Why a candidate start time cannot be booked.
 * The slot label is the short text shown in the slot picker, the message is the
 * explanation returned by the point check. Notice and booking-window texts are
 * built from the configured rules.
 */
@Getter
public enum UnavailabilityReason {
    OUTSIDE_BUSINESS_HOURS("Outside business hours", "Outside business hours", ConflictType.OUTSIDE_HOURS),
    APPOINTMENT_CONFLICT("Time slot unavailable", "Time slot conflicts with existing appointment", ConflictType.APPOINTMENT),
    BLOCKED("Time slot unavailable", "Time slot is blocked", ConflictType.BLOCKED),
    INSUFFICIENT_NOTICE("Insufficient advance notice", "Must be booked at least %d hours in advance", ConflictType.APPOINTMENT),
    BEYOND_BOOKING_WINDOW("Beyond booking window", "Cannot be booked more than %d days in advance", ConflictType.APPOINTMENT);

    private final String slotLabel;
    private final String message;
    private final ConflictType conflictType;

    UnavailabilityReason(String slotLabel, String message, ConflictType conflictType) {
        this.slotLabel = slotLabel;
        this.message = message;
        this.conflictType = conflictType;
    }

    public String formatMessage(Object... args) {
        return String.format(message, args);
    }
}
