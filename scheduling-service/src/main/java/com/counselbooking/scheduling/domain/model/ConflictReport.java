package com.counselbooking.scheduling.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Admin-facing conflict analysis for a proposed start time.
 * Every field is always serialized; a conflict-free report carries a null {@code conflictType} and an empty reason.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ConflictReport(
        boolean hasConflict,
        ConflictType conflictType,
        List<ConflictingAppointment> conflictingAppointments,
        String reason,
        List<SuggestedSlot> suggestedAlternatives
) {
    public static ConflictReport none() {
        return new ConflictReport(false, null, List.of(), "", List.of());
    }
}
