package com.counselbooking.scheduling.exception;

import com.counselbooking.common.exception.ConflictException;
import com.counselbooking.scheduling.domain.model.UnavailabilityReason;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The requested start time cannot be booked (booking or reschedule).
 */
@Getter
public class SlotUnavailableException extends ConflictException {

    public static final String ERROR_CODE = "SLOT_UNAVAILABLE";

    private final UnavailabilityReason reasonCode;
    private final List<Long> conflictingAppointmentIds;

    public SlotUnavailableException(UnavailabilityReason reasonCode, String message) {
        this(reasonCode, message, List.of());
    }

    public SlotUnavailableException(UnavailabilityReason reasonCode, String message, List<Long> conflictingAppointmentIds) {
        super(message, ERROR_CODE);
        this.reasonCode = reasonCode;
        this.conflictingAppointmentIds = List.copyOf(conflictingAppointmentIds);
    }

    public SlotUnavailableException(UnavailabilityReason reasonCode, String message, Throwable cause) {
        super(message, cause, ERROR_CODE);
        this.reasonCode = reasonCode;
        this.conflictingAppointmentIds = List.of();
    }

    @Override
    public Object getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reasonCode", reasonCode);
        details.put("conflictingAppointmentIds", conflictingAppointmentIds);
        return details;
    }
}
