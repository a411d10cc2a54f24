package com.counselbooking.scheduling.domain.service;

import com.counselbooking.common.exception.ValidationException;
import com.counselbooking.scheduling.config.BusinessRulesProperties;
import com.counselbooking.scheduling.config.SchedulingProperties;
import com.counselbooking.scheduling.domain.model.Appointment.AppointmentStatus;
import com.counselbooking.scheduling.domain.model.AvailabilityResult;
import com.counselbooking.scheduling.domain.model.ConflictReport;
import com.counselbooking.scheduling.domain.model.ConflictType;
import com.counselbooking.scheduling.domain.model.ConflictingAppointment;
import com.counselbooking.scheduling.domain.model.SuggestedSlot;
import com.counselbooking.scheduling.domain.model.TimeSlot;
import com.counselbooking.scheduling.domain.repository.AppointmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * Explains why a proposed start time cannot be used and proposes nearby alternatives.
 * Used by the admin screens before moving an appointment.
 *
 * Must not join a surrounding transaction: collaborators read in their own read-only
 * transactions and a failed alternative lookup would otherwise mark it rollback-only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConflictDetector {

    private final AvailabilityChecker availabilityChecker;
    private final SlotGenerator slotGenerator;
    private final AppointmentRepository appointmentRepository;
    private final DisplayTimeFormatter displayTimeFormatter;
    private final BusinessRulesProperties rules;
    private final SchedulingProperties schedulingProperties;

    public ConflictReport detectConflicts(Instant dateTime, Long serviceId, int durationMinutes) {
        return detectConflicts(dateTime, serviceId, durationMinutes, null);
    }

    public ConflictReport detectConflicts(Instant dateTime, Long serviceId, int durationMinutes,
                                          Long excludeAppointmentId) {
        if (!rules.isDurationInRange(durationMinutes)) {
            throw new ValidationException("serviceDuration", String.format(
                    "Duration must be between %d and %d minutes",
                    rules.getMinDurationMinutes(), rules.getMaxDurationMinutes()));
        }

        AvailabilityResult availability = availabilityChecker.isTimeSlotAvailable(dateTime, serviceId, excludeAppointmentId);
        if (availability.available()) {
            return ConflictReport.none();
        }

        ConflictType conflictType = availability.reasonCode().getConflictType();
        List<ConflictingAppointment> conflicting = conflictType == ConflictType.APPOINTMENT
                ? findConflictingAppointments(dateTime, durationMinutes, excludeAppointmentId)
                : List.of();
        List<SuggestedSlot> alternatives = suggestAlternatives(dateTime, serviceId, excludeAppointmentId);

        log.info("Conflict at {} for service {}: {} ({} conflicting, {} alternatives)",
                dateTime, serviceId, availability.reasonCode(), conflicting.size(), alternatives.size());
        return new ConflictReport(true, conflictType, conflicting, availability.reason(), alternatives);
    }

    private List<ConflictingAppointment> findConflictingAppointments(Instant dateTime, int durationMinutes,
                                                                     Long excludeAppointmentId) {
        ZoneId zone = schedulingProperties.getBusinessZone();
        LocalDate day = dateTime.atZone(zone).toLocalDate();
        Instant requestedEnd = dateTime.plus(Duration.ofMinutes(durationMinutes));

        return appointmentRepository.findInRangeWithStatuses(
                        day.atStartOfDay(zone).toInstant(),
                        day.plusDays(1).atStartOfDay(zone).toInstant(),
                        AppointmentStatus.ACTIVE)
                .stream()
                .filter(a -> !Objects.equals(a.getId(), excludeAppointmentId))
                .filter(a -> OccupancyRules.conflictsWithAppointment(dateTime, requestedEnd, a, rules.buffer()))
                .map(ConflictingAppointment::from)
                .toList();
    }

    private List<SuggestedSlot> suggestAlternatives(Instant dateTime, Long serviceId, Long excludeAppointmentId) {
        LocalDate requestedDay = dateTime.atZone(schedulingProperties.getBusinessZone()).toLocalDate();
        int limit = schedulingProperties.getConflicts().getMaxSuggestions();
        try {
            for (int offset = 0; offset <= schedulingProperties.getConflicts().getLookaheadDays(); offset++) {
                List<SuggestedSlot> suggestions = slotGenerator
                        .generateTimeSlots(requestedDay.plusDays(offset), serviceId, excludeAppointmentId)
                        .stream()
                        .filter(TimeSlot::available)
                        .limit(limit)
                        .map(slot -> new SuggestedSlot(slot.dateTime(),
                                displayTimeFormatter.formatRelative(slot.dateTime(), requestedDay)))
                        .toList();
                if (!suggestions.isEmpty()) {
                    return suggestions;
                }
            }
        } catch (RuntimeException e) {
            log.warn("Could not generate alternatives for {} (service {}), returning none", dateTime, serviceId, e);
        }
        return List.of();
    }
}
