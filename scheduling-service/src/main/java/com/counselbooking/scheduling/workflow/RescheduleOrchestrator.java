package com.counselbooking.scheduling.workflow;

import com.counselbooking.common.exception.ResourceNotFoundException;
import com.counselbooking.common.exception.ValidationException;
import com.counselbooking.scheduling.config.SchedulingProperties;
import com.counselbooking.scheduling.domain.model.Actor;
import com.counselbooking.scheduling.domain.model.Appointment;
import com.counselbooking.scheduling.domain.model.Appointment.AppointmentStatus;
import com.counselbooking.scheduling.domain.model.AppointmentHistory;
import com.counselbooking.scheduling.domain.model.AvailabilityResult;
import com.counselbooking.scheduling.domain.model.RescheduleResult;
import com.counselbooking.scheduling.domain.model.UnavailabilityReason;
import com.counselbooking.scheduling.domain.repository.AppointmentRepository;
import com.counselbooking.scheduling.domain.service.AppointmentHistoryService;
import com.counselbooking.scheduling.domain.service.AvailabilityChecker;
import com.counselbooking.scheduling.domain.service.BookingLockService;
import com.counselbooking.scheduling.exception.AppointmentStateException;
import com.counselbooking.scheduling.exception.SlotUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Moves an existing appointment to a new start time.
 *
 * Flow:
 * 1. Load the appointment and reject terminal statuses (fast path, no lock)
 * 2. Under the booking lock of the target day: reload with a row lock, re-check status,
 *    run the availability check with the appointment itself excluded
 * 3. In the same transaction: append the RESCHEDULED history row, then move the appointment
 *    and reset it to PENDING
 *
 * Any failure in step 2 or 3 rolls back both writes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RescheduleOrchestrator {

    static final int MAX_REASON_LENGTH = 200;

    private final AppointmentRepository appointmentRepository;
    private final AvailabilityChecker availabilityChecker;
    private final AppointmentHistoryService historyService;
    private final BookingLockService bookingLockService;
    private final SchedulingProperties schedulingProperties;
    private final Clock clock;

    /**
     * @param reason optional free text, at most 200 characters
     * @return the appended history row and the updated appointment
     */
    public RescheduleResult rescheduleAppointment(Long appointmentId, Instant newDateTime, String reason, Actor actor) {
        if (appointmentId == null) {
            throw new ValidationException("appointmentId", "Appointment ID is required");
        }
        if (newDateTime == null) {
            throw new ValidationException("newDateTime", "New date and time are required");
        }
        String normalizedReason = normalizeReason(reason);

        Appointment appointment = appointmentRepository.findWithServiceById(appointmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Appointment", appointmentId));
        ensureReschedulable(appointment);

        log.info("Rescheduling appointment {} from {} to {} by {}",
                appointmentId, appointment.getDateTime(), newDateTime, actor.name());

        LocalDate targetDay = newDateTime.atZone(schedulingProperties.getBusinessZone()).toLocalDate();
        return bookingLockService.executeLocked(targetDay,
                () -> performReschedule(appointmentId, newDateTime, normalizedReason, actor));
    }

    private RescheduleResult performReschedule(Long appointmentId, Instant newDateTime, String reason, Actor actor) {
        Appointment appointment = appointmentRepository.findByIdForUpdate(appointmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Appointment", appointmentId));
        ensureReschedulable(appointment);

        AvailabilityResult availability = availabilityChecker.isTimeSlotAvailable(
                newDateTime, appointment.getService().getId(), appointment.getId());
        if (!availability.available()) {
            log.info("Reschedule of appointment {} to {} rejected: {}",
                    appointmentId, newDateTime, availability.reasonCode());
            throw new SlotUnavailableException(availability.reasonCode(),
                    "New time slot is not available: " + availability.reason(),
                    availability.conflictingAppointmentIds());
        }

        Instant oldDateTime = appointment.getDateTime();
        AppointmentHistory historyRecord = historyService.recordReschedule(
                appointment, oldDateTime, newDateTime, AppointmentStatus.PENDING, reason, actor);

        appointment.setDateTime(newDateTime);
        appointment.setStatus(AppointmentStatus.PENDING);
        appointment.setUpdatedAt(clock.instant());
        Appointment updated;
        try {
            updated = appointmentRepository.saveAndFlush(appointment);
        } catch (DataIntegrityViolationException e) {
            throw new SlotUnavailableException(UnavailabilityReason.APPOINTMENT_CONFLICT,
                    "New time slot was just taken by another appointment", e);
        }

        log.info("Appointment {} rescheduled from {} to {}", appointmentId, oldDateTime, newDateTime);
        return new RescheduleResult(historyRecord, updated);
    }

    private void ensureReschedulable(Appointment appointment) {
        if (appointment.getStatus().isTerminal()) {
            throw new AppointmentStateException(
                    "Cannot reschedule " + appointment.getStatus().name().toLowerCase().replace('_', '-') + " appointments",
                    AppointmentStateException.NOT_RESCHEDULABLE,
                    appointment.getId(),
                    appointment.getStatus());
        }
    }

    private String normalizeReason(String reason) {
        if (reason == null || reason.isBlank()) {
            return null;
        }
        String trimmed = reason.trim();
        if (trimmed.length() > MAX_REASON_LENGTH) {
            throw new ValidationException("reason", "Reason must be at most " + MAX_REASON_LENGTH + " characters");
        }
        return trimmed;
    }
}
