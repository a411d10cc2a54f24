package com.counselbooking.scheduling.domain.service;

import com.counselbooking.common.exception.ResourceNotFoundException;
import com.counselbooking.common.exception.ValidationException;
import com.counselbooking.scheduling.domain.model.Actor;
import com.counselbooking.scheduling.domain.model.Appointment;
import com.counselbooking.scheduling.domain.model.Appointment.AppointmentStatus;
import com.counselbooking.scheduling.domain.repository.AppointmentRepository;
import com.counselbooking.scheduling.exception.AppointmentStateException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Status changes and note edits made by staff after booking.
 * CANCELLED, COMPLETED and NO_SHOW are final.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppointmentLifecycleService {

    static final int MAX_REASON_LENGTH = 200;
    static final int MAX_NOTES_LENGTH = 500;

    private final AppointmentRepository appointmentRepository;
    private final AppointmentHistoryService historyService;
    private final Clock clock;

    @Transactional
    public Appointment confirm(Long appointmentId, Actor actor) {
        Appointment appointment = loadForUpdate(appointmentId);
        ensureActive(appointment, "confirm");
        if (appointment.getStatus() == AppointmentStatus.CONFIRMED) {
            throw invalidTransition(appointment, "Appointment is already confirmed");
        }
        return transition(appointment, AppointmentStatus.CONFIRMED, null, actor);
    }

    @Transactional
    public Appointment cancel(Long appointmentId, String reason, Actor actor) {
        String normalizedReason = normalize(reason, MAX_REASON_LENGTH, "reason");
        Appointment appointment = loadForUpdate(appointmentId);
        if (appointment.getStatus() == AppointmentStatus.CANCELLED) {
            throw invalidTransition(appointment, "Appointment is already cancelled");
        }
        if (appointment.getStatus().isTerminal()) {
            throw invalidTransition(appointment, "Cannot cancel completed or no-show appointments");
        }
        appointment.setCancellationReason(normalizedReason);
        return transition(appointment, AppointmentStatus.CANCELLED, normalizedReason, actor);
    }

    @Transactional
    public Appointment complete(Long appointmentId, Actor actor) {
        Appointment appointment = loadForUpdate(appointmentId);
        ensureActive(appointment, "complete");
        return transition(appointment, AppointmentStatus.COMPLETED, null, actor);
    }

    @Transactional
    public Appointment markNoShow(Long appointmentId, Actor actor) {
        Appointment appointment = loadForUpdate(appointmentId);
        ensureActive(appointment, "mark as no-show");
        return transition(appointment, AppointmentStatus.NO_SHOW, null, actor);
    }

    /**
     * Notes stay editable in every status. Blank notes clear the field.
     */
    @Transactional
    public Appointment updateNotes(Long appointmentId, String notes, Actor actor) {
        String normalizedNotes = normalize(notes, MAX_NOTES_LENGTH, "notes");
        Appointment appointment = loadForUpdate(appointmentId);
        appointment.setNotes(normalizedNotes);
        appointment.setUpdatedAt(clock.instant());
        Appointment saved = appointmentRepository.save(appointment);
        historyService.recordNotesUpdated(saved, actor);
        log.info("Notes of appointment {} updated by {}", appointmentId, actor.name());
        return saved;
    }

    private Appointment transition(Appointment appointment, AppointmentStatus newStatus, String reason, Actor actor) {
        AppointmentStatus oldStatus = appointment.getStatus();
        historyService.recordStatusChange(appointment, oldStatus, newStatus, reason, actor);
        appointment.setStatus(newStatus);
        appointment.setUpdatedAt(clock.instant());
        Appointment saved = appointmentRepository.save(appointment);
        log.info("Appointment {} moved from {} to {} by {}", appointment.getId(), oldStatus, newStatus, actor.name());
        return saved;
    }

    private Appointment loadForUpdate(Long appointmentId) {
        if (appointmentId == null) {
            throw new ValidationException("appointmentId", "Appointment ID is required");
        }
        return appointmentRepository.findByIdForUpdate(appointmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Appointment", appointmentId));
    }

    private void ensureActive(Appointment appointment, String operation) {
        if (appointment.getStatus().isTerminal()) {
            throw invalidTransition(appointment,
                    "Cannot " + operation + " an appointment that is " + appointment.getStatus());
        }
    }

    private AppointmentStateException invalidTransition(Appointment appointment, String message) {
        return new AppointmentStateException(message, AppointmentStateException.INVALID_TRANSITION,
                appointment.getId(), appointment.getStatus());
    }

    private String normalize(String value, int maxLength, String field) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() > maxLength) {
            throw new ValidationException(field, field + " must be at most " + maxLength + " characters");
        }
        return trimmed;
    }
}
