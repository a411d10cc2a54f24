package com.counselbooking.scheduling.workflow;

import com.counselbooking.common.exception.ConflictException;
import com.counselbooking.common.exception.ForbiddenException;
import com.counselbooking.common.exception.ResourceNotFoundException;
import com.counselbooking.common.exception.ValidationException;
import com.counselbooking.scheduling.domain.model.Actor;
import com.counselbooking.scheduling.domain.model.Appointment;
import com.counselbooking.scheduling.domain.model.Appointment.AppointmentStatus;
import com.counselbooking.scheduling.domain.model.RescheduleResult;
import com.counselbooking.scheduling.domain.repository.AppointmentRepository;
import com.counselbooking.scheduling.domain.service.AppointmentLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Self-service changes made by the client who owns the appointment.
 * Rescheduling goes through {@link RescheduleOrchestrator}, cancelling through
 * {@link AppointmentLifecycleService}; both are attributed to the client.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClientAppointmentService {

    static final String DEFAULT_RESCHEDULE_REASON = "Client requested reschedule";
    static final String DEFAULT_CANCEL_REASON = "Cancelled by user";

    private final AppointmentRepository appointmentRepository;
    private final RescheduleOrchestrator rescheduleOrchestrator;
    private final AppointmentLifecycleService lifecycleService;

    /**
     * Appointments of other users are reported as not found.
     */
    public RescheduleResult rescheduleOwnAppointment(Long appointmentId, Long userId, Instant newDateTime, String reason) {
        requireUser(userId);
        Appointment appointment = appointmentRepository.findWithServiceById(appointmentId)
                .filter(found -> userId.equals(found.getUserId()))
                .orElseThrow(() -> new ResourceNotFoundException("Appointment", appointmentId));

        if (newDateTime != null && appointmentRepository.existsByUserIdAndDateTimeAndStatusInAndIdNot(
                userId, newDateTime, AppointmentStatus.ACTIVE, appointment.getId())) {
            throw new ConflictException("You already have an appointment at this time", "DUPLICATE_APPOINTMENT");
        }

        log.info("User {} rescheduling appointment {} to {}", userId, appointmentId, newDateTime);
        return rescheduleOrchestrator.rescheduleAppointment(appointmentId, newDateTime,
                reason == null || reason.isBlank() ? DEFAULT_RESCHEDULE_REASON : reason, Actor.client(userId));
    }

    @Transactional
    public Appointment cancelOwnAppointment(Long appointmentId, Long userId, String reason) {
        requireUser(userId);
        Appointment appointment = appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Appointment", appointmentId));
        if (!userId.equals(appointment.getUserId())) {
            log.warn("User {} tried to cancel appointment {} owned by user {}",
                    userId, appointmentId, appointment.getUserId());
            throw new ForbiddenException("You can only cancel your own appointments");
        }

        return lifecycleService.cancel(appointmentId,
                reason == null || reason.isBlank() ? DEFAULT_CANCEL_REASON : reason, Actor.client(userId));
    }

    private void requireUser(Long userId) {
        if (userId == null) {
            throw new ValidationException("userId", "User ID is required");
        }
    }
}
