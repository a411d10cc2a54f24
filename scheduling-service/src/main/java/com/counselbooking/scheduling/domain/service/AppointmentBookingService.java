package com.counselbooking.scheduling.domain.service;

import com.counselbooking.common.exception.ConflictException;
import com.counselbooking.common.exception.ResourceNotFoundException;
import com.counselbooking.common.exception.ValidationException;
import com.counselbooking.scheduling.config.SchedulingProperties;
import com.counselbooking.scheduling.domain.model.Actor;
import com.counselbooking.scheduling.domain.model.Appointment;
import com.counselbooking.scheduling.domain.model.Appointment.AppointmentStatus;
import com.counselbooking.scheduling.domain.model.AvailabilityResult;
import com.counselbooking.scheduling.domain.model.ServiceOffering;
import com.counselbooking.scheduling.domain.model.UnavailabilityReason;
import com.counselbooking.scheduling.domain.repository.AppointmentRepository;
import com.counselbooking.scheduling.domain.repository.ServiceOfferingRepository;
import com.counselbooking.scheduling.exception.SlotUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Client-side booking of new appointments.
 * The availability check and the insert run under the booking lock of the appointment's day.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppointmentBookingService {

    static final int MAX_NOTES_LENGTH = 500;

    private final AppointmentRepository appointmentRepository;
    private final ServiceOfferingRepository serviceOfferingRepository;
    private final AvailabilityChecker availabilityChecker;
    private final AppointmentHistoryService historyService;
    private final BookingLockService bookingLockService;
    private final SchedulingProperties schedulingProperties;
    private final Clock clock;

    public Appointment bookAppointment(Long userId, Long serviceId, Instant dateTime, String notes) {
        if (userId == null) {
            throw new ValidationException("userId", "User ID is required");
        }
        if (serviceId == null) {
            throw new ValidationException("serviceId", "Service ID is required");
        }
        if (dateTime == null) {
            throw new ValidationException("dateTime", "Date and time are required");
        }
        String normalizedNotes = normalizeNotes(notes);

        log.info("Booking service {} at {} for user {}", serviceId, dateTime, userId);
        LocalDate day = dateTime.atZone(schedulingProperties.getBusinessZone()).toLocalDate();
        return bookingLockService.executeLocked(day,
                () -> performBooking(userId, serviceId, dateTime, normalizedNotes));
    }

    private Appointment performBooking(Long userId, Long serviceId, Instant dateTime, String notes) {
        ServiceOffering service = serviceOfferingRepository.findByIdAndActiveTrue(serviceId)
                .orElseThrow(() -> new ResourceNotFoundException("Service not found or inactive"));

        AvailabilityResult availability = availabilityChecker.isTimeSlotAvailable(dateTime, serviceId, null);
        if (!availability.available()) {
            log.info("Booking of service {} at {} for user {} rejected: {}",
                    serviceId, dateTime, userId, availability.reasonCode());
            throw new SlotUnavailableException(availability.reasonCode(), availability.reason(),
                    availability.conflictingAppointmentIds());
        }

        if (appointmentRepository.existsByUserIdAndDateTimeAndStatusIn(userId, dateTime, AppointmentStatus.ACTIVE)) {
            throw new ConflictException("You already have an appointment at this time", "DUPLICATE_APPOINTMENT");
        }

        Instant now = clock.instant();
        Appointment appointment = Appointment.builder()
                .userId(userId)
                .service(service)
                .dateTime(dateTime)
                .status(AppointmentStatus.PENDING)
                .notes(notes)
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            appointment = appointmentRepository.saveAndFlush(appointment);
        } catch (DataIntegrityViolationException e) {
            throw new SlotUnavailableException(UnavailabilityReason.APPOINTMENT_CONFLICT,
                    "Time slot was just taken by another appointment", e);
        }
        historyService.recordCreated(appointment, Actor.client(userId));

        log.info("Appointment {} booked for user {} at {}", appointment.getId(), userId, dateTime);
        return appointment;
    }

    @Transactional(readOnly = true)
    public Appointment getAppointment(Long id) {
        return appointmentRepository.findWithServiceById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Appointment", id));
    }

    @Transactional(readOnly = true)
    public List<Appointment> getAppointmentsForUser(Long userId) {
        return appointmentRepository.findByUserIdWithService(userId);
    }

    private String normalizeNotes(String notes) {
        if (notes == null || notes.isBlank()) {
            return null;
        }
        String trimmed = notes.trim();
        if (trimmed.length() > MAX_NOTES_LENGTH) {
            throw new ValidationException("notes", "Notes must be at most " + MAX_NOTES_LENGTH + " characters");
        }
        return trimmed;
    }
}
