package com.counselbooking.scheduling.domain.service;

import com.counselbooking.common.exception.ResourceNotFoundException;
import com.counselbooking.common.exception.ValidationException;
import com.counselbooking.scheduling.config.BusinessRulesProperties;
import com.counselbooking.scheduling.config.SchedulingProperties;
import com.counselbooking.scheduling.domain.model.Appointment;
import com.counselbooking.scheduling.domain.model.Appointment.AppointmentStatus;
import com.counselbooking.scheduling.domain.model.AvailabilityResult;
import com.counselbooking.scheduling.domain.model.AvailabilityWindow;
import com.counselbooking.scheduling.domain.model.BlockedSlot;
import com.counselbooking.scheduling.domain.model.ServiceOffering;
import com.counselbooking.scheduling.domain.model.UnavailabilityReason;
import com.counselbooking.scheduling.domain.repository.AppointmentRepository;
import com.counselbooking.scheduling.domain.repository.AvailabilityWindowRepository;
import com.counselbooking.scheduling.domain.repository.BlockedSlotRepository;
import com.counselbooking.scheduling.domain.repository.ServiceOfferingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Point check of a single start instant for a service.
 *
 * Checks run in a fixed order and the first failing one is reported:
 * business hours, existing appointments, blocked periods, minimum notice, booking horizon.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityChecker {

    private final ServiceOfferingRepository serviceOfferingRepository;
    private final AvailabilityWindowRepository availabilityWindowRepository;
    private final AppointmentRepository appointmentRepository;
    private final BlockedSlotRepository blockedSlotRepository;
    private final BusinessRulesProperties rules;
    private final SchedulingProperties schedulingProperties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public AvailabilityResult isTimeSlotAvailable(Instant dateTime, Long serviceId) {
        return isTimeSlotAvailable(dateTime, serviceId, null);
    }

    /**
     * @param excludeAppointmentId appointment ignored by the conflict test, typically the one being rescheduled
     */
    @Transactional(readOnly = true)
    public AvailabilityResult isTimeSlotAvailable(Instant dateTime, Long serviceId, Long excludeAppointmentId) {
        if (dateTime == null) {
            throw new ValidationException("dateTime", "Date and time are required");
        }
        if (serviceId == null) {
            throw new ValidationException("serviceId", "Service ID is required");
        }

        ServiceOffering service = serviceOfferingRepository.findByIdAndActiveTrue(serviceId)
                .orElseThrow(() -> new ResourceNotFoundException("Service", serviceId));
        int durationMinutes = service.getDurationMinutes();
        Instant end = dateTime.plus(Duration.ofMinutes(durationMinutes));
        Duration buffer = rules.buffer();

        ZonedDateTime local = dateTime.atZone(schedulingProperties.getBusinessZone());
        List<AvailabilityWindow> windows = availabilityWindowRepository
                .findByDayOfWeekAndActiveTrueOrderByStartTimeAsc(OccupancyRules.dayOfWeekIndex(local.toLocalDate()));
        boolean withinHours = windows.stream()
                .anyMatch(w -> OccupancyRules.fitsWithin(local.toLocalTime(), durationMinutes, w));
        if (!withinHours) {
            return unavailable(dateTime, serviceId, UnavailabilityReason.OUTSIDE_BUSINESS_HOURS,
                    UnavailabilityReason.OUTSIDE_BUSINESS_HOURS.getMessage());
        }

        List<Long> conflictingIds = appointmentRepository.findInRangeWithStatuses(
                        dateTime.minus(OccupancyRules.MAX_STORED_DURATION).minus(buffer),
                        end.plus(buffer),
                        AppointmentStatus.ACTIVE)
                .stream()
                .filter(a -> !Objects.equals(a.getId(), excludeAppointmentId))
                .filter(a -> OccupancyRules.conflictsWithAppointment(dateTime, end, a, buffer))
                .map(Appointment::getId)
                .toList();
        if (!conflictingIds.isEmpty()) {
            log.debug("{} for service {} conflicts with appointments {}", dateTime, serviceId, conflictingIds);
            return AvailabilityResult.conflicting(UnavailabilityReason.APPOINTMENT_CONFLICT.getMessage(), conflictingIds);
        }

        List<BlockedSlot> blockedSlots = blockedSlotRepository.findStartingBetween(
                dateTime.minus(OccupancyRules.MAX_STORED_DURATION), end.plus(buffer));
        if (blockedSlots.stream().anyMatch(b -> OccupancyRules.conflictsWithBlocked(dateTime, end, b, buffer))) {
            return unavailable(dateTime, serviceId, UnavailabilityReason.BLOCKED,
                    UnavailabilityReason.BLOCKED.getMessage());
        }

        Instant now = clock.instant();
        if (dateTime.isBefore(now.plus(rules.minAdvance()))) {
            return unavailable(dateTime, serviceId, UnavailabilityReason.INSUFFICIENT_NOTICE,
                    UnavailabilityReason.INSUFFICIENT_NOTICE.formatMessage(rules.getMinAdvanceHours()));
        }
        if (dateTime.isAfter(now.plus(rules.maxAdvance()))) {
            return unavailable(dateTime, serviceId, UnavailabilityReason.BEYOND_BOOKING_WINDOW,
                    UnavailabilityReason.BEYOND_BOOKING_WINDOW.formatMessage(rules.getMaxAdvanceDays()));
        }

        return AvailabilityResult.ofAvailable();
    }

    private AvailabilityResult unavailable(Instant dateTime, Long serviceId, UnavailabilityReason code, String reason) {
        log.debug("{} for service {} unavailable: {}", dateTime, serviceId, code);
        return AvailabilityResult.unavailable(code, reason);
    }
}
