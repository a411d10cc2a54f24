package com.counselbooking.scheduling.domain.service;

import com.counselbooking.common.exception.ResourceNotFoundException;
import com.counselbooking.common.exception.ValidationException;
import com.counselbooking.scheduling.config.BusinessRulesProperties;
import com.counselbooking.scheduling.config.SchedulingProperties;
import com.counselbooking.scheduling.domain.model.Appointment;
import com.counselbooking.scheduling.domain.model.Appointment.AppointmentStatus;
import com.counselbooking.scheduling.domain.model.AvailabilityWindow;
import com.counselbooking.scheduling.domain.model.BlockedSlot;
import com.counselbooking.scheduling.domain.model.ServiceOffering;
import com.counselbooking.scheduling.domain.model.TimeSlot;
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
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Enumerates bookable start times for one business day and one service.
 *
 * Candidates are laid out every {@code slot-interval-minutes} from the start of each active
 * window of that weekday, as long as the whole session fits before the window closes.
 * Candidates past the booking horizon are dropped. Each remaining candidate is then
 * marked unavailable for, in order: insufficient notice, a blocked period, a booked appointment.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlotGenerator {

    private final ServiceOfferingRepository serviceOfferingRepository;
    private final AvailabilityWindowRepository availabilityWindowRepository;
    private final AppointmentRepository appointmentRepository;
    private final BlockedSlotRepository blockedSlotRepository;
    private final BusinessRulesProperties rules;
    private final SchedulingProperties schedulingProperties;
    private final DisplayTimeFormatter displayTimeFormatter;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<TimeSlot> generateTimeSlots(LocalDate date, Long serviceId) {
        return generateTimeSlots(date, serviceId, null);
    }

    /**
     * Same as {@link #generateTimeSlots(LocalDate, Long)} but ignores one appointment,
     * so that an appointment being moved does not block its own alternatives.
     */
    @Transactional(readOnly = true)
    public List<TimeSlot> generateTimeSlots(LocalDate date, Long serviceId, Long excludeAppointmentId) {
        if (date == null) {
            throw new ValidationException("date", "Date is required");
        }
        if (serviceId == null) {
            throw new ValidationException("serviceId", "Service ID is required");
        }
        ZoneId zone = schedulingProperties.getBusinessZone();
        if (date.isBefore(LocalDate.now(clock.withZone(zone)))) {
            throw new ValidationException("date", "Date cannot be in the past");
        }

        ServiceOffering service = serviceOfferingRepository.findByIdAndActiveTrue(serviceId)
                .orElseThrow(() -> new ResourceNotFoundException("Service", serviceId));

        List<AvailabilityWindow> windows = availabilityWindowRepository
                .findByDayOfWeekAndActiveTrueOrderByStartTimeAsc(OccupancyRules.dayOfWeekIndex(date));
        if (windows.isEmpty()) {
            log.debug("No availability windows on {} ({})", date, date.getDayOfWeek());
            return List.of();
        }

        Duration duration = Duration.ofMinutes(service.getDurationMinutes());
        Duration buffer = rules.buffer();
        Instant dayStart = date.atStartOfDay(zone).toInstant();
        Instant dayEnd = date.plusDays(1).atStartOfDay(zone).toInstant();

        List<Appointment> appointments = appointmentRepository.findInRangeWithStatuses(
                        dayStart.minus(OccupancyRules.MAX_STORED_DURATION).minus(buffer),
                        dayEnd.plus(buffer),
                        AppointmentStatus.ACTIVE)
                .stream()
                .filter(a -> !Objects.equals(a.getId(), excludeAppointmentId))
                .toList();
        List<BlockedSlot> blockedSlots = blockedSlotRepository.findStartingBetween(
                dayStart.minus(OccupancyRules.MAX_STORED_DURATION), dayEnd.plus(buffer));

        Instant now = clock.instant();
        Instant earliestStart = now.plus(rules.minAdvance());
        Instant latestStart = now.plus(rules.maxAdvance());

        // keyed by instant: overlapping windows collapse and the result comes out sorted
        Map<Instant, TimeSlot> slots = new TreeMap<>();
        int durationMinutes = service.getDurationMinutes();
        for (AvailabilityWindow window : windows) {
            for (int minute = window.startMinuteOfDay();
                 minute + durationMinutes <= window.endMinuteOfDay();
                 minute += rules.getSlotIntervalMinutes()) {

                LocalTime startTime = LocalTime.of(minute / 60, minute % 60);
                ZonedDateTime zoned = date.atTime(startTime).atZone(zone);
                // wall-clock time skipped by a DST gap: the zone shifts it outside the window
                if (!zoned.toLocalTime().equals(startTime)) {
                    continue;
                }
                Instant candidate = zoned.toInstant();
                if (candidate.isAfter(latestStart) || slots.containsKey(candidate)) {
                    continue;
                }
                slots.put(candidate, evaluate(candidate, candidate.plus(duration), earliestStart,
                        appointments, blockedSlots, buffer));
            }
        }

        List<TimeSlot> result = new ArrayList<>(slots.values());
        log.debug("Generated {} slots ({} available) for service {} on {}",
                result.size(), result.stream().filter(TimeSlot::available).count(), serviceId, date);
        return result;
    }

    @Transactional(readOnly = true)
    public List<TimeSlot> getAvailableSlots(LocalDate date, Long serviceId) {
        return generateTimeSlots(date, serviceId).stream()
                .filter(TimeSlot::available)
                .toList();
    }

    private TimeSlot evaluate(Instant start,
                              Instant end,
                              Instant earliestStart,
                              List<Appointment> appointments,
                              List<BlockedSlot> blockedSlots,
                              Duration buffer) {
        String displayTime = displayTimeFormatter.formatTime(start);

        if (start.isBefore(earliestStart)) {
            return TimeSlot.unavailable(start, UnavailabilityReason.INSUFFICIENT_NOTICE, displayTime);
        }
        boolean blocked = blockedSlots.stream()
                .anyMatch(b -> OccupancyRules.conflictsWithBlocked(start, end, b, buffer));
        if (blocked) {
            return TimeSlot.unavailable(start, UnavailabilityReason.BLOCKED, displayTime);
        }
        boolean booked = appointments.stream()
                .anyMatch(a -> OccupancyRules.conflictsWithAppointment(start, end, a, buffer));
        if (booked) {
            return TimeSlot.unavailable(start, UnavailabilityReason.APPOINTMENT_CONFLICT, displayTime);
        }
        return TimeSlot.available(start, displayTime);
    }
}
