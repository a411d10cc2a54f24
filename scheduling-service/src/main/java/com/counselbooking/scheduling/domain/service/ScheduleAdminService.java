package com.counselbooking.scheduling.domain.service;

import com.counselbooking.common.exception.ResourceNotFoundException;
import com.counselbooking.common.exception.ValidationException;
import com.counselbooking.scheduling.config.BusinessRulesProperties;
import com.counselbooking.scheduling.domain.model.AvailabilityWindow;
import com.counselbooking.scheduling.domain.model.BlockedSlot;
import com.counselbooking.scheduling.domain.repository.AvailabilityWindowRepository;
import com.counselbooking.scheduling.domain.repository.BlockedSlotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;

/**
 * Maintenance of weekly opening hours and one-off blocked periods.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleAdminService {

    static final int MAX_REASON_LENGTH = 200;

    private final AvailabilityWindowRepository availabilityWindowRepository;
    private final BlockedSlotRepository blockedSlotRepository;
    private final BusinessRulesProperties rules;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<AvailabilityWindow> listWindows() {
        return availabilityWindowRepository.findAllByOrderByDayOfWeekAscStartTimeAsc();
    }

    @Transactional
    public AvailabilityWindow createWindow(Integer dayOfWeek, LocalTime startTime, LocalTime endTime, Boolean active) {
        validateWindow(dayOfWeek, startTime, endTime);
        Instant now = clock.instant();
        AvailabilityWindow window = AvailabilityWindow.builder()
                .dayOfWeek(dayOfWeek)
                .startTime(startTime)
                .endTime(endTime)
                .active(active == null || active)
                .createdAt(now)
                .updatedAt(now)
                .build();
        window = availabilityWindowRepository.save(window);
        log.info("Created availability window {} (day {} {}-{})", window.getId(), dayOfWeek, startTime, endTime);
        return window;
    }

    @Transactional
    public AvailabilityWindow updateWindow(Long id, Integer dayOfWeek, LocalTime startTime, LocalTime endTime, Boolean active) {
        validateWindow(dayOfWeek, startTime, endTime);
        AvailabilityWindow window = availabilityWindowRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("AvailabilityWindow", id));
        window.setDayOfWeek(dayOfWeek);
        window.setStartTime(startTime);
        window.setEndTime(endTime);
        if (active != null) {
            window.setActive(active);
        }
        window.setUpdatedAt(clock.instant());
        log.info("Updated availability window {} (day {} {}-{}, active={})",
                id, dayOfWeek, startTime, endTime, window.isActive());
        return availabilityWindowRepository.save(window);
    }

    /**
     * Windows are deactivated rather than deleted.
     */
    @Transactional
    public AvailabilityWindow deactivateWindow(Long id) {
        AvailabilityWindow window = availabilityWindowRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("AvailabilityWindow", id));
        window.setActive(false);
        window.setUpdatedAt(clock.instant());
        log.info("Deactivated availability window {}", id);
        return availabilityWindowRepository.save(window);
    }

    @Transactional(readOnly = true)
    public List<BlockedSlot> listBlockedSlots(Instant from) {
        return blockedSlotRepository.findByDateTimeGreaterThanEqualOrderByDateTimeAsc(from == null ? Instant.EPOCH : from);
    }

    @Transactional
    public BlockedSlot createBlockedSlot(Instant dateTime, Integer durationMinutes, String reason) {
        if (dateTime == null) {
            throw new ValidationException("dateTime", "Date and time are required");
        }
        if (durationMinutes == null || !rules.isDurationInRange(durationMinutes)) {
            throw new ValidationException("duration", String.format("Duration must be between %d and %d minutes",
                    rules.getMinDurationMinutes(), rules.getMaxDurationMinutes()));
        }
        if (reason != null && reason.length() > MAX_REASON_LENGTH) {
            throw new ValidationException("reason", "Reason must be at most " + MAX_REASON_LENGTH + " characters");
        }
        BlockedSlot blockedSlot = blockedSlotRepository.save(BlockedSlot.builder()
                .dateTime(dateTime)
                .durationMinutes(durationMinutes)
                .reason(reason == null || reason.isBlank() ? null : reason.trim())
                .createdAt(clock.instant())
                .build());
        log.info("Blocked {} for {} minutes (id {})", dateTime, durationMinutes, blockedSlot.getId());
        return blockedSlot;
    }

    @Transactional
    public void deleteBlockedSlot(Long id) {
        BlockedSlot blockedSlot = blockedSlotRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("BlockedSlot", id));
        blockedSlotRepository.delete(blockedSlot);
        log.info("Removed blocked slot {} at {}", id, blockedSlot.getDateTime());
    }

    private void validateWindow(Integer dayOfWeek, LocalTime startTime, LocalTime endTime) {
        if (dayOfWeek == null || dayOfWeek < 0 || dayOfWeek > 6) {
            throw new ValidationException("dayOfWeek", "Day of week must be between 0 (Sunday) and 6 (Saturday)");
        }
        if (startTime == null) {
            throw new ValidationException("startTime", "Start time is required");
        }
        if (endTime == null) {
            throw new ValidationException("endTime", "End time is required");
        }
        if (!endTime.isAfter(startTime)) {
            throw new ValidationException("endTime", "End time must be after start time");
        }
    }
}
