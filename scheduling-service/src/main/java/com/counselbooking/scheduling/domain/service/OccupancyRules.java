package com.counselbooking.scheduling.domain.service;

import com.counselbooking.scheduling.domain.model.Appointment;
import com.counselbooking.scheduling.domain.model.AvailabilityWindow;
import com.counselbooking.scheduling.domain.model.BlockedSlot;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Overlap predicates shared by the slot generator, the availability checker and the conflict detector.
 * All intervals are half-open.
 */
public final class OccupancyRules {

    private static final long SECONDS_PER_DAY = 24 * 60 * 60;

    /**
     * Longest service or blocked period the schema accepts ({@code duration_minutes BETWEEN 15 AND 480}).
     * Range queries look back this far so that earlier-starting occupancy is never missed,
     * whatever the configured duration limit.
     */
    public static final Duration MAX_STORED_DURATION = Duration.ofMinutes(480);

    private OccupancyRules() {
    }

    /**
     * Weekday index as stored on availability windows: 0 = Sunday ... 6 = Saturday.
     */
    public static int dayOfWeekIndex(LocalDate date) {
        return date.getDayOfWeek().getValue() % 7;
    }

    public static boolean overlaps(Instant startA, Instant endA, Instant startB, Instant endB) {
        return startA.isBefore(endB) && startB.isBefore(endA);
    }

    /**
     * Buffer applies on both sides of the existing appointment:
     * {@code start < otherEnd + buffer && otherStart - buffer < end}.
     */
    public static boolean conflictsWithAppointment(Instant start, Instant end, Appointment other, Duration buffer) {
        return overlaps(start, end, other.getDateTime().minus(buffer), other.getEndTime().plus(buffer));
    }

    /**
     * A session plus its trailing buffer must not touch a blocked period.
     */
    public static boolean conflictsWithBlocked(Instant start, Instant end, BlockedSlot blocked, Duration buffer) {
        return overlaps(start, end.plus(buffer), blocked.getDateTime(), blocked.getEndTime());
    }

    /**
     * Whether a session starting at local {@code startTime} fits entirely inside the window,
     * without running past midnight.
     */
    public static boolean fitsWithin(LocalTime startTime, int durationMinutes, AvailabilityWindow window) {
        long start = startTime.toSecondOfDay();
        long end = start + durationMinutes * 60L;
        return end <= SECONDS_PER_DAY
                && start >= window.getStartTime().toSecondOfDay()
                && end <= window.getEndTime().toSecondOfDay();
    }
}
