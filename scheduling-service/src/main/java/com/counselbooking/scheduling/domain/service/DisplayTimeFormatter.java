package com.counselbooking.scheduling.domain.service;

import com.counselbooking.scheduling.config.SchedulingProperties;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Renders instants as wall-clock labels in the business zone, e.g. "9:00 AM" or "Tomorrow 9:00 AM".
 */
@Component
public class DisplayTimeFormatter {

    private final SchedulingProperties properties;
    private final DateTimeFormatter timeFormatter;
    private final DateTimeFormatter dayFormatter;

    public DisplayTimeFormatter(SchedulingProperties properties) {
        this.properties = properties;
        this.timeFormatter = DateTimeFormatter.ofPattern("h:mm a", properties.getDisplayLocale());
        this.dayFormatter = DateTimeFormatter.ofPattern("EEE, MMM d", properties.getDisplayLocale());
    }

    public String formatTime(Instant instant) {
        return timeFormatter.format(instant.atZone(properties.getBusinessZone()));
    }

    /**
     * Time label relative to {@code referenceDay}: bare time on the same day,
     * "Tomorrow" on the next one, weekday and date beyond that.
     */
    public String formatRelative(Instant instant, LocalDate referenceDay) {
        LocalDate day = instant.atZone(properties.getBusinessZone()).toLocalDate();
        String time = formatTime(instant);
        if (day.equals(referenceDay)) {
            return time;
        }
        if (day.equals(referenceDay.plusDays(1))) {
            return "Tomorrow " + time;
        }
        return dayFormatter.format(day) + " " + time;
    }
}
