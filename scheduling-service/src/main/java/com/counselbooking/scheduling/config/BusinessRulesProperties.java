package com.counselbooking.scheduling.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Booking rules of the practice, bound from {@code scheduling.rules.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "scheduling.rules")
public class BusinessRulesProperties {

    private int minAdvanceHours = 24;
    private int maxAdvanceDays = 30;
    private int bufferMinutes = 15;
    private int minDurationMinutes = 15;
    private int maxDurationMinutes = 480;
    private int slotIntervalMinutes = 15;

    public Duration minAdvance() {
        return Duration.ofHours(minAdvanceHours);
    }

    public Duration maxAdvance() {
        return Duration.ofDays(maxAdvanceDays);
    }

    public Duration buffer() {
        return Duration.ofMinutes(bufferMinutes);
    }

    public Duration maxDuration() {
        return Duration.ofMinutes(maxDurationMinutes);
    }

    public boolean isDurationInRange(int durationMinutes) {
        return durationMinutes >= minDurationMinutes && durationMinutes <= maxDurationMinutes;
    }
}
