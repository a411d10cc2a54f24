package com.counselbooking.scheduling.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;
import java.util.Locale;

/**
 * Calendar settings bound from {@code scheduling.*}.
 * All wall-clock reasoning (day of week, window times, display) happens in {@link #businessZone}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "scheduling")
public class SchedulingProperties {

    private ZoneId businessZone = ZoneId.of("America/New_York");

    private Locale displayLocale = Locale.US;

    private Conflicts conflicts = new Conflicts();

    @Getter
    @Setter
    public static class Conflicts {
        /** Extra days searched for alternatives when the requested day has none. */
        private int lookaheadDays = 1;
        private int maxSuggestions = 6;
    }
}
