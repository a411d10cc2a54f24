package com.counselbooking.scheduling.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    @Bean
    public Clock schedulingClock(SchedulingProperties properties) {
        return Clock.system(properties.getBusinessZone());
    }
}
