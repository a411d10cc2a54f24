package com.counselbooking.scheduling;

import com.counselbooking.scheduling.config.BusinessRulesProperties;
import com.counselbooking.scheduling.config.SchedulingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(scanBasePackages = {"com.counselbooking.scheduling", "com.counselbooking.common"})
@EnableConfigurationProperties({BusinessRulesProperties.class, SchedulingProperties.class})
public class SchedulingServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SchedulingServiceApplication.class, args);
    }
}
