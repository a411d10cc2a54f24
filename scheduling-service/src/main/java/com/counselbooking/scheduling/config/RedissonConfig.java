package com.counselbooking.scheduling.config;

import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redis client for the distributed booking lock. Only created when that strategy is selected,
 * so the default deployment needs no Redis.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "scheduling.booking.lock-strategy", havingValue = "distributed")
public class RedissonConfig {

    @Value("${scheduling.booking.redis-address:redis://localhost:6379}")
    private String redisAddress;

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient() {
        Config config = new Config();
        config.useSingleServer()
                .setAddress(redisAddress)
                .setConnectionMinimumIdleSize(2);
        log.info("Connecting Redisson to {}", redisAddress);
        return Redisson.create(config);
    }
}
