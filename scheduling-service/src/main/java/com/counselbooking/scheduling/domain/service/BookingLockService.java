package com.counselbooking.scheduling.domain.service;

import com.counselbooking.scheduling.domain.strategy.BookingLockStrategy;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Picks the booking lock strategy named by {@code scheduling.booking.lock-strategy}.
 *
 * Strategies are Spring beans keyed by bean name:
 * - pessimistic: SELECT FOR UPDATE on a per-day row (default)
 * - distributed: Redis/Redisson lock
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingLockService {

    private static final String DEFAULT_STRATEGY = "pessimistic";

    private final Map<String, BookingLockStrategy> lockStrategies;

    @Value("${scheduling.booking.lock-strategy:pessimistic}")
    private String strategyType;

    @PostConstruct
    public void init() {
        log.info("Initialized BookingLockService with strategy: {}", getLockStrategy().getStrategyType());
    }

    public <T> T executeLocked(LocalDate scheduleDay, Supplier<T> work) {
        return getLockStrategy().executeLocked(scheduleDay, work);
    }

    /**
     * Falls back to the pessimistic strategy when the configured one is unknown.
     */
    BookingLockStrategy getLockStrategy() {
        BookingLockStrategy strategy = lockStrategies.get(strategyType.toLowerCase());
        if (strategy == null) {
            log.warn("Unknown lock strategy: {}. Available strategies: {}. Defaulting to {}",
                    strategyType, lockStrategies.keySet(), DEFAULT_STRATEGY);
            strategy = lockStrategies.get(DEFAULT_STRATEGY);
            if (strategy == null) {
                throw new IllegalStateException(
                        DEFAULT_STRATEGY + " strategy not found. Available strategies: " + lockStrategies.keySet());
            }
        }
        return strategy;
    }
}
