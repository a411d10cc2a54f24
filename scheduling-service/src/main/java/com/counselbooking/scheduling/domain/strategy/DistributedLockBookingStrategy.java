package com.counselbooking.scheduling.domain.strategy;

import com.counselbooking.common.exception.ServiceUnavailableException;
import com.counselbooking.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Booking lock using a Redis/Redisson lock per business day, for deployments
 * running several instances against the same database.
 *
 * The transaction is opened inside the lock and committed before the lock is released.
 */
@Slf4j
@Component("distributed")
@ConditionalOnProperty(name = "scheduling.booking.lock-strategy", havingValue = "distributed")
@RequiredArgsConstructor
public class DistributedLockBookingStrategy implements BookingLockStrategy {

    private final RedissonClient redissonClient;
    private final TransactionTemplate transactionTemplate;

    @Value("${scheduling.booking.lock-wait-seconds:5}")
    private long lockWaitSeconds;

    @Value("${scheduling.booking.lock-lease-seconds:30}")
    private long lockLeaseSeconds;

    @Override
    public <T> T executeLocked(LocalDate scheduleDay, Supplier<T> work) {
        String lockKey = buildLockKey(scheduleDay);
        RLock lock = redissonClient.getLock(lockKey);

        try {
            boolean acquired = lock.tryLock(lockWaitSeconds, lockLeaseSeconds, TimeUnit.SECONDS);
            if (!acquired) {
                log.warn("Could not acquire distributed lock {} within {}s", lockKey, lockWaitSeconds);
                throw new ServiceUnavailableException(
                        "Schedule for " + scheduleDay + " is busy. Please try again.");
            }

            log.debug("Acquired distributed lock: {}", lockKey);
            return transactionTemplate.execute(status -> work.get());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException("Interrupted while waiting for booking lock", e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Released distributed lock: {}", lockKey);
            }
        }
    }

    @Override
    public String getStrategyType() {
        return "DISTRIBUTED_LOCK";
    }

    private String buildLockKey(LocalDate scheduleDay) {
        return Constants.LOCK_PREFIX + scheduleDay;
    }
}
