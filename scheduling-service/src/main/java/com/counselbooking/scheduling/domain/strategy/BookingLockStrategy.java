package com.counselbooking.scheduling.domain.strategy;

import java.time.LocalDate;
import java.util.function.Supplier;

/**
 * Serializes check-then-write sequences (booking, rescheduling) that target the same business day.
 *
 * Implementations:
 * - PessimisticLockBookingStrategy: SELECT FOR UPDATE on a per-day row
 * - DistributedLockBookingStrategy: Redis/Redisson lock per day
 */
public interface BookingLockStrategy {

    /**
     * Runs {@code work} in a new or joined transaction while holding the lock for {@code scheduleDay}.
     * The lock is held until the transaction has completed.
     *
     * @throws com.counselbooking.common.exception.ServiceUnavailableException if the lock cannot be acquired in time
     */
    <T> T executeLocked(LocalDate scheduleDay, Supplier<T> work);

    /**
     * @return Strategy type (PESSIMISTIC_LOCK, DISTRIBUTED_LOCK)
     */
    String getStrategyType();
}
