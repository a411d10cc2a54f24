package com.counselbooking.scheduling.domain.strategy;

import com.counselbooking.common.exception.ServiceUnavailableException;
import com.counselbooking.scheduling.domain.repository.ScheduleDayLockRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.function.Supplier;

/**
 * Booking lock using database-level SELECT FOR UPDATE on the {@code schedule_day_locks} row of the day.
 *
 * The row is created on first use. The lock lives as long as the surrounding transaction,
 * so the check and the write commit before the next caller sees the day.
 */
@Slf4j
@Component("pessimistic")
@RequiredArgsConstructor
public class PessimisticLockBookingStrategy implements BookingLockStrategy {

    private final ScheduleDayLockRepository scheduleDayLockRepository;
    private final TransactionTemplate transactionTemplate;

    @Override
    public <T> T executeLocked(LocalDate scheduleDay, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> {
                scheduleDayLockRepository.insertIfAbsent(scheduleDay);
                scheduleDayLockRepository.findByDayWithLock(scheduleDay)
                        .orElseThrow(() -> new IllegalStateException("Lock row missing for schedule day " + scheduleDay));
                log.debug("Acquired row lock for schedule day {}", scheduleDay);
                return work.get();
            });
        } catch (PessimisticLockingFailureException e) {
            log.warn("Timed out waiting for row lock on schedule day {}", scheduleDay, e);
            throw new ServiceUnavailableException(
                    "Schedule for " + scheduleDay + " is busy. Please try again.", e);
        }
    }

    @Override
    public String getStrategyType() {
        return "PESSIMISTIC_LOCK";
    }
}
