package com.counselbooking.scheduling.domain.repository;

import com.counselbooking.scheduling.domain.model.ScheduleDayLock;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Optional;

public interface ScheduleDayLockRepository extends JpaRepository<ScheduleDayLock, LocalDate> {

    /**
     * Creates the lock row for a day if missing. Returns 1 when inserted, 0 when it already existed.
     */
    @Modifying
    @Query(value = "INSERT INTO schedule_day_locks (schedule_day) VALUES (:day) ON CONFLICT DO NOTHING",
            nativeQuery = true)
    int insertIfAbsent(@Param("day") LocalDate day);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM ScheduleDayLock l WHERE l.scheduleDay = :day")
    Optional<ScheduleDayLock> findByDayWithLock(@Param("day") LocalDate day);
}
