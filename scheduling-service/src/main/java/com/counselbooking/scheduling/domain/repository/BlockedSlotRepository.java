package com.counselbooking.scheduling.domain.repository;

import com.counselbooking.scheduling.domain.model.BlockedSlot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface BlockedSlotRepository extends JpaRepository<BlockedSlot, Long> {

    /**
     * Blocked periods whose start falls in [from, to).
     * Callers widen {@code from} by the longest block duration to catch periods that started earlier.
     */
    @Query("SELECT b FROM BlockedSlot b WHERE b.dateTime >= :from AND b.dateTime < :to ORDER BY b.dateTime")
    List<BlockedSlot> findStartingBetween(@Param("from") Instant from, @Param("to") Instant to);

    List<BlockedSlot> findByDateTimeGreaterThanEqualOrderByDateTimeAsc(Instant from);
}
