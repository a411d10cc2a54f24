package com.counselbooking.scheduling.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * One row per business day, locked with SELECT FOR UPDATE to serialize
 * check-then-write sequences that target that day.
 */
@Entity
@Table(name = "schedule_day_locks")
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleDayLock {
    @Id
    @Column(name = "schedule_day", nullable = false)
    private LocalDate scheduleDay;
}
