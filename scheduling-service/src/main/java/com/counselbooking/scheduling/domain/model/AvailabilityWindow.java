package com.counselbooking.scheduling.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalTime;

/**
 * Recurring weekly opening hours. Several windows per day are allowed (split morning/afternoon).
 */
@Entity
@Table(name = "availability_windows", indexes = {
        @Index(name = "idx_availability_windows_day", columnList = "day_of_week,active")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AvailabilityWindow {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Day of week: 0 = Sunday ... 6 = Saturday.
     */
    @Column(name = "day_of_week", nullable = false)
    private Integer dayOfWeek;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    public int startMinuteOfDay() {
        return startTime.getHour() * 60 + startTime.getMinute();
    }

    public int endMinuteOfDay() {
        return endTime.getHour() * 60 + endTime.getMinute();
    }
}
