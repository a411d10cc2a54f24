package com.counselbooking.scheduling.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * A booked session. Cancellation is a status change; rows are never deleted.
 */
@Entity
@Table(name = "appointments", indexes = {
        @Index(name = "idx_appointments_date_time", columnList = "date_time"),
        @Index(name = "idx_appointments_user_id", columnList = "user_id"),
        @Index(name = "idx_appointments_status", columnList = "status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Appointment {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "service_id", nullable = false)
    private ServiceOffering service;

    @Column(name = "date_time", nullable = false)
    private Instant dateTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private AppointmentStatus status;

    @Column(name = "notes", length = 500)
    private String notes;

    @Column(name = "cancellation_reason", length = 200)
    private String cancellationReason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * Services stamp {@code createdAt}/{@code updatedAt} from the scheduling clock; this only fills gaps.
     */
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        if (status == null) {
            status = AppointmentStatus.PENDING;
        }
    }

    /**
     * End of the session itself, without buffer.
     */
    public Instant getEndTime() {
        return dateTime.plus(Duration.ofMinutes(service.getDurationMinutes()));
    }

    public enum AppointmentStatus {
        PENDING,
        CONFIRMED,
        CANCELLED,
        COMPLETED,
        NO_SHOW;

        /** Statuses whose interval blocks the calendar. */
        public static final Set<AppointmentStatus> ACTIVE = EnumSet.of(PENDING, CONFIRMED);

        public boolean isActive() {
            return ACTIVE.contains(this);
        }

        public boolean isTerminal() {
            return !isActive();
        }
    }
}
