package com.counselbooking.scheduling.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Audit entry for one appointment transition. Rows are inserted once and never changed.
 */
@Entity
@Immutable
@Table(name = "appointment_history", indexes = {
        @Index(name = "idx_appointment_history_appointment", columnList = "appointment_id,created_at")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentHistory {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "appointment_id", nullable = false, updatable = false)
    private Long appointmentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 20, updatable = false)
    private HistoryAction action;

    @Column(name = "old_date_time", updatable = false)
    private Instant oldDateTime;

    @Column(name = "new_date_time", updatable = false)
    private Instant newDateTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "old_status", length = 20, updatable = false)
    private Appointment.AppointmentStatus oldStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status", length = 20, updatable = false)
    private Appointment.AppointmentStatus newStatus;

    @Column(name = "reason", length = 200, updatable = false)
    private String reason;

    @Column(name = "actor_id", length = 64, updatable = false)
    private String actorId;

    @Column(name = "actor_name", nullable = false, length = 120, updatable = false)
    private String actorName;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public enum HistoryAction {
        CREATED,
        UPDATED,
        RESCHEDULED,
        CANCELLED,
        COMPLETED,
        NO_SHOW,
        STATUS_CHANGED,
        NOTES_UPDATED
    }
}
