package com.counselbooking.scheduling.domain.service;

import com.counselbooking.common.exception.ResourceNotFoundException;
import com.counselbooking.scheduling.domain.model.Actor;
import com.counselbooking.scheduling.domain.model.Appointment;
import com.counselbooking.scheduling.domain.model.Appointment.AppointmentStatus;
import com.counselbooking.scheduling.domain.model.AppointmentHistory;
import com.counselbooking.scheduling.domain.model.AppointmentHistory.HistoryAction;
import com.counselbooking.scheduling.domain.repository.AppointmentHistoryRepository;
import com.counselbooking.scheduling.domain.repository.AppointmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Append-only audit trail of appointment transitions.
 *
 * Writers require an active transaction so the history row commits or rolls back
 * together with the appointment change it describes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppointmentHistoryService {

    private final AppointmentHistoryRepository historyRepository;
    private final AppointmentRepository appointmentRepository;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public AppointmentHistory recordCreated(Appointment appointment, Actor actor) {
        return append(AppointmentHistory.builder()
                .appointmentId(appointment.getId())
                .action(HistoryAction.CREATED)
                .newDateTime(appointment.getDateTime())
                .newStatus(appointment.getStatus()), actor);
    }

    /**
     * Records a move of {@code appointment} from {@code oldDateTime} to {@code newDateTime}.
     * Status columns are filled only when the move also resets the status.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AppointmentHistory recordReschedule(Appointment appointment,
                                               Instant oldDateTime,
                                               Instant newDateTime,
                                               AppointmentStatus newStatus,
                                               String reason,
                                               Actor actor) {
        AppointmentHistory.AppointmentHistoryBuilder builder = AppointmentHistory.builder()
                .appointmentId(appointment.getId())
                .action(HistoryAction.RESCHEDULED)
                .oldDateTime(oldDateTime)
                .newDateTime(newDateTime)
                .reason(reason);
        if (appointment.getStatus() != newStatus) {
            builder.oldStatus(appointment.getStatus()).newStatus(newStatus);
        }
        return append(builder, actor);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public AppointmentHistory recordStatusChange(Appointment appointment,
                                                 AppointmentStatus oldStatus,
                                                 AppointmentStatus newStatus,
                                                 String reason,
                                                 Actor actor) {
        return append(AppointmentHistory.builder()
                .appointmentId(appointment.getId())
                .action(actionFor(newStatus))
                .oldStatus(oldStatus)
                .newStatus(newStatus)
                .reason(reason), actor);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public AppointmentHistory recordNotesUpdated(Appointment appointment, Actor actor) {
        return append(AppointmentHistory.builder()
                .appointmentId(appointment.getId())
                .action(HistoryAction.NOTES_UPDATED), actor);
    }

    /**
     * History of one appointment, newest first.
     */
    @Transactional(readOnly = true)
    public List<AppointmentHistory> getHistory(Long appointmentId) {
        if (!appointmentRepository.existsById(appointmentId)) {
            throw new ResourceNotFoundException("Appointment", appointmentId);
        }
        return historyRepository.findByAppointmentIdOrderByCreatedAtDescIdDesc(appointmentId);
    }

    private AppointmentHistory append(AppointmentHistory.AppointmentHistoryBuilder builder, Actor actor) {
        AppointmentHistory saved = historyRepository.save(builder
                .actorId(actor.id())
                .actorName(actor.name())
                .createdAt(clock.instant())
                .build());
        log.debug("Appended {} history entry for appointment {}", saved.getAction(), saved.getAppointmentId());
        return saved;
    }

    static HistoryAction actionFor(AppointmentStatus newStatus) {
        switch (newStatus) {
            case CANCELLED:
                return HistoryAction.CANCELLED;
            case COMPLETED:
                return HistoryAction.COMPLETED;
            case NO_SHOW:
                return HistoryAction.NO_SHOW;
            default:
                return HistoryAction.STATUS_CHANGED;
        }
    }
}
