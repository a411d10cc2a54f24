package com.counselbooking.scheduling.domain.repository;

import com.counselbooking.scheduling.domain.model.AppointmentHistory;
import org.springframework.data.repository.Repository;

import java.util.List;

/**
 * Append-only access to the appointment audit log. No update or delete methods are exposed.
 */
public interface AppointmentHistoryRepository extends Repository<AppointmentHistory, Long> {

    AppointmentHistory save(AppointmentHistory history);

    List<AppointmentHistory> findByAppointmentIdOrderByCreatedAtDescIdDesc(Long appointmentId);

    long countByAppointmentId(Long appointmentId);
}
