package com.counselbooking.scheduling.domain.repository;

import com.counselbooking.scheduling.domain.model.Appointment;
import com.counselbooking.scheduling.domain.model.Appointment.AppointmentStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Appointment entity.
 * Range queries fetch the service eagerly since every overlap test needs its duration.
 */
public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    @Query("""
           SELECT a FROM Appointment a JOIN FETCH a.service
           WHERE a.dateTime >= :from
             AND a.dateTime < :to
             AND a.status IN :statuses
           ORDER BY a.dateTime
           """)
    List<Appointment> findInRangeWithStatuses(@Param("from") Instant from,
                                              @Param("to") Instant to,
                                              @Param("statuses") Collection<AppointmentStatus> statuses);

    @Query("SELECT a FROM Appointment a JOIN FETCH a.service WHERE a.id = :id")
    Optional<Appointment> findWithServiceById(@Param("id") Long id);

    /**
     * Load an appointment with a row lock (SELECT FOR UPDATE) before mutating its status or time.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Appointment a JOIN FETCH a.service WHERE a.id = :id")
    Optional<Appointment> findByIdForUpdate(@Param("id") Long id);

    boolean existsByUserIdAndDateTimeAndStatusIn(Long userId, Instant dateTime, Collection<AppointmentStatus> statuses);

    boolean existsByUserIdAndDateTimeAndStatusInAndIdNot(Long userId, Instant dateTime,
                                                         Collection<AppointmentStatus> statuses, Long id);

    @Query("SELECT a FROM Appointment a JOIN FETCH a.service WHERE a.userId = :userId ORDER BY a.dateTime DESC")
    List<Appointment> findByUserIdWithService(@Param("userId") Long userId);
}
