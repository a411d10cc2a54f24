package com.counselbooking.scheduling.domain.repository;

import com.counselbooking.scheduling.domain.model.AvailabilityWindow;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AvailabilityWindowRepository extends JpaRepository<AvailabilityWindow, Long> {

    /**
     * Active windows for one weekday (0 = Sunday), earliest first.
     */
    List<AvailabilityWindow> findByDayOfWeekAndActiveTrueOrderByStartTimeAsc(Integer dayOfWeek);

    List<AvailabilityWindow> findAllByOrderByDayOfWeekAscStartTimeAsc();
}
