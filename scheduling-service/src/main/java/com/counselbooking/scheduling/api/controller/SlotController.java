package com.counselbooking.scheduling.api.controller;

import com.counselbooking.common.dto.BaseResponse;
import com.counselbooking.scheduling.domain.model.AvailabilityResult;
import com.counselbooking.scheduling.domain.model.TimeSlot;
import com.counselbooking.scheduling.domain.service.AvailabilityChecker;
import com.counselbooking.scheduling.domain.service.SlotGenerator;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Public slot picker endpoints.
 */
@RestController
@RequestMapping("/api/v1/slots")
@RequiredArgsConstructor
public class SlotController {

    private final SlotGenerator slotGenerator;
    private final AvailabilityChecker availabilityChecker;

    /**
     * All candidate start times of a day, each flagged available or not.
     * With {@code availableOnly=true} only bookable ones are returned.
     */
    @GetMapping
    public ResponseEntity<BaseResponse<List<TimeSlot>>> getSlots(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam Long serviceId,
            @RequestParam(defaultValue = "false") boolean availableOnly) {
        List<TimeSlot> slots = availableOnly
                ? slotGenerator.getAvailableSlots(date, serviceId)
                : slotGenerator.generateTimeSlots(date, serviceId);
        return ResponseEntity.ok(BaseResponse.success(slots));
    }

    @GetMapping("/check")
    public ResponseEntity<BaseResponse<AvailabilityResult>> checkSlot(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant dateTime,
            @RequestParam Long serviceId,
            @RequestParam(required = false) Long excludeAppointmentId) {
        return ResponseEntity.ok(BaseResponse.success(
                availabilityChecker.isTimeSlotAvailable(dateTime, serviceId, excludeAppointmentId)));
    }
}
