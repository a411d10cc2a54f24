package com.counselbooking.scheduling.api.controller;

import com.counselbooking.common.dto.BaseResponse;
import com.counselbooking.scheduling.api.dto.AppointmentResponse;
import com.counselbooking.scheduling.api.dto.BookAppointmentRequest;
import com.counselbooking.scheduling.api.dto.ClientRescheduleRequest;
import com.counselbooking.scheduling.api.dto.RescheduleResponse;
import com.counselbooking.scheduling.domain.model.Appointment;
import com.counselbooking.scheduling.domain.service.AppointmentBookingService;
import com.counselbooking.scheduling.workflow.ClientAppointmentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Client booking endpoints. Callers are authenticated upstream.
 */
@RestController
@RequestMapping("/api/v1/appointments")
@RequiredArgsConstructor
public class AppointmentController {

    private final AppointmentBookingService bookingService;
    private final ClientAppointmentService clientAppointmentService;

    @PostMapping
    public ResponseEntity<BaseResponse<AppointmentResponse>> bookAppointment(
            @Valid @RequestBody BookAppointmentRequest request) {
        Appointment appointment = bookingService.bookAppointment(
                request.userId(), request.serviceId(), request.dateTime(), request.notes());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Appointment booked successfully", AppointmentResponse.from(appointment)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<AppointmentResponse>> getAppointment(@PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(AppointmentResponse.from(bookingService.getAppointment(id))));
    }

    @GetMapping("/user/{userId}")
    public ResponseEntity<BaseResponse<List<AppointmentResponse>>> getAppointmentsForUser(@PathVariable Long userId) {
        List<AppointmentResponse> appointments = bookingService.getAppointmentsForUser(userId).stream()
                .map(AppointmentResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(BaseResponse.success(appointments));
    }

    @PutMapping("/{id}/reschedule")
    public ResponseEntity<BaseResponse<RescheduleResponse>> rescheduleAppointment(
            @PathVariable Long id,
            @Valid @RequestBody ClientRescheduleRequest request) {
        RescheduleResponse response = RescheduleResponse.from(clientAppointmentService.rescheduleOwnAppointment(
                id, request.userId(), request.newDateTime(), request.reason()));
        return ResponseEntity.ok(BaseResponse.success("Appointment rescheduled successfully", response));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<BaseResponse<AppointmentResponse>> cancelAppointment(
            @PathVariable Long id,
            @RequestParam Long userId,
            @RequestParam(required = false) String reason) {
        Appointment cancelled = clientAppointmentService.cancelOwnAppointment(id, userId, reason);
        return ResponseEntity.ok(BaseResponse.success("Appointment cancelled successfully", AppointmentResponse.from(cancelled)));
    }
}
