package com.counselbooking.scheduling.api.controller;

import com.counselbooking.common.dto.BaseResponse;
import com.counselbooking.common.util.Constants;
import com.counselbooking.scheduling.api.dto.AppointmentHistoryResponse;
import com.counselbooking.scheduling.api.dto.AppointmentResponse;
import com.counselbooking.scheduling.api.dto.CancelAppointmentRequest;
import com.counselbooking.scheduling.api.dto.ConflictCheckRequest;
import com.counselbooking.scheduling.api.dto.RescheduleRequest;
import com.counselbooking.scheduling.api.dto.RescheduleResponse;
import com.counselbooking.scheduling.api.dto.UpdateNotesRequest;
import com.counselbooking.scheduling.domain.model.Actor;
import com.counselbooking.scheduling.domain.model.Appointment;
import com.counselbooking.scheduling.domain.model.ConflictReport;
import com.counselbooking.scheduling.domain.model.RescheduleResult;
import com.counselbooking.scheduling.domain.service.AppointmentHistoryService;
import com.counselbooking.scheduling.domain.service.AppointmentLifecycleService;
import com.counselbooking.scheduling.domain.service.ConflictDetector;
import com.counselbooking.scheduling.workflow.RescheduleOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Staff endpoints for moving and managing appointments.
 * The acting staff member is taken from the X-Actor-Id / X-Actor-Name headers set by the gateway.
 */
@RestController
@RequestMapping("/api/v1/admin/appointments")
@RequiredArgsConstructor
public class AdminAppointmentController {

    private final ConflictDetector conflictDetector;
    private final RescheduleOrchestrator rescheduleOrchestrator;
    private final AppointmentLifecycleService lifecycleService;
    private final AppointmentHistoryService historyService;

    @PostMapping("/conflicts")
    public ResponseEntity<BaseResponse<ConflictReport>> detectConflicts(
            @Valid @RequestBody ConflictCheckRequest request) {
        ConflictReport report = conflictDetector.detectConflicts(
                request.dateTime(), request.serviceId(), request.serviceDuration(), request.excludeAppointmentId());
        return ResponseEntity.ok(BaseResponse.success(report));
    }

    @PostMapping("/{id}/reschedule")
    public ResponseEntity<BaseResponse<RescheduleResponse>> reschedule(
            @PathVariable Long id,
            @Valid @RequestBody RescheduleRequest request,
            @RequestHeader(value = Constants.ACTOR_ID_HEADER, required = false) String actorId,
            @RequestHeader(value = Constants.ACTOR_NAME_HEADER, required = false) String actorName) {
        RescheduleResult result = rescheduleOrchestrator.rescheduleAppointment(
                id, request.newDateTime(), request.reason(), toActor(actorId, actorName));
        return ResponseEntity.ok(BaseResponse.success("Appointment rescheduled successfully", RescheduleResponse.from(result)));
    }

    @PostMapping("/{id}/confirm")
    public ResponseEntity<BaseResponse<AppointmentResponse>> confirm(
            @PathVariable Long id,
            @RequestHeader(value = Constants.ACTOR_ID_HEADER, required = false) String actorId,
            @RequestHeader(value = Constants.ACTOR_NAME_HEADER, required = false) String actorName) {
        return ok(lifecycleService.confirm(id, toActor(actorId, actorName)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<BaseResponse<AppointmentResponse>> cancel(
            @PathVariable Long id,
            @Valid @RequestBody(required = false) CancelAppointmentRequest request,
            @RequestHeader(value = Constants.ACTOR_ID_HEADER, required = false) String actorId,
            @RequestHeader(value = Constants.ACTOR_NAME_HEADER, required = false) String actorName) {
        String reason = request == null ? null : request.reason();
        return ok(lifecycleService.cancel(id, reason, toActor(actorId, actorName)));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<BaseResponse<AppointmentResponse>> complete(
            @PathVariable Long id,
            @RequestHeader(value = Constants.ACTOR_ID_HEADER, required = false) String actorId,
            @RequestHeader(value = Constants.ACTOR_NAME_HEADER, required = false) String actorName) {
        return ok(lifecycleService.complete(id, toActor(actorId, actorName)));
    }

    @PostMapping("/{id}/no-show")
    public ResponseEntity<BaseResponse<AppointmentResponse>> markNoShow(
            @PathVariable Long id,
            @RequestHeader(value = Constants.ACTOR_ID_HEADER, required = false) String actorId,
            @RequestHeader(value = Constants.ACTOR_NAME_HEADER, required = false) String actorName) {
        return ok(lifecycleService.markNoShow(id, toActor(actorId, actorName)));
    }

    @PatchMapping("/{id}/notes")
    public ResponseEntity<BaseResponse<AppointmentResponse>> updateNotes(
            @PathVariable Long id,
            @Valid @RequestBody UpdateNotesRequest request,
            @RequestHeader(value = Constants.ACTOR_ID_HEADER, required = false) String actorId,
            @RequestHeader(value = Constants.ACTOR_NAME_HEADER, required = false) String actorName) {
        return ok(lifecycleService.updateNotes(id, request.notes(), toActor(actorId, actorName)));
    }

    @GetMapping("/{id}/history")
    public ResponseEntity<BaseResponse<List<AppointmentHistoryResponse>>> getHistory(@PathVariable Long id) {
        List<AppointmentHistoryResponse> history = historyService.getHistory(id).stream()
                .map(AppointmentHistoryResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(BaseResponse.success(history));
    }

    private ResponseEntity<BaseResponse<AppointmentResponse>> ok(Appointment appointment) {
        return ResponseEntity.ok(BaseResponse.success(AppointmentResponse.from(appointment)));
    }

    private Actor toActor(String actorId, String actorName) {
        String name = actorName == null || actorName.isBlank() ? Constants.DEFAULT_ACTOR_NAME : actorName;
        return new Actor(actorId, name);
    }
}
