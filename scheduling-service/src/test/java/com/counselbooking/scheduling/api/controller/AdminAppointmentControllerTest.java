package com.counselbooking.scheduling.api.controller;

import com.counselbooking.common.exception.ResourceNotFoundException;
import com.counselbooking.scheduling.domain.model.Actor;
import com.counselbooking.scheduling.domain.model.Appointment;
import com.counselbooking.scheduling.domain.model.Appointment.AppointmentStatus;
import com.counselbooking.scheduling.domain.model.AppointmentHistory;
import com.counselbooking.scheduling.domain.model.AppointmentHistory.HistoryAction;
import com.counselbooking.scheduling.domain.model.ConflictReport;
import com.counselbooking.scheduling.domain.model.ConflictType;
import com.counselbooking.scheduling.domain.model.ConflictingAppointment;
import com.counselbooking.scheduling.domain.model.RescheduleResult;
import com.counselbooking.scheduling.domain.model.SuggestedSlot;
import com.counselbooking.scheduling.domain.service.AppointmentHistoryService;
import com.counselbooking.scheduling.domain.service.AppointmentLifecycleService;
import com.counselbooking.scheduling.domain.service.ConflictDetector;
import com.counselbooking.scheduling.exception.AppointmentStateException;
import com.counselbooking.scheduling.workflow.RescheduleOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static com.counselbooking.scheduling.support.SchedulingFixtures.*;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AdminAppointmentController.class)
class AdminAppointmentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConflictDetector conflictDetector;
    @MockBean
    private RescheduleOrchestrator rescheduleOrchestrator;
    @MockBean
    private AppointmentLifecycleService lifecycleService;
    @MockBean
    private AppointmentHistoryService historyService;

    private final Instant newTime = at(NEXT_MONDAY, 14, 0);

    @Test
    @DisplayName("POST /{id}/reschedule returns the history record and the moved appointment")
    void reschedule_success_returns200() throws Exception {
        // given
        Appointment moved = appointment(10L, service(1L, 50), newTime, AppointmentStatus.PENDING);
        AppointmentHistory history = AppointmentHistory.builder()
                .id(3L)
                .appointmentId(10L)
                .action(HistoryAction.RESCHEDULED)
                .oldDateTime(at(NEXT_MONDAY, 9, 0))
                .newDateTime(newTime)
                .reason("Client request")
                .actorId("42")
                .actorName("Dana")
                .build();
        given(rescheduleOrchestrator.rescheduleAppointment(eq(10L), eq(newTime), eq("Client request"), any()))
                .willReturn(new RescheduleResult(history, moved));

        // when / then
        mockMvc.perform(post("/api/v1/admin/appointments/10/reschedule")
                        .header("X-Actor-Id", "42")
                        .header("X-Actor-Name", "Dana")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"newDateTime\":\"" + newTime + "\",\"reason\":\"Client request\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Appointment rescheduled successfully"))
                .andExpect(jsonPath("$.data.historyRecord.action").value("RESCHEDULED"))
                .andExpect(jsonPath("$.data.historyRecord.actorName").value("Dana"))
                .andExpect(jsonPath("$.data.appointment.id").value(10))
                .andExpect(jsonPath("$.data.appointment.status").value("PENDING"));

        verify(rescheduleOrchestrator).rescheduleAppointment(10L, newTime, "Client request", new Actor("42", "Dana"));
    }

    @Test
    @DisplayName("Rescheduling a cancelled appointment maps to 409 with the state details")
    void reschedule_notReschedulable_returns409() throws Exception {
        given(rescheduleOrchestrator.rescheduleAppointment(eq(10L), any(), any(), any()))
                .willThrow(new AppointmentStateException("Cannot reschedule cancelled appointments",
                        AppointmentStateException.NOT_RESCHEDULABLE, 10L, AppointmentStatus.CANCELLED));

        mockMvc.perform(post("/api/v1/admin/appointments/10/reschedule")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"newDateTime\":\"" + newTime + "\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value("APPOINTMENT_NOT_RESCHEDULABLE"))
                .andExpect(jsonPath("$.data.status").value("CANCELLED"));
    }

    @Test
    @DisplayName("Missing actor headers default to the Admin actor")
    void confirm_withoutHeaders_usesDefaultActor() throws Exception {
        given(lifecycleService.confirm(eq(10L), any()))
                .willReturn(appointment(10L, service(1L, 50), newTime, AppointmentStatus.CONFIRMED));

        mockMvc.perform(post("/api/v1/admin/appointments/10/confirm"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("CONFIRMED"))
                .andExpect(jsonPath("$.data.serviceTitle").value("Individual Therapy"));

        verify(lifecycleService).confirm(10L, new Actor(null, "Admin"));
    }

    @Test
    @DisplayName("Cancel accepts an empty body")
    void cancel_withoutBody_passesNullReason() throws Exception {
        given(lifecycleService.cancel(eq(10L), isNull(), any()))
                .willReturn(appointment(10L, service(1L, 50), newTime, AppointmentStatus.CANCELLED));

        mockMvc.perform(post("/api/v1/admin/appointments/10/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("CANCELLED"));
    }

    @Test
    @DisplayName("History of an unknown appointment is 404")
    void getHistory_unknown_returns404() throws Exception {
        given(historyService.getHistory(99L)).willThrow(new ResourceNotFoundException("Appointment", 99L));

        mockMvc.perform(get("/api/v1/admin/appointments/99/history"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("RESOURCE_NOT_FOUND"));
    }

    @Test
    @DisplayName("Conflict report exposes the conflict type in lower case and the suggested alternatives")
    void detectConflicts_appointmentConflict_returnsReport() throws Exception {
        Instant proposed = at(TOMORROW, 10, 0);
        Appointment existing = appointment(5L, service(1L, 50), at(TOMORROW, 10, 30), AppointmentStatus.CONFIRMED);
        ConflictReport report = new ConflictReport(true, ConflictType.APPOINTMENT,
                List.of(ConflictingAppointment.from(existing)),
                "Time slot conflicts with existing appointment",
                List.of(new SuggestedSlot(at(TOMORROW, 11, 45), "Tomorrow 11:45 AM")));
        given(conflictDetector.detectConflicts(proposed, 1L, 50, null)).willReturn(report);

        mockMvc.perform(post("/api/v1/admin/appointments/conflicts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dateTime\":\"" + proposed + "\",\"serviceId\":1,\"serviceDuration\":50}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.hasConflict").value(true))
                .andExpect(jsonPath("$.data.conflictType").value("appointment"))
                .andExpect(jsonPath("$.data.conflictingAppointments[0].id").value(5))
                .andExpect(jsonPath("$.data.suggestedAlternatives[0].displayTime").value("Tomorrow 11:45 AM"));
    }

    @Test
    @DisplayName("A conflict-free report still carries every field, with a null conflict type and an empty reason")
    void detectConflicts_noConflict_serializesFullShape() throws Exception {
        Instant proposed = at(TOMORROW, 15, 0);
        given(conflictDetector.detectConflicts(proposed, 1L, 50, null)).willReturn(ConflictReport.none());

        mockMvc.perform(post("/api/v1/admin/appointments/conflicts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dateTime\":\"" + proposed + "\",\"serviceId\":1,\"serviceDuration\":50}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.hasConflict").value(false))
                .andExpect(jsonPath("$.data", hasKey("conflictType")))
                .andExpect(jsonPath("$.data.conflictType").value(nullValue()))
                .andExpect(jsonPath("$.data.reason").value(""))
                .andExpect(jsonPath("$.data.conflictingAppointments").isEmpty())
                .andExpect(jsonPath("$.data.suggestedAlternatives").isEmpty());
    }

    @Test
    @DisplayName("Conflict check rejects a duration outside 15..480 minutes before calling the detector")
    void detectConflicts_invalidDuration_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/admin/appointments/conflicts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dateTime\":\"2026-10-20T14:00:00Z\",\"serviceId\":1,\"serviceDuration\":5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.data.serviceDuration").value("Duration must be at least 15 minutes"));

        verifyNoInteractions(conflictDetector);
    }
}
