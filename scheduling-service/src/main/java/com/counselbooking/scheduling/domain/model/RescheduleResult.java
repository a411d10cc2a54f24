package com.counselbooking.scheduling.domain.model;

public record RescheduleResult(AppointmentHistory historyRecord, Appointment updatedAppointment) {
}
