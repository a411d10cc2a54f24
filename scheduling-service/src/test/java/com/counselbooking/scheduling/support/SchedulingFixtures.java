package com.counselbooking.scheduling.support;

import com.counselbooking.scheduling.domain.model.Appointment;
import com.counselbooking.scheduling.domain.model.Appointment.AppointmentStatus;
import com.counselbooking.scheduling.domain.model.AvailabilityWindow;
import com.counselbooking.scheduling.domain.model.BlockedSlot;
import com.counselbooking.scheduling.domain.model.ServiceOffering;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Shared test data. "Today" is Monday 2026-10-19 in the practice's zone.
 */
public final class SchedulingFixtures {

    public static final ZoneId ZONE = ZoneId.of("America/New_York");
    public static final LocalDate TODAY = LocalDate.of(2026, 10, 19);
    public static final LocalDate TOMORROW = TODAY.plusDays(1);
    public static final LocalDate NEXT_MONDAY = TODAY.plusDays(7);

    public static final int MONDAY = 1;
    public static final int TUESDAY = 2;

    private SchedulingFixtures() {
    }

    /** Monday 10:00 local. */
    public static Clock fixedClock() {
        return Clock.fixed(at(TODAY, 10, 0), ZONE);
    }

    public static Instant at(LocalDate date, int hour, int minute) {
        return date.atTime(hour, minute).atZone(ZONE).toInstant();
    }

    public static ServiceOffering service(long id, int durationMinutes) {
        return ServiceOffering.builder()
                .id(id)
                .title("Individual Therapy")
                .durationMinutes(durationMinutes)
                .price(BigDecimal.valueOf(150))
                .active(true)
                .build();
    }

    public static AvailabilityWindow window(int dayOfWeek, String start, String end) {
        return AvailabilityWindow.builder()
                .dayOfWeek(dayOfWeek)
                .startTime(LocalTime.parse(start))
                .endTime(LocalTime.parse(end))
                .active(true)
                .build();
    }

    public static Appointment appointment(long id, ServiceOffering service, Instant start, AppointmentStatus status) {
        return Appointment.builder()
                .id(id)
                .userId(500L + id)
                .service(service)
                .dateTime(start)
                .status(status)
                .build();
    }

    public static BlockedSlot blocked(long id, Instant start, int durationMinutes) {
        return BlockedSlot.builder()
                .id(id)
                .dateTime(start)
                .durationMinutes(durationMinutes)
                .reason("Staff training")
                .build();
    }
}
