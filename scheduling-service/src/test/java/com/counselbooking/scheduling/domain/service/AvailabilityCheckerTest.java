package com.counselbooking.scheduling.domain.service;

import com.counselbooking.common.exception.ResourceNotFoundException;
import com.counselbooking.scheduling.config.BusinessRulesProperties;
import com.counselbooking.scheduling.config.SchedulingProperties;
import com.counselbooking.scheduling.domain.model.Appointment.AppointmentStatus;
import com.counselbooking.scheduling.domain.model.AvailabilityResult;
import com.counselbooking.scheduling.domain.model.ServiceOffering;
import com.counselbooking.scheduling.domain.model.UnavailabilityReason;
import com.counselbooking.scheduling.domain.repository.AppointmentRepository;
import com.counselbooking.scheduling.domain.repository.AvailabilityWindowRepository;
import com.counselbooking.scheduling.domain.repository.BlockedSlotRepository;
import com.counselbooking.scheduling.domain.repository.ServiceOfferingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static com.counselbooking.scheduling.support.SchedulingFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Unit tests for {@link AvailabilityChecker}. "Now" is Monday 10:00; weekdays open 09:00-17:00.
 */
@ExtendWith(MockitoExtension.class)
class AvailabilityCheckerTest {

    private static final long SERVICE_ID = 1L;

    @Mock
    private ServiceOfferingRepository serviceOfferingRepository;
    @Mock
    private AvailabilityWindowRepository availabilityWindowRepository;
    @Mock
    private AppointmentRepository appointmentRepository;
    @Mock
    private BlockedSlotRepository blockedSlotRepository;

    private final ServiceOffering sixtyMinutes = service(SERVICE_ID, 60);

    private AvailabilityChecker checker;

    @BeforeEach
    void setUp() {
        checker = new AvailabilityChecker(
                serviceOfferingRepository,
                availabilityWindowRepository,
                appointmentRepository,
                blockedSlotRepository,
                new BusinessRulesProperties(),
                new SchedulingProperties(),
                fixedClock()
        );
        lenient().when(serviceOfferingRepository.findByIdAndActiveTrue(SERVICE_ID)).thenReturn(Optional.of(sixtyMinutes));
        lenient().when(availabilityWindowRepository.findByDayOfWeekAndActiveTrueOrderByStartTimeAsc(anyInt()))
                .thenAnswer(invocation -> {
                    int day = invocation.getArgument(0);
                    return day >= 1 && day <= 5 ? List.of(window(day, "09:00", "17:00")) : List.of();
                });
        lenient().when(appointmentRepository.findInRangeWithStatuses(any(), any(), any())).thenReturn(List.of());
        lenient().when(blockedSlotRepository.findStartingBetween(any(), any())).thenReturn(List.of());
    }

    @Test
    @DisplayName("10:30 overlaps a confirmed 10:00 appointment, 11:20 clears its buffer")
    void isTimeSlotAvailable_confirmedAppointment_bufferBoundary() {
        // given
        given(appointmentRepository.findInRangeWithStatuses(any(), any(), any())).willReturn(List.of(
                appointment(7L, sixtyMinutes, at(NEXT_MONDAY, 10, 0), AppointmentStatus.CONFIRMED)));

        // when
        AvailabilityResult halfPastTen = checker.isTimeSlotAvailable(at(NEXT_MONDAY, 10, 30), SERVICE_ID);
        AvailabilityResult twentyPastEleven = checker.isTimeSlotAvailable(at(NEXT_MONDAY, 11, 20), SERVICE_ID);

        // then
        assertThat(halfPastTen.available()).isFalse();
        assertThat(halfPastTen.reasonCode()).isEqualTo(UnavailabilityReason.APPOINTMENT_CONFLICT);
        assertThat(halfPastTen.reason()).isEqualTo("Time slot conflicts with existing appointment");
        assertThat(halfPastTen.conflictingAppointmentIds()).containsExactly(7L);

        assertThat(twentyPastEleven.available()).isTrue();
        assertThat(twentyPastEleven.reasonCode()).isNull();
        assertThat(twentyPastEleven.reason()).isNull();
    }

    @Test
    @DisplayName("An appointment does not conflict with itself when excluded")
    void isTimeSlotAvailable_selfExcluded_available() {
        given(appointmentRepository.findInRangeWithStatuses(any(), any(), any())).willReturn(List.of(
                appointment(7L, sixtyMinutes, at(NEXT_MONDAY, 10, 0), AppointmentStatus.CONFIRMED)));

        AvailabilityResult result = checker.isTimeSlotAvailable(at(NEXT_MONDAY, 10, 0), SERVICE_ID, 7L);

        assertThat(result.available()).isTrue();
    }

    @Test
    @DisplayName("A session running past closing time is outside business hours")
    void isTimeSlotAvailable_endsAfterClose_outsideHours() {
        AvailabilityResult result = checker.isTimeSlotAvailable(at(NEXT_MONDAY, 16, 30), SERVICE_ID);

        assertThat(result.available()).isFalse();
        assertThat(result.reasonCode()).isEqualTo(UnavailabilityReason.OUTSIDE_BUSINESS_HOURS);
        assertThat(result.reason()).isEqualTo("Outside business hours");
        verifyNoInteractions(appointmentRepository, blockedSlotRepository);
    }

    @Test
    @DisplayName("A day without windows is outside business hours")
    void isTimeSlotAvailable_sunday_outsideHours() {
        LocalDate sunday = NEXT_MONDAY.minusDays(1);

        AvailabilityResult result = checker.isTimeSlotAvailable(at(sunday, 10, 0), SERVICE_ID);

        assertThat(result.reasonCode()).isEqualTo(UnavailabilityReason.OUTSIDE_BUSINESS_HOURS);
    }

    @Test
    @DisplayName("Business hours are checked before the notice period")
    void isTimeSlotAvailable_earlyToday_outsideHoursWins() {
        AvailabilityResult result = checker.isTimeSlotAvailable(at(TODAY, 7, 0), SERVICE_ID);

        assertThat(result.reasonCode()).isEqualTo(UnavailabilityReason.OUTSIDE_BUSINESS_HOURS);
    }

    @Test
    @DisplayName("A blocked period overlapping the session makes it unavailable")
    void isTimeSlotAvailable_blocked() {
        given(blockedSlotRepository.findStartingBetween(any(), any()))
                .willReturn(List.of(blocked(3L, at(NEXT_MONDAY, 13, 0), 120)));

        AvailabilityResult result = checker.isTimeSlotAvailable(at(NEXT_MONDAY, 12, 30), SERVICE_ID);

        assertThat(result.available()).isFalse();
        assertThat(result.reasonCode()).isEqualTo(UnavailabilityReason.BLOCKED);
        assertThat(result.reason()).isEqualTo("Time slot is blocked");
    }

    @Test
    @DisplayName("Less than 24 hours ahead is rejected with the notice message")
    void isTimeSlotAvailable_insufficientNotice() {
        AvailabilityResult result = checker.isTimeSlotAvailable(at(TOMORROW, 9, 0), SERVICE_ID);

        assertThat(result.available()).isFalse();
        assertThat(result.reasonCode()).isEqualTo(UnavailabilityReason.INSUFFICIENT_NOTICE);
        assertThat(result.reason()).isEqualTo("Must be booked at least 24 hours in advance");
    }

    @Test
    @DisplayName("Exactly 24 hours ahead is bookable")
    void isTimeSlotAvailable_exactlyMinimumNotice_available() {
        AvailabilityResult result = checker.isTimeSlotAvailable(at(TOMORROW, 10, 0), SERVICE_ID);

        assertThat(result.available()).isTrue();
    }

    @Test
    @DisplayName("More than 30 days ahead is beyond the booking window")
    void isTimeSlotAvailable_beyondBookingWindow() {
        // Thursday 2026-11-19
        AvailabilityResult result = checker.isTimeSlotAvailable(at(TODAY.plusDays(31), 10, 0), SERVICE_ID);

        assertThat(result.available()).isFalse();
        assertThat(result.reasonCode()).isEqualTo(UnavailabilityReason.BEYOND_BOOKING_WINDOW);
        assertThat(result.reason()).isEqualTo("Cannot be booked more than 30 days in advance");
    }

    @Test
    @DisplayName("Unknown service raises not found instead of returning unavailable")
    void isTimeSlotAvailable_unknownService_throwsNotFound() {
        given(serviceOfferingRepository.findByIdAndActiveTrue(42L)).willReturn(Optional.empty());

        assertThatThrownBy(() -> checker.isTimeSlotAvailable(at(NEXT_MONDAY, 10, 0), 42L))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("Occupancy lookback covers the longest stored duration even when the configured limit is lower")
    void isTimeSlotAvailable_lowerConfiguredMaxDuration_keepsFullLookback() {
        // given
        BusinessRulesProperties rules = new BusinessRulesProperties();
        rules.setMaxDurationMinutes(60);
        AvailabilityChecker strictChecker = new AvailabilityChecker(serviceOfferingRepository,
                availabilityWindowRepository, appointmentRepository, blockedSlotRepository,
                rules, new SchedulingProperties(), fixedClock());
        Instant start = at(NEXT_MONDAY, 16, 0);

        // when
        strictChecker.isTimeSlotAvailable(start, SERVICE_ID);

        // then
        verify(appointmentRepository).findInRangeWithStatuses(
                eq(start.minus(Duration.ofMinutes(480 + 15))), any(), any());
        verify(blockedSlotRepository).findStartingBetween(eq(start.minus(Duration.ofMinutes(480))), any());
    }
}
