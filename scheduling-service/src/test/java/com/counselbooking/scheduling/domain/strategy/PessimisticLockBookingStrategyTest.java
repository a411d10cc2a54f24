package com.counselbooking.scheduling.domain.strategy;

import com.counselbooking.common.exception.ServiceUnavailableException;
import com.counselbooking.scheduling.domain.model.ScheduleDayLock;
import com.counselbooking.scheduling.domain.repository.ScheduleDayLockRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.Optional;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class PessimisticLockBookingStrategyTest {

    private static final LocalDate DAY = LocalDate.of(2026, 10, 26);

    @Mock
    private ScheduleDayLockRepository scheduleDayLockRepository;
    @Mock
    private TransactionTemplate transactionTemplate;

    private PessimisticLockBookingStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new PessimisticLockBookingStrategy(scheduleDayLockRepository, transactionTemplate);
        lenient().when(transactionTemplate.execute(any()))
                .thenAnswer(invocation -> invocation.<TransactionCallback<?>>getArgument(0).doInTransaction(null));
    }

    @Test
    @DisplayName("Work runs after the day row has been created and locked")
    void executeLocked_locksDayRowBeforeWork() {
        // given
        given(scheduleDayLockRepository.findByDayWithLock(DAY)).willReturn(Optional.of(new ScheduleDayLock(DAY)));
        @SuppressWarnings("unchecked")
        Supplier<String> work = mock(Supplier.class);
        given(work.get()).willReturn("booked");

        // when
        String result = strategy.executeLocked(DAY, work);

        // then
        assertThat(result).isEqualTo("booked");
        InOrder inOrder = inOrder(scheduleDayLockRepository, work);
        inOrder.verify(scheduleDayLockRepository).insertIfAbsent(DAY);
        inOrder.verify(scheduleDayLockRepository).findByDayWithLock(DAY);
        inOrder.verify(work).get();
    }

    @Test
    @DisplayName("Lock wait timeout is reported as service unavailable")
    void executeLocked_lockTimeout_throwsServiceUnavailable() {
        given(scheduleDayLockRepository.findByDayWithLock(DAY))
                .willThrow(new PessimisticLockingFailureException("lock timeout"));
        @SuppressWarnings("unchecked")
        Supplier<String> work = mock(Supplier.class);

        assertThatThrownBy(() -> strategy.executeLocked(DAY, work))
                .isInstanceOf(ServiceUnavailableException.class)
                .hasMessageContaining("2026-10-26");

        verifyNoInteractions(work);
    }

    @Test
    @DisplayName("Business exceptions thrown by the work pass through unchanged")
    void executeLocked_workFails_propagates() {
        given(scheduleDayLockRepository.findByDayWithLock(DAY)).willReturn(Optional.of(new ScheduleDayLock(DAY)));

        assertThatThrownBy(() -> strategy.executeLocked(DAY, () -> {
            throw new IllegalArgumentException("boom");
        })).isInstanceOf(IllegalArgumentException.class).hasMessage("boom");

        verify(transactionTemplate).execute(any());
    }

    @Test
    @DisplayName("Strategy type is PESSIMISTIC_LOCK")
    void getStrategyType() {
        assertThat(strategy.getStrategyType()).isEqualTo("PESSIMISTIC_LOCK");
    }
}
