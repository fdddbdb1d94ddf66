package org.example.insights.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TimeCapsuleDiggerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 19, 12, 0);

    @Mock
    private RecapCapsuleQueue capsuleQueue;

    @Mock
    private CapsuleHandler handler;

    @Mock
    private RecapScheduleCalculator scheduleCalculator;

    private TimeCapsuleDigger digger;

    @BeforeEach
    void setUp() {
        digger = new TimeCapsuleDigger(capsuleQueue, handler, scheduleCalculator, 300);
        when(scheduleCalculator.nowUtc()).thenReturn(NOW);
    }

    @Test
    void dig_firesEveryClaimedCapsuleEvenWhenOneFails() {
        when(capsuleQueue.claimDue(NOW, Duration.ofSeconds(300))).thenReturn(List.of(1L, 2L));
        doThrow(new IllegalStateException("boom")).when(handler).onFire(1L);

        digger.dig();

        verify(handler).onFire(1L);
        verify(handler).onFire(2L);
    }

    @Test
    void dig_claimFailure_firesNothing() {
        when(capsuleQueue.claimDue(any(), any())).thenThrow(new IllegalStateException("db down"));

        digger.dig();

        verifyNoInteractions(handler);
    }
}
