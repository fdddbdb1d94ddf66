package org.example.insights.service;

import org.example.insights.entity.RecapCapsuleEntity;
import org.example.insights.repository.RecapCapsuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RecapCapsuleQueueTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 19, 12, 0);

    @Mock
    private RecapCapsuleRepository capsuleRepository;

    private RecapCapsuleQueue queue;

    @BeforeEach
    void setUp() {
        queue = new RecapCapsuleQueue(capsuleRepository);
    }

    @Test
    void schedule_existingCapsule_isRearmed() {
        when(capsuleRepository.rearm(-1L, NOW)).thenReturn(1);

        queue.schedule(-1L, NOW);

        verify(capsuleRepository, never()).save(any());
    }

    @Test
    void schedule_newChat_insertsCapsule() {
        when(capsuleRepository.rearm(-1L, NOW)).thenReturn(0);

        queue.schedule(-1L, NOW);

        ArgumentCaptor<RecapCapsuleEntity> saved = ArgumentCaptor.forClass(RecapCapsuleEntity.class);
        verify(capsuleRepository).save(saved.capture());
        assertEquals(-1L, saved.getValue().getChatId());
        assertEquals(NOW, saved.getValue().getDueAt());
    }

    @Test
    void schedule_concurrentInsert_fallsBackToRearm() {
        when(capsuleRepository.rearm(-1L, NOW)).thenReturn(0, 1);
        when(capsuleRepository.save(any(RecapCapsuleEntity.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate chat_id"));

        queue.schedule(-1L, NOW);

        verify(capsuleRepository, times(2)).rearm(-1L, NOW);
    }

    @Test
    void claimDue_returnsOnlyChatsWhoseLeaseWasWon() {
        when(capsuleRepository.findDueChatIds(NOW)).thenReturn(List.of(-1L, -2L));
        when(capsuleRepository.claimFireLease(eq(-1L), eq(NOW), eq(NOW.plusMinutes(5)), anyString())).thenReturn(1);
        when(capsuleRepository.claimFireLease(eq(-2L), eq(NOW), eq(NOW.plusMinutes(5)), anyString())).thenReturn(0);

        List<Long> claimed = queue.claimDue(NOW, Duration.ofMinutes(5));

        assertEquals(List.of(-1L), claimed);
    }
}
