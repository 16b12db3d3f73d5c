package ai.classtalk.backend.service;

import ai.classtalk.backend.model.dto.TranscriptSegment;
import ai.classtalk.backend.model.entity.DiscussionSession;
import ai.classtalk.backend.model.entity.FlagType;
import ai.classtalk.backend.model.entity.SessionStatus;
import ai.classtalk.backend.repository.DiscussionSessionRepository;
import ai.classtalk.backend.repository.FlaggedContentRepository;
import ai.classtalk.backend.service.exception.CursorConflictException;
import ai.classtalk.backend.service.exception.ModerationServiceException;
import ai.classtalk.backend.service.exception.SessionClosedException;
import ai.classtalk.backend.service.exception.SessionNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SegmentStoreImplTest {

    @Mock
    private DiscussionSessionRepository sessionRepository;

    @Mock
    private FlaggedContentRepository flaggedContentRepository;

    @Mock
    private ModerationMetricsService metricsService;

    @InjectMocks
    private SegmentStoreImpl segmentStore;

    private UUID sessionId;
    private DiscussionSession session;

    @BeforeEach
    void setUp() {
        sessionId = UUID.randomUUID();
        session = new DiscussionSession();
        session.setId(sessionId);
        session.setOwnerId("owner");
        session.setSegments(new ArrayList<>(List.of(segment("A", 0, 1), segment("B", 1, 2))));
        session.setCursor(2);
    }

    @Test
    @DisplayName("Append at the current cursor should commit and advance the cursor")
    void shouldAppendAtCurrentCursor() {
        // Arrange
        when(sessionRepository.findById(sessionId)).thenReturn(Optional.of(session));
        when(sessionRepository.compareAndSetSegments(eq(sessionId), eq(2), eq(3), anyString(), any())).thenReturn(1);

        // Act
        AppendResult result = segmentStore.append(sessionId, List.of(segment("C", 2, 3)), 2);

        // Assert
        assertThat(result.getNewCursor()).isEqualTo(3);
        assertThat(result.getSegments()).hasSize(3);
        assertThat(result.getAppendedSegments()).extracting(TranscriptSegment::getSpeaker).containsExactly("C");
        verify(metricsService).recordSegmentsAppended(1);
    }

    @Test
    @DisplayName("A stale fromIndex should conflict with the stored cursor and write nothing")
    void shouldRejectStaleCursor() {
        when(sessionRepository.findById(sessionId)).thenReturn(Optional.of(session));

        assertThatThrownBy(() -> segmentStore.append(sessionId, List.of(segment("C", 2, 3)), 1))
                .isInstanceOf(CursorConflictException.class)
                .satisfies(e -> {
                    CursorConflictException conflict = (CursorConflictException) e;
                    assertThat(conflict.getExpected()).isEqualTo(1);
                    assertThat(conflict.getActual()).isEqualTo(2);
                })
                .hasMessage("Index mismatch: expected 1, got 2");

        verify(sessionRepository, never()).compareAndSetSegments(any(), anyInt(), anyInt(), anyString(), any());
        verify(metricsService).recordCursorConflict();
    }

    @Test
    @DisplayName("Losing the conditional write race should report the winner's cursor")
    void shouldReportConflictWhenConditionalWriteLoses() {
        DiscussionSession afterRace = new DiscussionSession();
        afterRace.setId(sessionId);
        afterRace.setCursor(4);
        when(sessionRepository.findById(sessionId)).thenReturn(Optional.of(session), Optional.of(afterRace));
        when(sessionRepository.compareAndSetSegments(eq(sessionId), eq(2), eq(3), anyString(), any())).thenReturn(0);

        assertThatThrownBy(() -> segmentStore.append(sessionId, List.of(segment("C", 2, 3)), 2))
                .isInstanceOf(CursorConflictException.class)
                .hasMessage("Index mismatch: expected 2, got 4");

        verify(metricsService, never()).recordSegmentsAppended(anyInt());
    }

    @Test
    @DisplayName("Appends to a session that is no longer a draft should be rejected")
    void shouldRejectAppendToClosedSession() {
        session.setStatus(SessionStatus.COMPLETE);
        when(sessionRepository.findById(sessionId)).thenReturn(Optional.of(session));

        assertThatThrownBy(() -> segmentStore.append(sessionId, List.of(segment("C", 2, 3)), 2))
                .isInstanceOf(SessionClosedException.class)
                .satisfies(e -> assertThat(((SessionClosedException) e).getStatus()).isEqualTo(SessionStatus.COMPLETE));
    }

    @Test
    @DisplayName("Unknown sessions should raise SessionNotFoundException")
    void shouldRejectUnknownSession() {
        when(sessionRepository.findById(sessionId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> segmentStore.append(sessionId, List.of(segment("C", 2, 3)), 0))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    @DisplayName("Database errors should be wrapped without leaking details")
    void shouldWrapDataAccessErrors() {
        when(sessionRepository.findById(sessionId)).thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> segmentStore.append(sessionId, List.of(segment("C", 2, 3)), 2))
                .isInstanceOf(ModerationServiceException.class)
                .hasMessage("Failed to append segments");
    }

    @Test
    @DisplayName("Replacement outside reconciliation should be rejected")
    void shouldRejectReplaceWhenNotReconciling() {
        when(sessionRepository.replaceSegments(eq(sessionId), eq(1), anyString(), any())).thenReturn(0);
        when(sessionRepository.findById(sessionId)).thenReturn(Optional.of(session));

        assertThatThrownBy(() -> segmentStore.replaceAll(sessionId, List.of(segment("A", 0, 1))))
                .isInstanceOf(SessionClosedException.class);
        verify(flaggedContentRepository, never()).deleteBySessionIdAndFlagTypes(any(), any());
    }

    @Test
    @DisplayName("Replacement during reconciliation should succeed")
    void shouldReplaceWhileReconciling() {
        when(sessionRepository.replaceSegments(eq(sessionId), eq(2), anyString(), any())).thenReturn(1);

        when(flaggedContentRepository.deleteBySessionIdAndFlagTypes(sessionId, EnumSet.allOf(FlagType.class)))
                .thenReturn(3);

        List<TranscriptSegment> stored = segmentStore.replaceAll(sessionId,
                List.of(segment("A", 0, 1), segment("B", 1, 2)));

        verify(sessionRepository).replaceSegments(eq(sessionId), eq(2), anyString(), any());
        verify(flaggedContentRepository).deleteBySessionIdAndFlagTypes(sessionId, EnumSet.allOf(FlagType.class));
        assertThat(stored).extracting(TranscriptSegment::getSpeaker).containsExactly("A", "B");
    }

    @Test
    @DisplayName("A failed flag invalidation should fail the whole replacement")
    void shouldFailReplacementWhenFlagInvalidationFails() {
        when(sessionRepository.replaceSegments(eq(sessionId), eq(1), anyString(), any())).thenReturn(1);
        when(flaggedContentRepository.deleteBySessionIdAndFlagTypes(sessionId, EnumSet.allOf(FlagType.class)))
                .thenThrow(new DataAccessResourceFailureException("lock timeout"));

        assertThatThrownBy(() -> segmentStore.replaceAll(sessionId, List.of(segment("A", 0, 1))))
                .isInstanceOf(ModerationServiceException.class)
                .hasMessage("Failed to replace segments");
    }

    private static TranscriptSegment segment(String speaker, double start, double end) {
        return TranscriptSegment.builder().speaker(speaker).text("text").startTime(start).endTime(end).build();
    }
}
