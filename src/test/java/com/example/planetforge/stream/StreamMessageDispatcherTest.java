package com.example.planetforge.stream;

import com.example.planetforge.error.DuplicateSessionException;
import com.example.planetforge.error.SessionNotFoundException;
import com.example.planetforge.model.Achievement;
import com.example.planetforge.model.CloseReason;
import com.example.planetforge.model.EvolutionResult;
import com.example.planetforge.model.MetricsSample;
import com.example.planetforge.model.SessionMetadata;
import com.example.planetforge.model.SessionSummary;
import com.example.planetforge.model.StreamResult;
import com.example.planetforge.service.SessionManager;
import com.example.planetforge.service.StreamAnalysisService;
import com.example.planetforge.stream.message.ServerMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StreamMessageDispatcherTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final String CODE_STREAM = "{\"type\":\"code_stream\",\"code_metrics\":{\"lines\":40,\"comments\":10,"
            + "\"functions\":4,\"language\":\"python\"},\"edit_metadata\":{\"keystrokes\":12,\"characters_changed\":10}}";

    @Mock
    private SessionManager sessionManager;

    @Mock
    private StreamAnalysisService analysisService;

    private ConnectionRegistry registry;
    private StreamMessageDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        MessageCodec codec = new MessageCodec(new ObjectMapper().registerModule(new JavaTimeModule()));
        registry = new ConnectionRegistry(codec);
        dispatcher = new StreamMessageDispatcher(sessionManager, analysisService, registry, codec,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testDispatch_PingRepliesPong() {
        // When
        List<ServerMessage> replies = dispatcher.dispatch("alice", "{\"type\":\"ping\"}");

        // Then
        assertEquals(1, replies.size());
        assertEquals(ServerMessage.PONG, replies.get(0).getType());
        assertEquals(NOW, replies.get(0).getTimestamp());
        verifyNoInteractions(sessionManager, analysisService);
    }

    @Test
    void testDispatch_StartSessionBindsSession() {
        // Given
        when(sessionManager.startSession(eq("alice"), any(SessionMetadata.class))).thenReturn("s1");

        // When
        List<ServerMessage> replies = dispatcher.dispatch("alice",
                "{\"type\":\"start_session\",\"metadata\":{\"editor_id\":\"vim\",\"language\":\"go\"}}");

        // Then
        assertEquals(ServerMessage.SESSION_STARTED, replies.get(0).getType());
        assertEquals("s1", replies.get(0).getSessionId());
        assertEquals(Optional.of("s1"), registry.activeSession("alice"));

        ArgumentCaptor<SessionMetadata> metadata = ArgumentCaptor.forClass(SessionMetadata.class);
        verify(sessionManager).startSession(eq("alice"), metadata.capture());
        assertEquals("vim", metadata.getValue().getEditorId());
    }

    @Test
    void testDispatch_CodeStreamWithoutSessionIsRejected() {
        // When
        List<ServerMessage> replies = dispatcher.dispatch("alice", CODE_STREAM);

        // Then
        assertEquals(1, replies.size());
        assertEquals(ServerMessage.ERROR, replies.get(0).getType());
        assertTrue(replies.get(0).getMessage().contains("start_session"));
        verifyNoInteractions(analysisService);
    }

    @Test
    void testDispatch_CodeStreamEmitsAchievementsAndEvolution() {
        // Given
        registry.bindSession("alice", "s1");
        Achievement achievement = new Achievement("stage_ascension", "Stage Ascension", "Reached a new stage", 40);
        EvolutionResult evolution = EvolutionResult.builder()
                .planetId("planet-alice")
                .ownerId("alice")
                .stageChanged(true)
                .pointsEarned(75.0)
                .achievement(achievement)
                .build();
        StreamResult result = StreamResult.builder().sessionId("s1").evolution(evolution).build();
        when(analysisService.analyze(eq("s1"), any(MetricsSample.class))).thenReturn(result);

        // When
        List<ServerMessage> replies = dispatcher.dispatch("alice", CODE_STREAM);

        // Then
        assertEquals(3, replies.size());
        assertEquals(ServerMessage.ANALYSIS_UPDATE, replies.get(0).getType());
        assertEquals(ServerMessage.ACHIEVEMENT_UNLOCKED, replies.get(1).getType());
        assertEquals("stage_ascension", replies.get(1).getAchievement().getId());
        assertEquals(ServerMessage.PLANET_EVOLUTION, replies.get(2).getType());

        ArgumentCaptor<MetricsSample> sample = ArgumentCaptor.forClass(MetricsSample.class);
        verify(analysisService).analyze(eq("s1"), sample.capture());
        assertEquals(40, sample.getValue().getLines());
        assertEquals(12, sample.getValue().getKeystrokes());
        assertEquals(NOW, sample.getValue().getTimestamp());
    }

    @Test
    void testDispatch_CodeStreamWithinStageSendsOnlyUpdate() {
        // Given
        registry.bindSession("alice", "s1");
        EvolutionResult evolution = EvolutionResult.builder().planetId("planet-alice").stageChanged(false).build();
        when(analysisService.analyze(eq("s1"), any(MetricsSample.class)))
                .thenReturn(StreamResult.builder().sessionId("s1").evolution(evolution).build());

        // When
        List<ServerMessage> replies = dispatcher.dispatch("alice", CODE_STREAM);

        // Then
        assertEquals(1, replies.size());
        assertEquals(ServerMessage.ANALYSIS_UPDATE, replies.get(0).getType());
    }

    @Test
    void testDispatch_EndSessionClearsBinding() {
        // Given
        registry.bindSession("alice", "s1");
        SessionSummary summary = SessionSummary.builder()
                .sessionId("s1")
                .userId("alice")
                .closeReason(CloseReason.ENDED_BY_CLIENT)
                .build();
        when(sessionManager.endSession("s1")).thenReturn(summary);

        // When
        List<ServerMessage> replies = dispatcher.dispatch("alice", "{\"type\":\"end_session\"}");

        // Then
        assertEquals(ServerMessage.SESSION_ENDED, replies.get(0).getType());
        assertSame(summary, replies.get(0).getSummary());
        assertTrue(registry.activeSession("alice").isEmpty());
    }

    @Test
    void testDispatch_DuplicateSessionBecomesError() {
        // Given
        when(sessionManager.startSession(eq("alice"), any()))
                .thenThrow(new DuplicateSessionException("alice", "s0"));

        // When
        List<ServerMessage> replies = dispatcher.dispatch("alice", "{\"type\":\"start_session\"}");

        // Then
        assertEquals(ServerMessage.ERROR, replies.get(0).getType());
        assertTrue(registry.activeSession("alice").isEmpty());
    }

    @Test
    void testDispatch_MalformedTextBecomesError() {
        List<ServerMessage> replies = dispatcher.dispatch("alice", "not json");

        assertEquals(1, replies.size());
        assertEquals(ServerMessage.ERROR, replies.get(0).getType());
        verifyNoInteractions(sessionManager, analysisService);
    }

    @Test
    void testDispatch_ClosedSessionClearsBinding() {
        // Given
        registry.bindSession("alice", "s1");
        when(analysisService.analyze(eq("s1"), any(MetricsSample.class)))
                .thenThrow(new SessionNotFoundException("s1"));

        // When
        List<ServerMessage> replies = dispatcher.dispatch("alice", CODE_STREAM);

        // Then
        assertEquals(ServerMessage.ERROR, replies.get(0).getType());
        assertTrue(replies.get(0).getMessage().contains("s1"));
        assertTrue(registry.activeSession("alice").isEmpty());
    }

    @Test
    void testDispatch_UnexpectedFailureBecomesInternalError() {
        // Given
        registry.bindSession("alice", "s1");
        when(analysisService.analyze(eq("s1"), any(MetricsSample.class)))
                .thenThrow(new IllegalStateException("boom"));

        // When
        List<ServerMessage> replies = dispatcher.dispatch("alice", CODE_STREAM);

        // Then
        assertEquals("Internal error handling code_stream", replies.get(0).getMessage());
        assertEquals(Optional.of("s1"), registry.activeSession("alice"));
    }
}
