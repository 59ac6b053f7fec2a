package com.example.planetforge.service;

import com.example.planetforge.error.DuplicateSessionException;
import com.example.planetforge.error.SessionNotFoundException;
import com.example.planetforge.model.BehavioralAnalysis;
import com.example.planetforge.model.CloseReason;
import com.example.planetforge.model.LiveUpdate;
import com.example.planetforge.model.MetricsSample;
import com.example.planetforge.model.SessionMetadata;
import com.example.planetforge.model.SessionRecord;
import com.example.planetforge.model.SessionSummary;
import com.example.planetforge.model.Skill;
import com.example.planetforge.model.SkillDeltaSet;
import com.example.planetforge.store.EvolutionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionManagerTest {

    @Mock
    private EvolutionStore store;

    @Mock
    private ApplicationEventPublisher events;

    private MutableClock clock;
    private BackgroundWorkQueue workQueue;
    private SessionManager sessionManager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        workQueue = new BackgroundWorkQueue();
        sessionManager = new SessionManager(store, workQueue, events, clock);
        ReflectionTestUtils.setField(sessionManager, "idleTimeout", Duration.ofMinutes(10));
    }

    private static MetricsSample sample(int chars) {
        return MetricsSample.builder()
                .lines(40).functions(3).comments(2).complexity(3).language("python")
                .keystrokes(chars).charactersChanged(chars)
                .build();
    }

    private static BehavioralAnalysis analysis(String style) {
        return BehavioralAnalysis.builder()
                .skillDeltas(SkillDeltaSet.uniform(0.5))
                .codingStyle(style)
                .analysisMethod(BehavioralAnalysis.METHOD_FALLBACK)
                .build();
    }

    @Test
    void testStartSession_DistinctIdsPerUser() {
        // When
        String a = sessionManager.startSession("alice", SessionMetadata.empty());
        String b = sessionManager.startSession("bob", null);

        // Then
        assertNotEquals(a, b);
        assertEquals(2, sessionManager.openSessionCount());
        assertEquals("alice", sessionManager.requireOpen(a));
    }

    @Test
    void testStartSession_DuplicateWhenConcurrentDisabled() {
        // Given
        String first = sessionManager.startSession("alice", SessionMetadata.empty());

        // When
        DuplicateSessionException e = assertThrows(DuplicateSessionException.class,
                () -> sessionManager.startSession("alice", SessionMetadata.empty()));

        // Then
        assertEquals(first, e.getExistingSessionId());
        assertEquals(1, sessionManager.openSessionCount());
    }

    @Test
    void testStartSession_SameEditorSupersedesWhenConcurrentAllowed() {
        // Given
        ReflectionTestUtils.setField(sessionManager, "allowConcurrent", true);
        SessionMetadata vscode = SessionMetadata.builder().editorId("vscode").build();
        String first = sessionManager.startSession("alice", vscode);

        // When
        String second = sessionManager.startSession("alice", vscode);

        // Then
        assertThrows(SessionNotFoundException.class, () -> sessionManager.processStream(first, sample(10), analysis("modular")));
        assertEquals("alice", sessionManager.requireOpen(second));
        assertEquals(1, sessionManager.openSessionCount());
    }

    @Test
    void testStartSession_DifferentEditorsCoexistWhenConcurrentAllowed() {
        // Given
        ReflectionTestUtils.setField(sessionManager, "allowConcurrent", true);

        // When
        String a = sessionManager.startSession("alice", SessionMetadata.builder().editorId("vscode").build());
        String b = sessionManager.startSession("alice", SessionMetadata.builder().editorId("vim").build());

        // Then
        assertEquals("alice", sessionManager.requireOpen(a));
        assertEquals("alice", sessionManager.requireOpen(b));
        assertEquals(2, sessionManager.activeSessions().size());
    }

    @Test
    void testProcessStream_UnknownSession() {
        assertThrows(SessionNotFoundException.class,
                () -> sessionManager.processStream("missing", sample(5), analysis("pragmatic")));
    }

    @Test
    void testProcessStream_UpdatesCounters() {
        // Given
        String id = sessionManager.startSession("alice", SessionMetadata.empty());

        // When
        sessionManager.processStream(id, sample(30), analysis("modular"));
        LiveUpdate update = sessionManager.processStream(id, sample(20), analysis("methodical"));

        // Then
        assertEquals(2, update.getEditCount());
        assertEquals(50, update.getTotalCharacters());
        assertEquals(50, update.getKeystrokes());
        assertEquals("methodical", update.getLatest().getCodingStyle());
    }

    @Test
    void testEndSession_SecondCallFails() {
        // Given
        String id = sessionManager.startSession("alice", SessionMetadata.empty());
        sessionManager.endSession(id);

        // When / Then
        assertThrows(SessionNotFoundException.class, () -> sessionManager.endSession(id));
        assertThrows(SessionNotFoundException.class, () -> sessionManager.processStream(id, sample(1), analysis("modular")));
        assertThrows(SessionNotFoundException.class, () -> sessionManager.requireOpen(id));
    }

    @Test
    void testEndSession_ComputesSummary() {
        // Given
        String id = sessionManager.startSession("alice", SessionMetadata.builder().language("python").build());
        sessionManager.processStream(id, sample(100), analysis("modular"));
        sessionManager.processStream(id, sample(100), analysis("methodical"));
        sessionManager.processStream(id, sample(100), analysis("modular"));
        sessionManager.processStream(id, sample(100), analysis("methodical"));
        clock.advance(Duration.ofMinutes(2));

        // When
        SessionSummary summary = sessionManager.endSession(id);

        // Then
        assertEquals(120, summary.getDurationSeconds());
        assertEquals(4, summary.getEditCount());
        assertEquals(2.0, summary.getAverageEditFrequency(), 1e-9);
        assertEquals(40.0, summary.getTypingSpeedWpm(), 1e-9);
        // tie broken alphabetically
        assertEquals("methodical", summary.getDominantStyle());
        assertEquals(2, summary.getStyleBreakdown().get("modular"));
        assertEquals(2.0, summary.getAccumulatedDeltas().get(Skill.API_DESIGN), 1e-9);
        assertEquals(CloseReason.ENDED_BY_CLIENT, summary.getCloseReason());
    }

    @Test
    void testEndSession_PublishesEventAndQueuesPersistence() {
        // Given
        String id = sessionManager.startSession("alice", SessionMetadata.empty());

        // When
        sessionManager.endSession(id);

        // Then
        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(events).publishEvent(event.capture());
        assertTrue(event.getValue() instanceof SessionClosedEvent);
        assertEquals(id, ((SessionClosedEvent) event.getValue()).getSessionId());
        verify(store, never()).saveSession(any());

        workQueue.drainPending();
        ArgumentCaptor<SessionRecord> record = ArgumentCaptor.forClass(SessionRecord.class);
        verify(store).saveSession(record.capture());
        assertEquals(id, record.getValue().getSessionId());
        assertEquals("ended_by_client", record.getValue().getCloseReason());
    }

    @Test
    void testEndSession_ListenerFailureDoesNotFailClose() {
        // Given
        String id = sessionManager.startSession("alice", SessionMetadata.empty());
        doThrow(new IllegalStateException("listener broke")).when(events).publishEvent(any(Object.class));

        // When
        SessionSummary summary = sessionManager.endSession(id);

        // Then
        assertEquals(id, summary.getSessionId());
        assertEquals(0, sessionManager.openSessionCount());
    }

    @Test
    void testReapIdleSessions_ClosesOnlyIdleSessions() {
        // Given
        String idle = sessionManager.startSession("alice", SessionMetadata.empty());
        clock.advance(Duration.ofMinutes(11));
        String fresh = sessionManager.startSession("bob", SessionMetadata.empty());

        // When
        int closed = sessionManager.reapIdleSessions();

        // Then
        assertEquals(1, closed);
        assertThrows(SessionNotFoundException.class, () -> sessionManager.requireOpen(idle));
        assertEquals("bob", sessionManager.requireOpen(fresh));

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(events).publishEvent(event.capture());
        SessionClosedEvent closedEvent = (SessionClosedEvent) event.getValue();
        assertEquals(CloseReason.IDLE_TIMEOUT, closedEvent.getSnapshot().getSummary().getCloseReason());
    }

    @Test
    void testReapIdleSessions_ActivityKeepsSessionOpen() {
        // Given
        String id = sessionManager.startSession("alice", SessionMetadata.empty());
        clock.advance(Duration.ofMinutes(9));
        sessionManager.processStream(id, sample(5), analysis("modular"));
        clock.advance(Duration.ofMinutes(9));

        // When
        int closed = sessionManager.reapIdleSessions();

        // Then
        assertEquals(0, closed);
        assertEquals("alice", sessionManager.requireOpen(id));
    }

    @Test
    void testEndSession_RacingClosersOnlyOneWins() throws Exception {
        // Given
        String id = sessionManager.startSession("alice", SessionMetadata.empty());
        clock.advance(Duration.ofMinutes(30));
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger wins = new AtomicInteger();
        AtomicInteger notFound = new AtomicInteger();
        List<Runnable> tasks = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            boolean reaper = i % 2 == 0;
            tasks.add(() -> {
                try {
                    go.await();
                    if (reaper) {
                        wins.addAndGet(sessionManager.reapIdleSessions());
                    } else {
                        sessionManager.endSession(id);
                        wins.incrementAndGet();
                    }
                } catch (SessionNotFoundException e) {
                    notFound.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }

        // When
        tasks.forEach(pool::submit);
        go.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        // Then
        assertEquals(1, wins.get());
        verify(events, times(1)).publishEvent(any(Object.class));
    }
}
