package com.example.planetforge.service;

import com.example.planetforge.error.DuplicateSessionException;
import com.example.planetforge.error.SessionNotFoundException;
import com.example.planetforge.model.BehavioralAnalysis;
import com.example.planetforge.model.CloseReason;
import com.example.planetforge.model.LiveUpdate;
import com.example.planetforge.model.MetricsSample;
import com.example.planetforge.model.SessionMetadata;
import com.example.planetforge.model.SessionRecord;
import com.example.planetforge.model.SessionSnapshot;
import com.example.planetforge.model.SessionSummary;
import com.example.planetforge.model.SessionView;
import com.example.planetforge.store.EvolutionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Owns every open coding session.
 *
 * Sessions are keyed by a stream key: the user id when concurrent sessions are disabled, otherwise
 * user id plus editor id. At most one session per stream key is open. Closing is terminal, publishes a
 * {@link SessionClosedEvent} and queues the summary for storage without waiting on it.
 */
@Service
public class SessionManager {

    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    private final Map<String, CodingSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, String> openByStream = new ConcurrentHashMap<>();

    private final EvolutionStore store;
    private final BackgroundWorkQueue workQueue;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    @Value("${app.session.allow-concurrent:false}")
    private boolean allowConcurrent = false;

    @Value("${app.session.idle-timeout:10m}")
    private Duration idleTimeout = Duration.ofMinutes(10);

    public SessionManager(EvolutionStore store, BackgroundWorkQueue workQueue,
                          ApplicationEventPublisher events, Clock clock) {
        this.store = store;
        this.workQueue = workQueue;
        this.events = events;
        this.clock = clock;
    }

    public String startSession(String userId, SessionMetadata metadata) {
        SessionMetadata md = metadata == null ? SessionMetadata.empty() : metadata;
        String streamKey = allowConcurrent ? userId + "|" + md.editorIdOrDefault() : userId;
        String sessionId = UUID.randomUUID().toString();
        CodingSession session = new CodingSession(sessionId, userId, streamKey, md, clock.instant());

        String[] superseded = new String[1];
        openByStream.compute(streamKey, (key, existing) -> {
            if (existing != null) {
                CodingSession current = sessions.get(existing);
                if (current != null && current.isOpen()) {
                    if (!allowConcurrent) {
                        throw new DuplicateSessionException(userId, existing);
                    }
                    superseded[0] = existing;
                }
            }
            sessions.put(sessionId, session);
            return sessionId;
        });

        if (superseded[0] != null) {
            try {
                endSession(superseded[0], CloseReason.SUPERSEDED);
            } catch (SessionNotFoundException e) {
                logger.debug("Superseded session {} was already closed", superseded[0]);
            }
        }
        logger.info("Started session {} for user {} (editor={})", sessionId, userId, md.editorIdOrDefault());
        return sessionId;
    }

    /**
     * @return the owning user id of an open session
     * @throws SessionNotFoundException when the session is unknown or closed
     */
    public String requireOpen(String sessionId) {
        CodingSession session = sessions.get(sessionId);
        if (session == null || !session.isOpen()) {
            throw new SessionNotFoundException(sessionId);
        }
        return session.userId();
    }

    public LiveUpdate processStream(String sessionId, MetricsSample sample, BehavioralAnalysis analysis) {
        CodingSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        LiveUpdate update = session.record(sample, analysis, clock.instant());
        if (update == null) {
            throw new SessionNotFoundException(sessionId);
        }
        logger.debug("Session {} accepted sample #{}", sessionId, update.getEditCount());
        return update;
    }

    public SessionSummary endSession(String sessionId) {
        return endSession(sessionId, CloseReason.ENDED_BY_CLIENT);
    }

    public SessionSummary endSession(String sessionId, CloseReason reason) {
        CodingSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return terminate(session, reason);
    }

    @Scheduled(fixedDelayString = "${app.session.reaper-interval-ms:15000}",
               initialDelayString = "${app.session.reaper-interval-ms:15000}")
    public int reapIdleSessions() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        int closed = 0;
        for (CodingSession session : sessions.values()) {
            if (!session.isIdleSince(cutoff)) {
                continue;
            }
            try {
                terminate(session, CloseReason.IDLE_TIMEOUT);
                closed++;
            } catch (SessionNotFoundException e) {
                logger.debug("Session {} closed by its owner before the reaper got to it", session.sessionId());
            }
        }
        if (closed > 0) {
            logger.info("Idle reaper closed {} session(s) inactive since {}", closed, cutoff);
        }
        return closed;
    }

    public List<SessionView> activeSessions() {
        return sessions.values().stream()
                .map(CodingSession::view)
                .sorted(Comparator.comparing(SessionView::getStartedAt))
                .collect(Collectors.toList());
    }

    public Optional<SessionView> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId)).map(CodingSession::view);
    }

    public int openSessionCount() {
        return sessions.size();
    }

    private SessionSummary terminate(CodingSession session, CloseReason reason) {
        SessionSnapshot snapshot = session.close(reason, clock.instant());
        if (snapshot == null) {
            throw new SessionNotFoundException(session.sessionId());
        }
        sessions.remove(session.sessionId(), session);
        openByStream.remove(session.streamKey(), session.sessionId());

        SessionSummary summary = snapshot.getSummary();
        workQueue.submit("save session " + summary.getSessionId(),
                () -> store.saveSession(SessionRecord.from(summary)));
        try {
            events.publishEvent(new SessionClosedEvent(snapshot));
        } catch (RuntimeException e) {
            logger.warn("Session-closed listeners failed for {}", summary.getSessionId(), e);
        }
        logger.info("Closed session {} for user {} ({}, {} samples, {}s)", summary.getSessionId(),
                summary.getUserId(), reason.key(), summary.getEditCount(), summary.getDurationSeconds());
        return summary;
    }
}
