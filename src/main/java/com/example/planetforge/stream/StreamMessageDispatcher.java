package com.example.planetforge.stream;

import com.example.planetforge.error.DuplicateSessionException;
import com.example.planetforge.error.MessageDecodingException;
import com.example.planetforge.error.SessionNotFoundException;
import com.example.planetforge.model.Achievement;
import com.example.planetforge.model.MetricsSample;
import com.example.planetforge.model.SessionSummary;
import com.example.planetforge.model.StreamResult;
import com.example.planetforge.service.SessionManager;
import com.example.planetforge.service.StreamAnalysisService;
import com.example.planetforge.stream.message.ClientMessage;
import com.example.planetforge.stream.message.CodeStreamMessage;
import com.example.planetforge.stream.message.EndSessionMessage;
import com.example.planetforge.stream.message.PingMessage;
import com.example.planetforge.stream.message.ServerMessage;
import com.example.planetforge.stream.message.StartSessionMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Routes one inbound message of an authenticated user and returns the replies for that user, in order.
 * Failures become {@code error} replies; the connection is never closed from here.
 */
@Component
public class StreamMessageDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(StreamMessageDispatcher.class);

    private final SessionManager sessionManager;
    private final StreamAnalysisService analysisService;
    private final ConnectionRegistry registry;
    private final MessageCodec codec;
    private final Clock clock;

    public StreamMessageDispatcher(SessionManager sessionManager, StreamAnalysisService analysisService,
                                   ConnectionRegistry registry, MessageCodec codec, Clock clock) {
        this.sessionManager = sessionManager;
        this.analysisService = analysisService;
        this.registry = registry;
        this.codec = codec;
        this.clock = clock;
    }

    public List<ServerMessage> dispatch(String userId, String text) {
        ClientMessage message;
        try {
            message = codec.decode(text);
        } catch (MessageDecodingException e) {
            logger.debug("Rejected message from {}: {}", userId, e.getMessage());
            return List.of(ServerMessage.error(e.getMessage()));
        }
        return dispatch(userId, message);
    }

    public List<ServerMessage> dispatch(String userId, ClientMessage message) {
        try {
            if (message instanceof StartSessionMessage) {
                return startSession(userId, (StartSessionMessage) message);
            }
            if (message instanceof CodeStreamMessage) {
                return codeStream(userId, (CodeStreamMessage) message);
            }
            if (message instanceof EndSessionMessage) {
                return endSession(userId);
            }
            if (message instanceof PingMessage) {
                return List.of(ServerMessage.pong(clock.instant()));
            }
            return List.of(ServerMessage.error("Unsupported message type: " + message.type()));
        } catch (SessionNotFoundException e) {
            registry.clearSession(userId, e.getSessionId());
            return List.of(ServerMessage.error("Session not found or already closed: " + e.getSessionId()));
        } catch (DuplicateSessionException | MessageDecodingException e) {
            return List.of(ServerMessage.error(e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("Failed to handle {} from {}", message.type(), userId, e);
            return List.of(ServerMessage.error("Internal error handling " + message.type()));
        }
    }

    private List<ServerMessage> startSession(String userId, StartSessionMessage message) {
        String sessionId = sessionManager.startSession(userId, message.getMetadata());
        registry.bindSession(userId, sessionId);
        return List.of(ServerMessage.sessionStarted(sessionId));
    }

    private List<ServerMessage> codeStream(String userId, CodeStreamMessage message) {
        String sessionId = boundSession(userId);
        MetricsSample sample = codec.toSample(message, clock.instant());
        StreamResult result = analysisService.analyze(sessionId, sample);

        List<ServerMessage> replies = new ArrayList<>();
        replies.add(ServerMessage.analysisUpdate(result));
        for (Achievement achievement : result.getEvolution().getAchievements()) {
            replies.add(ServerMessage.achievementUnlocked(sessionId, achievement));
        }
        if (result.getEvolution().isStageChanged()) {
            replies.add(ServerMessage.planetEvolution(sessionId, result.getEvolution()));
        }
        return replies;
    }

    private List<ServerMessage> endSession(String userId) {
        String sessionId = boundSession(userId);
        SessionSummary summary = sessionManager.endSession(sessionId);
        registry.clearSession(userId, sessionId);
        return List.of(ServerMessage.sessionEnded(summary));
    }

    private String boundSession(String userId) {
        Optional<String> sessionId = registry.activeSession(userId);
        if (sessionId.isEmpty()) {
            throw new MessageDecodingException("No active session; send start_session first");
        }
        return sessionId.get();
    }
}
