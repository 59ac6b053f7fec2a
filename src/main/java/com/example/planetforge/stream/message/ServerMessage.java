package com.example.planetforge.stream.message;

import com.example.planetforge.model.Achievement;
import com.example.planetforge.model.BehavioralAnalysis;
import com.example.planetforge.model.EvolutionResult;
import com.example.planetforge.model.LiveUpdate;
import com.example.planetforge.model.SessionSummary;
import com.example.planetforge.model.StreamResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outbound envelope. Only the fields belonging to {@code type} are set.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServerMessage {

    public static final String CONNECTED = "connected";
    public static final String SESSION_STARTED = "session_started";
    public static final String ANALYSIS_UPDATE = "analysis_update";
    public static final String SESSION_ENDED = "session_ended";
    public static final String ACHIEVEMENT_UNLOCKED = "achievement_unlocked";
    public static final String PLANET_EVOLUTION = "planet_evolution";
    public static final String PONG = "pong";
    public static final String ERROR = "error";

    String type;
    String userId;
    String sessionId;
    BehavioralAnalysis analysis;
    LiveUpdate live;
    EvolutionResult evolution;
    SessionSummary summary;
    String reason;
    Achievement achievement;
    String message;
    Instant timestamp;

    public static ServerMessage connected(String userId, Instant now) {
        return ServerMessage.builder().type(CONNECTED).userId(userId).timestamp(now).build();
    }

    public static ServerMessage sessionStarted(String sessionId) {
        return ServerMessage.builder().type(SESSION_STARTED).sessionId(sessionId).build();
    }

    public static ServerMessage analysisUpdate(StreamResult result) {
        return ServerMessage.builder()
                .type(ANALYSIS_UPDATE)
                .sessionId(result.getSessionId())
                .analysis(result.getAnalysis())
                .live(result.getLive())
                .evolution(result.getEvolution())
                .build();
    }

    public static ServerMessage sessionEnded(SessionSummary summary) {
        return ServerMessage.builder()
                .type(SESSION_ENDED)
                .sessionId(summary.getSessionId())
                .summary(summary)
                .reason(summary.getCloseReason() == null ? null : summary.getCloseReason().key())
                .build();
    }

    public static ServerMessage achievementUnlocked(String sessionId, Achievement achievement) {
        return ServerMessage.builder().type(ACHIEVEMENT_UNLOCKED).sessionId(sessionId).achievement(achievement).build();
    }

    public static ServerMessage planetEvolution(String sessionId, EvolutionResult evolution) {
        return ServerMessage.builder().type(PLANET_EVOLUTION).sessionId(sessionId).evolution(evolution).build();
    }

    public static ServerMessage pong(Instant now) {
        return ServerMessage.builder().type(PONG).timestamp(now).build();
    }

    public static ServerMessage error(String message) {
        return ServerMessage.builder().type(ERROR).message(message).build();
    }
}
