package com.example.planetforge.service;

import com.example.planetforge.model.BehaviorSample;
import com.example.planetforge.model.BehavioralAnalysis;
import com.example.planetforge.model.CloseReason;
import com.example.planetforge.model.LiveUpdate;
import com.example.planetforge.model.MetricsSample;
import com.example.planetforge.model.SessionMetadata;
import com.example.planetforge.model.SessionSnapshot;
import com.example.planetforge.model.SessionStatus;
import com.example.planetforge.model.SessionSummary;
import com.example.planetforge.model.SessionView;
import com.example.planetforge.model.SkillDeltaSet;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One open or closed coding session. All state changes go through this object's monitor;
 * once {@link #close} succeeds every later mutation is refused.
 */
final class CodingSession {

    private final String sessionId;
    private final String userId;
    private final String editorId;
    private final String projectName;
    private final Instant startedAt;
    private final String streamKey;

    private String language;
    private SessionStatus status = SessionStatus.OPEN;
    private int editCount;
    private long totalCharacters;
    private long keystrokes;
    private Instant lastActivityAt;
    private BehavioralAnalysis latest;
    private final List<BehaviorSample> samples = new ArrayList<>();

    CodingSession(String sessionId, String userId, String streamKey, SessionMetadata metadata, Instant now) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.streamKey = streamKey;
        this.editorId = metadata.editorIdOrDefault();
        this.projectName = metadata.getProjectName();
        this.language = metadata.getLanguage();
        this.startedAt = now;
        this.lastActivityAt = now;
    }

    String sessionId() {
        return sessionId;
    }

    String userId() {
        return userId;
    }

    String streamKey() {
        return streamKey;
    }

    synchronized boolean isOpen() {
        return status == SessionStatus.OPEN;
    }

    synchronized boolean isIdleSince(Instant cutoff) {
        return status == SessionStatus.OPEN && lastActivityAt.isBefore(cutoff);
    }

    /**
     * @return the live counters, or null when the session is already closed
     */
    synchronized LiveUpdate record(MetricsSample sample, BehavioralAnalysis analysis, Instant now) {
        if (status != SessionStatus.OPEN) {
            return null;
        }
        editCount++;
        totalCharacters += Math.max(0, sample.getCharactersChanged());
        keystrokes += Math.max(0, sample.getKeystrokes());
        if (sample.getLanguage() != null && !sample.getLanguage().isBlank()) {
            language = sample.getLanguage();
        }
        lastActivityAt = now;
        latest = analysis;
        samples.add(BehaviorSample.of(now, sample, analysis));
        return LiveUpdate.builder()
                .sessionId(sessionId)
                .userId(userId)
                .editCount(editCount)
                .totalCharacters(totalCharacters)
                .keystrokes(keystrokes)
                .lastActivityAt(lastActivityAt)
                .latest(latest)
                .build();
    }

    /**
     * Transitions OPEN to CLOSED and builds the summary.
     *
     * @return the snapshot, or null when the session was already closed
     */
    synchronized SessionSnapshot close(CloseReason reason, Instant now) {
        if (status != SessionStatus.OPEN) {
            return null;
        }
        status = SessionStatus.CLOSED;
        return new SessionSnapshot(summarize(reason, now), samples);
    }

    synchronized SessionView view() {
        return new SessionView(sessionId, userId, editorId, language, startedAt, lastActivityAt, editCount, status);
    }

    private SessionSummary summarize(CloseReason reason, Instant endedAt) {
        Duration duration = Duration.between(startedAt, endedAt);
        long seconds = Math.max(0, duration.getSeconds());
        double minutes = duration.toMillis() / 60_000.0;

        Map<String, Integer> styles = new LinkedHashMap<>();
        SkillDeltaSet accumulated = SkillDeltaSet.empty();
        for (BehaviorSample s : samples) {
            styles.merge(s.getStyleLabel(), 1, Integer::sum);
            accumulated = accumulated.plus(s.getDeltas());
        }
        String dominant = styles.entrySet().stream()
                .max(Map.Entry.<String, Integer>comparingByValue().thenComparing(Map.Entry.comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey)
                .orElse(null);

        return SessionSummary.builder()
                .sessionId(sessionId)
                .userId(userId)
                .editorId(editorId)
                .language(language)
                .projectName(projectName)
                .startedAt(startedAt)
                .endedAt(endedAt)
                .durationSeconds(seconds)
                .editCount(editCount)
                .totalCharacters(totalCharacters)
                .keystrokes(keystrokes)
                .averageEditFrequency(minutes > 0 ? editCount / minutes : 0.0)
                .typingSpeedWpm(minutes > 0 ? (totalCharacters / 5.0) / minutes : 0.0)
                .dominantStyle(dominant)
                .styleBreakdown(styles)
                .accumulatedDeltas(accumulated)
                .closeReason(reason)
                .build();
    }
}
