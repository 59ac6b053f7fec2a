package com.example.planetforge.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionSummary {
    String sessionId;
    String userId;
    String editorId;
    String language;
    String projectName;
    Instant startedAt;
    Instant endedAt;
    long durationSeconds;
    int editCount;
    long totalCharacters;
    long keystrokes;
    /** Accepted samples per minute. */
    double averageEditFrequency;
    /** Words per minute, five characters to a word. */
    double typingSpeedWpm;
    String dominantStyle;
    Map<String, Integer> styleBreakdown;
    SkillDeltaSet accumulatedDeltas;
    CloseReason closeReason;
}
