package com.example.planetforge.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Counters of an open session right after a sample was accepted, plus the scorer output for that sample.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LiveUpdate {
    String sessionId;
    String userId;
    int editCount;
    long totalCharacters;
    long keystrokes;
    Instant lastActivityAt;
    BehavioralAnalysis latest;
}
