package com.example.planetforge.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

import java.time.Instant;

/**
 * Status listing entry for an open session.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionView {
    String sessionId;
    String userId;
    String editorId;
    String language;
    Instant startedAt;
    Instant lastActivityAt;
    int editCount;
    SessionStatus status;
}
