package com.example.planetforge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of pushing one sample through scoring, the session and the planet.
 * {@code summary} is only set by the single-shot path, which closes the session itself.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamResult {
    String sessionId;
    BehavioralAnalysis analysis;
    LiveUpdate live;
    EvolutionResult evolution;
    SessionSummary summary;
}
