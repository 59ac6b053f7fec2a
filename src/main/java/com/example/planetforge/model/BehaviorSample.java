package com.example.planetforge.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

import java.time.Instant;

/**
 * Digest of one scored sample as kept in a session's history.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BehaviorSample {
    Instant timestamp;
    String language;
    int lines;
    int functions;
    int comments;
    double complexity;
    double commentRatio;
    double functionDensity;
    int errorHandlers;
    int asyncMarkers;
    String styleLabel;
    SkillDeltaSet deltas;

    public static BehaviorSample of(Instant timestamp, MetricsSample sample, BehavioralAnalysis analysis) {
        return new BehaviorSample(
                timestamp,
                sample.languageOrUnknown(),
                sample.getLines(),
                sample.getFunctions(),
                sample.getComments(),
                sample.getComplexity(),
                sample.commentRatio(),
                sample.functionDensity(),
                sample.getErrorHandlers(),
                sample.getAsyncMarkers(),
                analysis.getCodingStyle(),
                analysis.getSkillDeltas());
    }
}
