package com.example.planetforge.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Behavioral metrics derived by the client from one editing burst. Numbers only; no code text.
 */
@Value
@Builder(toBuilder = true)
public class MetricsSample {
    int lines;
    int functions;
    int classes;
    int comments;
    double complexity;
    String language;
    int errorHandlers;
    int asyncMarkers;
    long editLatencyMs;
    int keystrokes;
    int charactersChanged;
    Instant timestamp;

    public double commentRatio() {
        return (double) comments / Math.max(lines, 1);
    }

    public double functionDensity() {
        return (double) functions / Math.max(lines, 1);
    }

    public String languageOrUnknown() {
        return language == null || language.isBlank() ? "unknown" : language;
    }
}
