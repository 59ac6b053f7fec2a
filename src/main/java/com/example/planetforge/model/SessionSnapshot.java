package com.example.planetforge.model;

import lombok.Value;

import java.util.List;

/**
 * Read-only view of a closed session handed to the evolution engine.
 */
@Value
public class SessionSnapshot {
    SessionSummary summary;
    List<BehaviorSample> samples;

    public SessionSnapshot(SessionSummary summary, List<BehaviorSample> samples) {
        this.summary = summary;
        this.samples = List.copyOf(samples);
    }
}
