package com.example.planetforge.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BehavioralPatterns {
    double commentRatio;
    double functionDensity;
    double complexityPreference;

    public static BehavioralPatterns of(MetricsSample sample) {
        return new BehavioralPatterns(sample.commentRatio(), sample.functionDensity(), sample.getComplexity());
    }
}
