package com.example.planetforge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Scorer output for one metrics sample.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BehavioralAnalysis {

    public static final String METHOD_AI = "ai";
    public static final String METHOD_FALLBACK = "fallback_heuristic";

    SkillDeltaSet skillDeltas;
    String codingStyle;
    BehavioralPatterns behavioralPatterns;
    @Singular
    List<String> suggestions;
    @Singular
    List<String> insights;
    PlanetTraitUpdate planetUpdates;
    CodingGenome genome;
    String analysisMethod;

    public double getEvolutionPoints() {
        return skillDeltas.total();
    }
}
