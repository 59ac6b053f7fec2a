package com.example.planetforge.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of applying one delta set to a planet.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EvolutionResult {
    String planetId;
    String ownerId;
    PlanetSnapshot before;
    PlanetSnapshot after;
    boolean stageChanged;
    double pointsEarned;
    SkillDeltaSet deltas;
    @Singular
    List<Achievement> achievements;
    String eventId;
}
