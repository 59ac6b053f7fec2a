package com.example.planetforge.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Developer profile derived from one scored sample: an archetype named after the coding style,
 * a complexity band, how fast the sample moved the planet and how strongly each skill area was exercised.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CodingGenome {

    public static final String DEFAULT_ARCHETYPE = "The Builder";

    private static final Map<String, String> ARCHETYPES = Map.of(
            "methodical", "The Architect",
            "pragmatic", "The Builder",
            "artistic", "The Visionary",
            "complex", "The Explorer",
            "minimal", "The Zen Master");

    private String primaryArchetype;
    private String codingStyle;
    private String complexityPreference;
    // in [0, 1]
    private double learningVelocity;
    // affinity area -> [0, 1]
    private Map<String, Double> skillAffinities;
    private double evolutionPotential;

    public static CodingGenome derive(String codingStyle, double complexity, SkillDeltaSet deltas) {
        double points = deltas.total();
        Map<String, Double> affinities = new LinkedHashMap<>();
        affinities.put("algorithms", affinity(deltas.get(Skill.ALGORITHM_MASTERY)));
        affinities.put("systems", affinity(deltas.get(Skill.API_DESIGN)));
        affinities.put("ui", affinity(deltas.get(Skill.WEB_DEVELOPMENT)));
        affinities.put("devops", affinity(deltas.get(Skill.DEVOPS_MATURITY)));
        affinities.put("security", affinity(deltas.get(Skill.SECURITY_AWARENESS)));
        return CodingGenome.builder()
                .primaryArchetype(archetypeFor(codingStyle))
                .codingStyle(codingStyle)
                .complexityPreference(complexityBand(complexity))
                .learningVelocity(Math.min(points / 10.0, 1.0))
                .skillAffinities(affinities)
                .evolutionPotential(points)
                .build();
    }

    public static String archetypeFor(String codingStyle) {
        if (codingStyle == null) {
            return DEFAULT_ARCHETYPE;
        }
        return ARCHETYPES.getOrDefault(codingStyle.toLowerCase(Locale.ROOT), DEFAULT_ARCHETYPE);
    }

    static String complexityBand(double complexity) {
        if (complexity > 8) {
            return "high";
        }
        if (complexity > 4) {
            return "moderate_to_high";
        }
        return "simple_solutions";
    }

    private static double affinity(double delta) {
        return Math.min(delta / 5.0, 1.0);
    }
}
