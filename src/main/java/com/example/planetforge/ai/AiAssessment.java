package com.example.planetforge.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Structured reply of the AI analyzer. Skill assessment values are on a 0-100 scale and keyed by the
 * short names used in the prompt (algorithm_mastery, web_development, api_design, devops_skills, security_awareness).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AiAssessment {
    private String codingStyle;
    private List<String> personalityTraits;
    private Map<String, Double> skillAssessment;
    private PlanetCharacteristics planetCharacteristics;
    private List<String> insights;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PlanetCharacteristics {
        private String atmosphere;
        private String terrain;
    }
}
