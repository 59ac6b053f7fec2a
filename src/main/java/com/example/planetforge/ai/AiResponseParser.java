package com.example.planetforge.ai;

import com.example.planetforge.error.AnalysisUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Pulls the JSON object out of a chat completion (bare, or wrapped in a markdown fence) and validates it.
 */
public class AiResponseParser {

    private final ObjectMapper objectMapper;

    public AiResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public AiAssessment parse(String content) {
        if (content == null || content.isBlank()) {
            throw new AnalysisUnavailableException("AI analyzer returned an empty reply");
        }
        String json = extractJson(content);
        AiAssessment assessment;
        try {
            assessment = objectMapper.readValue(json, AiAssessment.class);
        } catch (JsonProcessingException e) {
            throw new AnalysisUnavailableException("AI analyzer reply is not valid JSON", e);
        }
        validate(assessment);
        return assessment;
    }

    static String extractJson(String content) {
        String body = content;
        int fence = body.indexOf("```json");
        if (fence >= 0) {
            int start = fence + 7;
            int end = body.indexOf("```", start);
            body = end > start ? body.substring(start, end) : body.substring(start);
        } else if ((fence = body.indexOf("```")) >= 0) {
            int start = fence + 3;
            int end = body.indexOf("```", start);
            body = end > start ? body.substring(start, end) : body.substring(start);
        }
        return body.trim();
    }

    private static void validate(AiAssessment assessment) {
        if (assessment.getSkillAssessment() == null || assessment.getSkillAssessment().isEmpty()) {
            throw new AnalysisUnavailableException("AI analyzer reply has no skill assessment");
        }
        for (var entry : assessment.getSkillAssessment().entrySet()) {
            Double v = entry.getValue();
            if (v == null || v.isNaN() || v < 0 || v > 100) {
                throw new AnalysisUnavailableException(
                        "AI skill score out of range for " + entry.getKey() + ": " + v);
            }
        }
    }
}
