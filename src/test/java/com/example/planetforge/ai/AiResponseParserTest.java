package com.example.planetforge.ai;

import com.example.planetforge.error.AnalysisUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AiResponseParserTest {

    private static final String REPLY = "{\"coding_style\":\"modular\",\"personality_traits\":[\"curious\"],"
            + "\"skill_assessment\":{\"algorithm_mastery\":70,\"web_development\":40},"
            + "\"planet_characteristics\":{\"atmosphere\":\"calm\",\"terrain\":\"crystalline\"},"
            + "\"insights\":[\"Small focused functions\"],\"confidence\":0.8}";

    private AiResponseParser parser;

    @BeforeEach
    void setUp() {
        parser = new AiResponseParser(new ObjectMapper());
    }

    @Test
    void testParse_BareJson() {
        // When
        AiAssessment assessment = parser.parse(REPLY);

        // Then
        assertEquals("modular", assessment.getCodingStyle());
        assertEquals(70.0, assessment.getSkillAssessment().get("algorithm_mastery"));
        assertEquals("crystalline", assessment.getPlanetCharacteristics().getTerrain());
        assertEquals(1, assessment.getInsights().size());
    }

    @Test
    void testParse_FencedJson() {
        // Given
        String content = "Here is the analysis:\n```json\n" + REPLY + "\n```\nLet me know if you need more.";

        // When
        AiAssessment assessment = parser.parse(content);

        // Then
        assertEquals("calm", assessment.getPlanetCharacteristics().getAtmosphere());
    }

    @Test
    void testParse_PlainFence() {
        assertEquals("modular", parser.parse("```\n" + REPLY + "\n```").getCodingStyle());
    }

    @Test
    void testParse_InvalidJson() {
        assertThrows(AnalysisUnavailableException.class, () -> parser.parse("I think the developer is methodical."));
        assertThrows(AnalysisUnavailableException.class, () -> parser.parse(""));
    }

    @Test
    void testParse_ScoreOutOfRange() {
        assertThrows(AnalysisUnavailableException.class,
                () -> parser.parse("{\"skill_assessment\":{\"api_design\":140}}"));
        assertThrows(AnalysisUnavailableException.class,
                () -> parser.parse("{\"skill_assessment\":{\"api_design\":-5}}"));
    }

    @Test
    void testParse_MissingSkillAssessment() {
        assertThrows(AnalysisUnavailableException.class, () -> parser.parse("{\"coding_style\":\"modular\"}"));
    }
}
