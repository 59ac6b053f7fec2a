package com.example.planetforge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The five tracked skills. Keys are the wire and storage names.
 */
public enum Skill {
    ALGORITHM_MASTERY("algorithm_mastery"),
    WEB_DEVELOPMENT("web_development_skill"),
    API_DESIGN("api_design_discipline"),
    DEVOPS_MATURITY("devops_maturity"),
    SECURITY_AWARENESS("security_awareness");

    private final String key;

    Skill(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static Skill fromKey(String key) {
        String normalized = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
        for (Skill skill : values()) {
            if (skill.key.equals(normalized) || skill.name().equalsIgnoreCase(normalized)) {
                return skill;
            }
        }
        throw new IllegalArgumentException("Unknown skill: " + key);
    }
}
