package com.example.planetforge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ordered evolution stages, lowest first. Thresholds live in {@link com.example.planetforge.service.EvolutionStageTable}.
 */
public enum EvolutionStage {
    PROTOPLANET,
    YOUNG_WORLD,
    MATURE_PLANET,
    ANCIENT_WORLD,
    TRANSCENDED;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EvolutionStage fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isAfter(EvolutionStage other) {
        return ordinal() > other.ordinal();
    }
}
