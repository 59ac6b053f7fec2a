package com.example.planetforge.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum Terrain {
    ROCKY, LIQUID, CRYSTALLINE, VOLCANIC, METALLIC;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Lenient lookup for values coming from the AI analyzer. */
    public static Optional<Terrain> parse(String value) {
        if (value == null) return Optional.empty();
        for (Terrain t : values()) {
            if (t.key().equalsIgnoreCase(value.trim())) return Optional.of(t);
        }
        return Optional.empty();
    }
}
