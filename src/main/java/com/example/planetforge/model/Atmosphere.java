package com.example.planetforge.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum Atmosphere {
    CLEAR, NEON, CRYSTALLINE, STORMY, TOXIC;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Atmosphere> parse(String value) {
        if (value == null) return Optional.empty();
        for (Atmosphere a : values()) {
            if (a.key().equalsIgnoreCase(value.trim())) return Optional.of(a);
        }
        return Optional.empty();
    }
}
