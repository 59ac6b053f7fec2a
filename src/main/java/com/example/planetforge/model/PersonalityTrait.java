package com.example.planetforge.model;

import java.util.Locale;

/**
 * Personality traits folded into a planet from closed sessions, each scored in [0, 1].
 */
public enum PersonalityTrait {
    DOCUMENTATION_INCLINATION,
    MODULARITY,
    COMPLEXITY_APPETITE,
    RESILIENCE,
    CONCURRENCY_AFFINITY;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
