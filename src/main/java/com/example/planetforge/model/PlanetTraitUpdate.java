package com.example.planetforge.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

/**
 * Visual trait changes suggested by the AI analyzer. Either field may be null.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PlanetTraitUpdate {
    Terrain terrain;
    Atmosphere atmosphere;

    public boolean isEmpty() {
        return terrain == null && atmosphere == null;
    }
}
