package com.example.planetforge.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("evolution_events")
@CompoundIndex(name = "planet_time", def = "{'planetId': 1, 'createdAt': -1}")
public class EvolutionEvent {

    public static final String TYPE_SKILL_GROWTH = "skill_growth";
    public static final String TYPE_STAGE_EVOLUTION = "stage_evolution";

    @Id
    private String id;
    private String planetId;
    private String ownerId;
    private String eventType; // skill_growth | stage_evolution
    private String description;
    private double pointsEarned;
    private Map<String, Double> deltas;
    private PlanetSnapshot previousState;
    private PlanetSnapshot newState;
    private Instant createdAt;
}
