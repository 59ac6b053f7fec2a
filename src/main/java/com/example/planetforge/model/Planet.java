package com.example.planetforge.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("planets")
public class Planet {
    @Id
    private String id;
    @Indexed(unique = true)
    private String ownerId;
    private String name;
    private Terrain terrain;
    private Atmosphere atmosphere;
    // keyed by Skill.key(), values in [0, 100]
    private Map<String, Double> skills;
    private EvolutionStage stage;
    // exact running total; evolutionPoints is its floor
    private double evolutionScore;
    private long evolutionPoints;
    private Map<String, Double> personalityTraits;
    private Set<String> achievements;
    private long totalCodingSeconds;
    private int sessionCount;
    private CodingGenome genome;
    // bumped on every change; durable writes carrying a lower revision are discarded
    private long revision;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastActivityAt;

    /** Planet ids are derived from the owner so a planet created while storage is down upserts onto the stored one. */
    public static String idFor(String ownerId) {
        return UUID.nameUUIDFromBytes(("planet:" + ownerId).getBytes(StandardCharsets.UTF_8)).toString();
    }

    public static Planet newborn(String ownerId, Instant now) {
        Map<String, Double> skills = new LinkedHashMap<>();
        for (Skill skill : Skill.values()) {
            skills.put(skill.key(), 0.0);
        }
        return Planet.builder()
                .id(idFor(ownerId))
                .ownerId(ownerId)
                .name("World of " + ownerId)
                .terrain(Terrain.ROCKY)
                .atmosphere(Atmosphere.CLEAR)
                .skills(skills)
                .stage(EvolutionStage.PROTOPLANET)
                .evolutionScore(0.0)
                .evolutionPoints(0L)
                .personalityTraits(new LinkedHashMap<>())
                .achievements(new LinkedHashSet<>())
                .createdAt(now)
                .updatedAt(now)
                .lastActivityAt(now)
                .build();
    }

    public double skill(Skill skill) {
        if (skills == null) return 0.0;
        Double v = skills.get(skill.key());
        return v == null ? 0.0 : v;
    }

    public Map<Skill, Double> skillLevels() {
        Map<Skill, Double> levels = new EnumMap<>(Skill.class);
        for (Skill skill : Skill.values()) {
            levels.put(skill, skill(skill));
        }
        return levels;
    }

    public double meanSkill() {
        double sum = 0.0;
        for (Skill skill : Skill.values()) {
            sum += skill(skill);
        }
        return sum / Skill.values().length;
    }

    public void addPoints(double points) {
        evolutionScore += points;
        evolutionPoints = (long) Math.floor(evolutionScore);
    }

    /** Marks a change made at {@code now}. */
    public void touch(Instant now) {
        revision++;
        updatedAt = now;
    }

    public boolean hasAchievement(String achievementId) {
        return achievements != null && achievements.contains(achievementId);
    }

    public PlanetSnapshot snapshot() {
        Map<String, Double> copy = new LinkedHashMap<>();
        for (Skill skill : Skill.values()) {
            copy.put(skill.key(), skill(skill));
        }
        return new PlanetSnapshot(copy, stage, meanSkill(), evolutionPoints);
    }

    /** Deep copy; the returned planet shares no maps with this one. */
    public Planet copy() {
        return Planet.builder()
                .id(id)
                .ownerId(ownerId)
                .name(name)
                .terrain(terrain)
                .atmosphere(atmosphere)
                .skills(skills == null ? new LinkedHashMap<>() : new LinkedHashMap<>(skills))
                .stage(stage)
                .evolutionScore(evolutionScore)
                .evolutionPoints(evolutionPoints)
                .personalityTraits(personalityTraits == null ? new LinkedHashMap<>() : new LinkedHashMap<>(personalityTraits))
                .achievements(achievements == null ? new LinkedHashSet<>() : new LinkedHashSet<>(achievements))
                .totalCodingSeconds(totalCodingSeconds)
                .sessionCount(sessionCount)
                .genome(genome)
                .revision(revision)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .lastActivityAt(lastActivityAt)
                .build();
    }
}
