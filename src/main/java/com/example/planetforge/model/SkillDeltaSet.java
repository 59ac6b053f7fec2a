package com.example.planetforge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable per-sample skill increments. Every skill is present; negative or non-finite inputs are stored as 0.
 */
public final class SkillDeltaSet {

    private static final SkillDeltaSet EMPTY = new SkillDeltaSet(Map.of());

    private final EnumMap<Skill, Double> deltas = new EnumMap<>(Skill.class);

    private SkillDeltaSet(Map<Skill, Double> values) {
        for (Skill skill : Skill.values()) {
            Double v = values.get(skill);
            deltas.put(skill, sanitize(v));
        }
    }

    public static SkillDeltaSet empty() {
        return EMPTY;
    }

    public static SkillDeltaSet of(Map<Skill, Double> values) {
        return new SkillDeltaSet(values == null ? Map.of() : values);
    }

    /** Builds a delta set where every skill receives the same increment. */
    public static SkillDeltaSet uniform(double value) {
        Map<Skill, Double> values = new EnumMap<>(Skill.class);
        for (Skill skill : Skill.values()) {
            values.put(skill, value);
        }
        return new SkillDeltaSet(values);
    }

    @JsonCreator
    public static SkillDeltaSet fromKeys(Map<String, Double> values) {
        Map<Skill, Double> parsed = new EnumMap<>(Skill.class);
        if (values != null) {
            values.forEach((k, v) -> parsed.put(Skill.fromKey(k), v));
        }
        return new SkillDeltaSet(parsed);
    }

    public double get(Skill skill) {
        return deltas.get(skill);
    }

    public double total() {
        double sum = 0.0;
        for (double v : deltas.values()) {
            sum += v;
        }
        return sum;
    }

    public SkillDeltaSet plus(SkillDeltaSet other) {
        Map<Skill, Double> merged = new EnumMap<>(Skill.class);
        for (Skill skill : Skill.values()) {
            merged.put(skill, get(skill) + other.get(skill));
        }
        return new SkillDeltaSet(merged);
    }

    public SkillDeltaSet capped(double cap) {
        Map<Skill, Double> capped = new EnumMap<>(Skill.class);
        for (Skill skill : Skill.values()) {
            capped.put(skill, Math.min(get(skill), cap));
        }
        return new SkillDeltaSet(capped);
    }

    @JsonValue
    public Map<String, Double> asMap() {
        Map<String, Double> out = new LinkedHashMap<>();
        deltas.forEach((k, v) -> out.put(k.key(), v));
        return Collections.unmodifiableMap(out);
    }

    private static double sanitize(Double v) {
        if (v == null || v.isNaN() || v.isInfinite() || v < 0) {
            return 0.0;
        }
        return v;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SkillDeltaSet)) return false;
        return deltas.equals(((SkillDeltaSet) o).deltas);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deltas);
    }

    @Override
    public String toString() {
        return "SkillDeltaSet" + asMap();
    }
}
