package com.example.planetforge.service;

import com.example.planetforge.model.EvolutionStage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Step function from mean skill level to {@link EvolutionStage}.
 * Threshold {@code i} is the lowest mean that reaches stage {@code i + 1}.
 */
@Component
public class EvolutionStageTable {

    public static final List<Double> DEFAULT_THRESHOLDS = List.of(20.0, 40.0, 60.0, 80.0);

    private final List<Double> thresholds;

    public EvolutionStageTable(@Value("${app.evolution.stage-thresholds:20,40,60,80}") List<Double> thresholds) {
        int expected = EvolutionStage.values().length - 1;
        if (thresholds == null || thresholds.size() != expected) {
            throw new IllegalArgumentException("Expected " + expected + " stage thresholds, got " + thresholds);
        }
        for (int i = 1; i < thresholds.size(); i++) {
            if (thresholds.get(i) <= thresholds.get(i - 1)) {
                throw new IllegalArgumentException("Stage thresholds must be strictly ascending: " + thresholds);
            }
        }
        this.thresholds = List.copyOf(thresholds);
    }

    public static EvolutionStageTable defaults() {
        return new EvolutionStageTable(DEFAULT_THRESHOLDS);
    }

    public EvolutionStage stageFor(double meanSkill) {
        EvolutionStage[] stages = EvolutionStage.values();
        for (int i = 0; i < thresholds.size(); i++) {
            if (meanSkill < thresholds.get(i)) {
                return stages[i];
            }
        }
        return stages[stages.length - 1];
    }

    public List<Double> getThresholds() {
        return thresholds;
    }
}
