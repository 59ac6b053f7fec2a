package com.example.planetforge.service;

import com.example.planetforge.model.Achievement;
import com.example.planetforge.model.MetricsSample;

/**
 * Fixed achievement table, evaluated on every delta application against the sample that produced it.
 */
public enum AchievementRule {

    DOCUMENTATION_CHAMPION("documentation_champion", "Documentation Champion",
            "Maintained excellent code documentation", 50,
            (sample, points, stageChanged) -> sample != null && sample.commentRatio() > 0.2),

    PRODUCTIVITY_BURST("productivity_burst", "Productivity Burst",
            "Achieved high learning velocity", 25,
            (sample, points, stageChanged) -> points > 3.0),

    STAGE_ASCENSION("stage_ascension", "Stage Ascension",
            "Planet evolved to a new stage", 40,
            (sample, points, stageChanged) -> stageChanged),

    POLYGLOT_SPARK("polyglot_spark", "Polyglot Spark",
            "Shipped asynchronous web code", 30,
            (sample, points, stageChanged) -> sample != null && sample.getAsyncMarkers() > 0
                    && BehavioralScorer.isWebLanguage(sample.getLanguage()));

    @FunctionalInterface
    interface Condition {
        boolean test(MetricsSample sample, double pointsEarned, boolean stageChanged);
    }

    private final String id;
    private final String title;
    private final String description;
    private final int points;
    private final Condition condition;

    AchievementRule(String id, String title, String description, int points, Condition condition) {
        this.id = id;
        this.title = title;
        this.description = description;
        this.points = points;
        this.condition = condition;
    }

    public String id() {
        return id;
    }

    /**
     * @param sample the triggering sample, null when deltas were applied directly
     * @param pointsEarned points earned by the application being evaluated
     * @param stageChanged whether that application advanced the stage
     */
    public boolean matches(MetricsSample sample, double pointsEarned, boolean stageChanged) {
        return condition.test(sample, pointsEarned, stageChanged);
    }

    public Achievement toAchievement() {
        return new Achievement(id, title, description, points);
    }
}
