package com.example.planetforge.service;

import com.example.planetforge.ai.AiAnalyzer;
import com.example.planetforge.ai.AiAssessment;
import com.example.planetforge.error.AnalysisTimeoutException;
import com.example.planetforge.error.AnalysisUnavailableException;
import com.example.planetforge.model.Atmosphere;
import com.example.planetforge.model.BehavioralAnalysis;
import com.example.planetforge.model.BehavioralPatterns;
import com.example.planetforge.model.CodingGenome;
import com.example.planetforge.model.MetricsSample;
import com.example.planetforge.model.PlanetTraitUpdate;
import com.example.planetforge.model.Skill;
import com.example.planetforge.model.SkillDeltaSet;
import com.example.planetforge.model.Terrain;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Maps a metrics sample to skill deltas, a coding style label and suggestions.
 *
 * The heuristic path is deterministic and always available. When the AI analyzer is available and answers
 * within {@code app.ai.timeout-ms}, its assessment replaces the heuristic deltas, style and planet traits.
 * Any AI failure falls back to the heuristic without surfacing an error.
 */
@Service
public class BehavioralScorer {

    private static final Logger logger = LoggerFactory.getLogger(BehavioralScorer.class);

    static final Set<String> WEB_LANGUAGES = Set.of(
            "javascript", "typescript", "html", "css", "jsx", "tsx", "vue", "svelte");

    static final Set<String> KNOWN_STYLES = Set.of(
            "methodical", "modular", "complex", "pragmatic", "artistic", "minimal");

    private static final Map<String, Skill> AI_SKILL_KEYS = Map.of(
            "algorithm_mastery", Skill.ALGORITHM_MASTERY,
            "web_development", Skill.WEB_DEVELOPMENT,
            "api_design", Skill.API_DESIGN,
            "devops_skills", Skill.DEVOPS_MATURITY,
            "security_awareness", Skill.SECURITY_AWARENESS);

    private final AiAnalyzer aiAnalyzer;
    private final ExecutorService aiExecutor;

    @Value("${app.scoring.per-sample-cap:2.0}")
    private double perSampleCap = 2.0;

    @Value("${app.ai.timeout-ms:3000}")
    private long aiTimeoutMs = 3000L;

    public BehavioralScorer(AiAnalyzer aiAnalyzer) {
        this.aiAnalyzer = aiAnalyzer;
        this.aiExecutor = Executors.newFixedThreadPool(4, r -> {
            Thread t = new Thread(r, "ai-analysis-thread");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        aiExecutor.shutdownNow();
    }

    public BehavioralAnalysis score(MetricsSample sample) {
        BehavioralAnalysis heuristic = heuristic(sample);
        if (!aiAnalyzer.isAvailable()) {
            return heuristic;
        }
        try {
            AiAssessment assessment = analyzeWithTimeout(sample);
            return enrich(assessment, heuristic);
        } catch (AnalysisTimeoutException e) {
            logger.warn("AI analysis timed out after {}ms, using heuristic scoring", aiTimeoutMs);
        } catch (AnalysisUnavailableException e) {
            logger.warn("AI analysis unavailable, using heuristic scoring: {}", e.getMessage());
        }
        return heuristic;
    }

    /**
     * Deterministic scoring; no I/O, no randomness.
     */
    public BehavioralAnalysis heuristic(MetricsSample sample) {
        double commentRatio = sample.commentRatio();
        double complexity = sample.getComplexity();
        boolean hasFunctions = sample.getFunctions() > 0;
        boolean hasClasses = sample.getClasses() > 0;
        boolean hasComments = sample.getComments() > 0;
        boolean hasErrorHandling = sample.getErrorHandlers() > 0;
        boolean hasAsync = sample.getAsyncMarkers() > 0;
        boolean web = isWebLanguage(sample.getLanguage());

        Map<Skill, Double> deltas = new EnumMap<>(Skill.class);
        deltas.put(Skill.ALGORITHM_MASTERY, 0.1 * complexity + (hasFunctions ? 0.2 : 0.0));
        deltas.put(Skill.WEB_DEVELOPMENT, (web ? 1.5 : 0.5) + (hasAsync ? 0.2 : 0.0));
        deltas.put(Skill.API_DESIGN, (hasFunctions ? 1.0 : 0.2) + (hasClasses ? 0.3 : 0.0));
        deltas.put(Skill.DEVOPS_MATURITY, 0.3 + (hasComments ? 0.1 : 0.0) + (hasAsync ? 0.2 : 0.0));
        deltas.put(Skill.SECURITY_AWARENESS, (commentRatio > 0.1 ? 0.2 : 0.1) + (hasErrorHandling ? 0.4 : 0.0));

        SkillDeltaSet capped = SkillDeltaSet.of(deltas).capped(perSampleCap);
        String style = styleLabel(sample);
        return BehavioralAnalysis.builder()
                .skillDeltas(capped)
                .codingStyle(style)
                .genome(CodingGenome.derive(style, complexity, capped))
                .behavioralPatterns(BehavioralPatterns.of(sample))
                .suggestions(suggestionsFor(sample))
                .analysisMethod(BehavioralAnalysis.METHOD_FALLBACK)
                .build();
    }

    /**
     * First matching rule wins: methodical, modular, complex, pragmatic.
     */
    static String styleLabel(MetricsSample sample) {
        if (sample.commentRatio() > 0.15) {
            return "methodical";
        }
        if (sample.functionDensity() > 0.1) {
            return "modular";
        }
        if (sample.getComplexity() > 5) {
            return "complex";
        }
        return "pragmatic";
    }

    static List<String> suggestionsFor(MetricsSample sample) {
        List<String> out = new ArrayList<>();
        if (sample.getLines() >= 20 && sample.commentRatio() < 0.05) {
            out.add("Add comments that explain the intent behind non-obvious code");
        }
        if (sample.getLines() > 50 && sample.functionDensity() < 0.02) {
            out.add("Break long stretches of code into smaller functions");
        }
        if (sample.getComplexity() > 10) {
            out.add("Reduce nesting and branching to bring complexity down");
        }
        if (sample.getLines() > 30 && sample.getErrorHandlers() == 0) {
            out.add("Handle failure paths explicitly");
        }
        return out;
    }

    static boolean isWebLanguage(String language) {
        return language != null && WEB_LANGUAGES.contains(language.trim().toLowerCase(Locale.ROOT));
    }

    private AiAssessment analyzeWithTimeout(MetricsSample sample) {
        CompletableFuture<AiAssessment> future = CompletableFuture.supplyAsync(() -> aiAnalyzer.analyze(sample), aiExecutor);
        try {
            return future.get(aiTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AnalysisTimeoutException(aiTimeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AnalysisUnavailableException) {
                throw (AnalysisUnavailableException) cause;
            }
            throw new AnalysisUnavailableException("AI analysis failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisUnavailableException("Interrupted while waiting for AI analysis", e);
        }
    }

    private BehavioralAnalysis enrich(AiAssessment assessment, BehavioralAnalysis heuristic) {
        Map<Skill, Double> deltas = new EnumMap<>(Skill.class);
        for (Skill skill : Skill.values()) {
            deltas.put(skill, heuristic.getSkillDeltas().get(skill));
        }
        assessment.getSkillAssessment().forEach((key, score) -> {
            Skill skill = AI_SKILL_KEYS.get(key.toLowerCase(Locale.ROOT));
            if (skill == null) {
                skill = lenientSkill(key);
            }
            if (skill != null) {
                deltas.put(skill, score / 10.0);
            }
        });

        String style = assessment.getCodingStyle() == null ? null : assessment.getCodingStyle().trim().toLowerCase(Locale.ROOT);
        if (style == null || !KNOWN_STYLES.contains(style)) {
            style = heuristic.getCodingStyle();
        }

        PlanetTraitUpdate traits = null;
        if (assessment.getPlanetCharacteristics() != null) {
            Terrain terrain = Terrain.parse(assessment.getPlanetCharacteristics().getTerrain()).orElse(null);
            Atmosphere atmosphere = Atmosphere.parse(assessment.getPlanetCharacteristics().getAtmosphere()).orElse(null);
            PlanetTraitUpdate update = new PlanetTraitUpdate(terrain, atmosphere);
            traits = update.isEmpty() ? null : update;
        }

        SkillDeltaSet capped = SkillDeltaSet.of(deltas).capped(perSampleCap);
        double complexity = heuristic.getBehavioralPatterns().getComplexityPreference();
        BehavioralAnalysis.BehavioralAnalysisBuilder builder = BehavioralAnalysis.builder()
                .skillDeltas(capped)
                .codingStyle(style)
                .genome(CodingGenome.derive(style, complexity, capped))
                .behavioralPatterns(heuristic.getBehavioralPatterns())
                .suggestions(heuristic.getSuggestions())
                .planetUpdates(traits)
                .analysisMethod(BehavioralAnalysis.METHOD_AI);
        if (assessment.getInsights() != null) {
            builder.insights(assessment.getInsights());
        }
        return builder.build();
    }

    private static Skill lenientSkill(String key) {
        try {
            return Skill.fromKey(key);
        } catch (IllegalArgumentException e) {
            logger.debug("Ignoring unknown AI skill key '{}'", key);
            return null;
        }
    }
}
