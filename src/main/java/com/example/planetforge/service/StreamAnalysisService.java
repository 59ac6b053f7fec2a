package com.example.planetforge.service;

import com.example.planetforge.error.SessionNotFoundException;
import com.example.planetforge.model.BehavioralAnalysis;
import com.example.planetforge.model.EvolutionResult;
import com.example.planetforge.model.LiveUpdate;
import com.example.planetforge.model.MetricsSample;
import com.example.planetforge.model.SessionMetadata;
import com.example.planetforge.model.SessionSummary;
import com.example.planetforge.model.StreamResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Per-sample pipeline: session check, scoring, session counters, then the planet.
 */
@Service
public class StreamAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(StreamAnalysisService.class);

    private final SessionManager sessionManager;
    private final BehavioralScorer scorer;
    private final EvolutionEngine evolutionEngine;

    public StreamAnalysisService(SessionManager sessionManager, BehavioralScorer scorer, EvolutionEngine evolutionEngine) {
        this.sessionManager = sessionManager;
        this.scorer = scorer;
        this.evolutionEngine = evolutionEngine;
    }

    /**
     * @throws SessionNotFoundException when the session is unknown or already closed
     */
    public StreamResult analyze(String sessionId, MetricsSample sample) {
        String userId = sessionManager.requireOpen(sessionId);
        BehavioralAnalysis analysis = scorer.score(sample);
        // the session may close while scoring; processStream then refuses the sample and the planet is untouched
        LiveUpdate live = sessionManager.processStream(sessionId, sample, analysis);
        EvolutionResult evolution = evolutionEngine.applySample(userId, sample, analysis);
        logger.debug("Session {} sample scored {} ({}), planet {} -> {}", sessionId,
                analysis.getEvolutionPoints(), analysis.getAnalysisMethod(),
                evolution.getBefore().getStage().key(), evolution.getAfter().getStage().key());
        return StreamResult.builder()
                .sessionId(sessionId)
                .analysis(analysis)
                .live(live)
                .evolution(evolution)
                .build();
    }

    /**
     * Opens a session, analyzes one sample and closes the session again.
     */
    public StreamResult analyzeOnce(String userId, SessionMetadata metadata, MetricsSample sample) {
        String sessionId = sessionManager.startSession(userId, metadata);
        StreamResult result;
        try {
            result = analyze(sessionId, sample);
        } catch (RuntimeException e) {
            closeQuietly(sessionId);
            throw e;
        }
        SessionSummary summary = sessionManager.endSession(sessionId);
        return StreamResult.builder()
                .sessionId(sessionId)
                .analysis(result.getAnalysis())
                .live(result.getLive())
                .evolution(result.getEvolution())
                .summary(summary)
                .build();
    }

    private void closeQuietly(String sessionId) {
        try {
            sessionManager.endSession(sessionId);
        } catch (SessionNotFoundException e) {
            logger.debug("Single-shot session {} already closed", sessionId);
        }
    }
}
