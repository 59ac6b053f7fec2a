package com.example.planetforge.ai;

import com.example.planetforge.model.MetricsSample;

/**
 * External behavioral classifier. Callers bound each call with a timeout and treat any exception as "unavailable".
 */
public interface AiAnalyzer {

    boolean isAvailable();

    /**
     * @throws com.example.planetforge.error.AnalysisUnavailableException when the analyzer cannot answer
     */
    AiAssessment analyze(MetricsSample sample);
}
