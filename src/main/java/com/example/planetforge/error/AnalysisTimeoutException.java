package com.example.planetforge.error;

public class AnalysisTimeoutException extends AnalysisUnavailableException {

    public AnalysisTimeoutException(long timeoutMs) {
        super("AI analysis did not answer within " + timeoutMs + "ms");
    }
}
