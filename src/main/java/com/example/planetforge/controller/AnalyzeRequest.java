package com.example.planetforge.controller;

import com.example.planetforge.model.SessionMetadata;
import com.example.planetforge.stream.message.CodeMetricsPayload;
import com.example.planetforge.stream.message.EditMetadataPayload;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the single-shot analysis endpoint; same metric fields as a {@code code_stream} message.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AnalyzeRequest {
    private SessionMetadata metadata;
    private CodeMetricsPayload codeMetrics;
    private EditMetadataPayload editMetadata;
}
