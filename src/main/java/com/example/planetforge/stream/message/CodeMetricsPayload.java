package com.example.planetforge.stream.message;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Client-computed structural metrics of an editing burst. Boxed so absent fields can be told apart from zero.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CodeMetricsPayload {
    private Integer lines;
    private Integer functions;
    private Integer classes;
    private Integer comments;
    private Double complexity;
    private String language;
    private Integer errorHandlers;
    private Integer asyncMarkers;
}
