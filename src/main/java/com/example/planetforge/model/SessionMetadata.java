package com.example.planetforge.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionMetadata {

    public static final String DEFAULT_EDITOR = "default";

    private String editorId;
    private String language;
    private String projectName;

    public String editorIdOrDefault() {
        return editorId == null || editorId.isBlank() ? DEFAULT_EDITOR : editorId;
    }

    public static SessionMetadata empty() {
        return new SessionMetadata();
    }
}
