package com.example.planetforge.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("sessions")
public class SessionRecord {
    @Id
    private String sessionId;
    @Indexed
    private String userId;
    private String editorId;
    private String language;
    private String projectName;
    private Instant startedAt;
    private Instant endedAt;
    private String status;
    private String closeReason;
    private long durationSeconds;
    private int editCount;
    private long totalCharacters;
    private long keystrokes;
    private double averageEditFrequency;
    private double typingSpeedWpm;
    private String dominantStyle;
    private Map<String, Integer> styleBreakdown;

    // Skill deltas accumulated over the session
    private Map<String, Double> skillImprovements;

    public static SessionRecord from(SessionSummary summary) {
        return SessionRecord.builder()
                .sessionId(summary.getSessionId())
                .userId(summary.getUserId())
                .editorId(summary.getEditorId())
                .language(summary.getLanguage())
                .projectName(summary.getProjectName())
                .startedAt(summary.getStartedAt())
                .endedAt(summary.getEndedAt())
                .status(SessionStatus.CLOSED.name())
                .closeReason(summary.getCloseReason() == null ? null : summary.getCloseReason().key())
                .durationSeconds(summary.getDurationSeconds())
                .editCount(summary.getEditCount())
                .totalCharacters(summary.getTotalCharacters())
                .keystrokes(summary.getKeystrokes())
                .averageEditFrequency(summary.getAverageEditFrequency())
                .typingSpeedWpm(summary.getTypingSpeedWpm())
                .dominantStyle(summary.getDominantStyle())
                .styleBreakdown(summary.getStyleBreakdown())
                .skillImprovements(summary.getAccumulatedDeltas() == null ? Map.of() : summary.getAccumulatedDeltas().asMap())
                .build();
    }
}
