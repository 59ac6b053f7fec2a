package com.example.planetforge.stream.message;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CodeStreamMessage extends ClientMessage {

    public static final String TYPE = "code_stream";

    private CodeMetricsPayload codeMetrics;
    private EditMetadataPayload editMetadata;

    @Override
    public String type() {
        return TYPE;
    }
}
