package com.example.planetforge.stream.message;

import com.example.planetforge.model.SessionMetadata;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class StartSessionMessage extends ClientMessage {

    public static final String TYPE = "start_session";

    private SessionMetadata metadata;

    public StartSessionMessage(SessionMetadata metadata) {
        this.metadata = metadata;
    }

    @Override
    public String type() {
        return TYPE;
    }
}
