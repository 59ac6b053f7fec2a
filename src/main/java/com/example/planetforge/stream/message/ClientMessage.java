package com.example.planetforge.stream.message;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Inbound envelope, tagged by {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StartSessionMessage.class, name = StartSessionMessage.TYPE),
        @JsonSubTypes.Type(value = CodeStreamMessage.class, name = CodeStreamMessage.TYPE),
        @JsonSubTypes.Type(value = EndSessionMessage.class, name = EndSessionMessage.TYPE),
        @JsonSubTypes.Type(value = PingMessage.class, name = PingMessage.TYPE)
})
public abstract class ClientMessage {

    public abstract String type();
}
