package com.example.planetforge.stream;

import com.example.planetforge.error.MessageDecodingException;
import com.example.planetforge.model.MetricsSample;
import com.example.planetforge.stream.message.ClientMessage;
import com.example.planetforge.stream.message.CodeMetricsPayload;
import com.example.planetforge.stream.message.CodeStreamMessage;
import com.example.planetforge.stream.message.EditMetadataPayload;
import com.example.planetforge.stream.message.ServerMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * JSON codec for the stream protocol. Inbound messages are validated here so nothing past the
 * boundary sees a negative count or a non-finite number.
 */
@Component
public class MessageCodec {

    static final int MAX_LANGUAGE_LENGTH = 32;

    private final ObjectMapper objectMapper;

    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @throws MessageDecodingException for malformed JSON, unknown types or invalid field values
     */
    public ClientMessage decode(String text) {
        if (text == null || text.isBlank()) {
            throw new MessageDecodingException("Empty message");
        }
        ClientMessage message;
        try {
            message = objectMapper.readValue(text, ClientMessage.class);
        } catch (InvalidTypeIdException e) {
            String typeId = e.getTypeId();
            throw new MessageDecodingException(typeId == null ? "Message has no type" : "Unknown message type: " + typeId, e);
        } catch (JsonProcessingException e) {
            throw new MessageDecodingException("Malformed message: " + e.getOriginalMessage(), e);
        }
        if (message == null) {
            throw new MessageDecodingException("Message has no type");
        }
        if (message instanceof CodeStreamMessage) {
            validate((CodeStreamMessage) message);
        }
        return message;
    }

    public String encode(ServerMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode " + message.getType() + " message", e);
        }
    }

    /**
     * Converts a validated code_stream message into a metrics sample stamped with {@code now}.
     */
    public MetricsSample toSample(CodeStreamMessage message, Instant now) {
        CodeMetricsPayload m = message.getCodeMetrics();
        EditMetadataPayload e = message.getEditMetadata();
        return MetricsSample.builder()
                .lines(orZero(m.getLines()))
                .functions(orZero(m.getFunctions()))
                .classes(orZero(m.getClasses()))
                .comments(orZero(m.getComments()))
                .complexity(m.getComplexity() == null ? 0.0 : m.getComplexity())
                .language(m.getLanguage())
                .errorHandlers(orZero(m.getErrorHandlers()))
                .asyncMarkers(orZero(m.getAsyncMarkers()))
                .editLatencyMs(e == null || e.getEditTimeMs() == null ? 0L : e.getEditTimeMs())
                .keystrokes(e == null ? 0 : orZero(e.getKeystrokes()))
                .charactersChanged(e == null ? 0 : orZero(e.getCharactersChanged()))
                .timestamp(now)
                .build();
    }

    public static void validate(CodeStreamMessage message) {
        CodeMetricsPayload m = message.getCodeMetrics();
        if (m == null) {
            throw new MessageDecodingException("code_stream requires code_metrics");
        }
        nonNegative("lines", m.getLines());
        nonNegative("functions", m.getFunctions());
        nonNegative("classes", m.getClasses());
        nonNegative("comments", m.getComments());
        nonNegative("error_handlers", m.getErrorHandlers());
        nonNegative("async_markers", m.getAsyncMarkers());
        if (m.getComplexity() != null && (!Double.isFinite(m.getComplexity()) || m.getComplexity() < 0)) {
            throw new MessageDecodingException("complexity must be a finite non-negative number");
        }
        if (m.getLanguage() != null && m.getLanguage().length() > MAX_LANGUAGE_LENGTH) {
            throw new MessageDecodingException("language tag too long");
        }
        EditMetadataPayload e = message.getEditMetadata();
        if (e != null) {
            if (e.getEditTimeMs() != null && e.getEditTimeMs() < 0) {
                throw new MessageDecodingException("edit_time_ms must not be negative");
            }
            nonNegative("keystrokes", e.getKeystrokes());
            nonNegative("characters_changed", e.getCharactersChanged());
        }
    }

    private static void nonNegative(String field, Integer value) {
        if (value != null && value < 0) {
            throw new MessageDecodingException(field + " must not be negative");
        }
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }
}
