package com.example.planetforge.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CloseReason {
    ENDED_BY_CLIENT,
    IDLE_TIMEOUT,
    DISCONNECTED,
    SUPERSEDED;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
