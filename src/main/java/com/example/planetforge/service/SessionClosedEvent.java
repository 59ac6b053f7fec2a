package com.example.planetforge.service;

import com.example.planetforge.model.SessionSnapshot;
import lombok.Value;

/**
 * Published once per session when it leaves the OPEN state, whatever the reason.
 */
@Value
public class SessionClosedEvent {
    SessionSnapshot snapshot;

    public String getSessionId() {
        return snapshot.getSummary().getSessionId();
    }

    public String getUserId() {
        return snapshot.getSummary().getUserId();
    }
}
