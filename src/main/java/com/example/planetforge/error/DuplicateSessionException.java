package com.example.planetforge.error;

/**
 * Raised when a user opens a session while another is still open and concurrent sessions are disabled.
 */
public class DuplicateSessionException extends RuntimeException {

    private final String userId;
    private final String existingSessionId;

    public DuplicateSessionException(String userId, String existingSessionId) {
        super("User " + userId + " already has an open session: " + existingSessionId);
        this.userId = userId;
        this.existingSessionId = existingSessionId;
    }

    public String getUserId() {
        return userId;
    }

    public String getExistingSessionId() {
        return existingSessionId;
    }
}
