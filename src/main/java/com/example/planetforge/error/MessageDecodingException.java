package com.example.planetforge.error;

/**
 * An inbound message could not be decoded or failed validation.
 */
public class MessageDecodingException extends RuntimeException {

    public MessageDecodingException(String message) {
        super(message);
    }

    public MessageDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
