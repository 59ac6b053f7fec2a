package com.example.planetforge.stream;

/**
 * Outbound side of one live client transport.
 */
public interface ClientConnection {

    /**
     * @return false when the transport refused the message; the connection should then be treated as dead
     */
    boolean send(String text);

    void close();
}
