package com.example.planetforge.stream;

import com.example.planetforge.model.CloseReason;
import com.example.planetforge.model.SessionSummary;
import com.example.planetforge.service.SessionClosedEvent;
import com.example.planetforge.stream.message.ServerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live connections and their bound sessions, one connection per user.
 *
 * Both maps are guarded by a single lock. Transport writes happen outside the lock; a failed write
 * drops the connection and its binding. Nothing here throws on a send.
 */
@Component
public class ConnectionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ClientConnection> connections = new HashMap<>();
    private final Map<String, String> boundSessions = new HashMap<>();

    private final MessageCodec codec;

    public ConnectionRegistry(MessageCodec codec) {
        this.codec = codec;
    }

    /**
     * Registers the user's connection. A previous connection of the same user is replaced and closed;
     * its session binding carries over to the new connection.
     */
    public void connect(String userId, ClientConnection connection) {
        ClientConnection replaced;
        lock.lock();
        try {
            replaced = connections.put(userId, connection);
        } finally {
            lock.unlock();
        }
        if (replaced != null && replaced != connection) {
            logger.info("Replacing existing connection of {}", userId);
            closeQuietly(userId, replaced);
        }
        logger.debug("Connected {} ({} live)", userId, connectionCount());
    }

    /**
     * Idempotent.
     *
     * @return the session id that was bound to the user, if any
     */
    public Optional<String> disconnect(String userId) {
        lock.lock();
        try {
            connections.remove(userId);
            return Optional.ofNullable(boundSessions.remove(userId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Disconnect on behalf of one particular connection. A no-op once a newer connection of the user has
     * replaced it, so a late close of the old transport cannot tear down its successor.
     */
    public Optional<String> disconnect(String userId, ClientConnection connection) {
        lock.lock();
        try {
            ClientConnection current = connections.get(userId);
            if (current != null && current != connection) {
                return Optional.empty();
            }
            connections.remove(userId);
            return Optional.ofNullable(boundSessions.remove(userId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true when the message was handed to the transport
     */
    public boolean send(String userId, ServerMessage message) {
        ClientConnection connection;
        lock.lock();
        try {
            connection = connections.get(userId);
        } finally {
            lock.unlock();
        }
        if (connection == null) {
            logger.debug("No live connection for {}, dropping {}", userId, message.getType());
            return false;
        }
        return deliver(userId, connection, encodeQuietly(message));
    }

    /**
     * Sends to every live connection; one failing recipient does not affect the others.
     *
     * @return number of recipients the message was delivered to
     */
    public int broadcast(ServerMessage message) {
        List<Map.Entry<String, ClientConnection>> recipients;
        lock.lock();
        try {
            recipients = new ArrayList<>(connections.entrySet().size());
            for (Map.Entry<String, ClientConnection> e : connections.entrySet()) {
                recipients.add(Map.entry(e.getKey(), e.getValue()));
            }
        } finally {
            lock.unlock();
        }
        String text = encodeQuietly(message);
        if (text == null) {
            return 0;
        }
        int delivered = 0;
        for (Map.Entry<String, ClientConnection> r : recipients) {
            if (deliver(r.getKey(), r.getValue(), text)) {
                delivered++;
            }
        }
        return delivered;
    }

    public void bindSession(String userId, String sessionId) {
        lock.lock();
        try {
            boundSessions.put(userId, sessionId);
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> activeSession(String userId) {
        lock.lock();
        try {
            return Optional.ofNullable(boundSessions.get(userId));
        } finally {
            lock.unlock();
        }
    }

    public void clearSession(String userId) {
        lock.lock();
        try {
            boundSessions.remove(userId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears the binding only while it still points at {@code sessionId}.
     */
    public boolean clearSession(String userId, String sessionId) {
        lock.lock();
        try {
            return boundSessions.remove(userId, sessionId);
        } finally {
            lock.unlock();
        }
    }

    public int connectionCount() {
        lock.lock();
        try {
            return connections.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isConnected(String userId) {
        lock.lock();
        try {
            return connections.containsKey(userId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Server-side closes (idle reap, supersession) are pushed to the client; client-initiated ends are
     * answered by the dispatcher instead.
     */
    @EventListener
    public void onSessionClosed(SessionClosedEvent event) {
        SessionSummary summary = event.getSnapshot().getSummary();
        boolean wasBound = clearSession(summary.getUserId(), summary.getSessionId());
        CloseReason reason = summary.getCloseReason();
        if (reason == CloseReason.IDLE_TIMEOUT || (reason == CloseReason.SUPERSEDED && wasBound)) {
            send(summary.getUserId(), ServerMessage.sessionEnded(summary));
        }
    }

    private boolean deliver(String userId, ClientConnection connection, String text) {
        if (text == null) {
            return false;
        }
        boolean ok;
        try {
            ok = connection.send(text);
        } catch (RuntimeException e) {
            logger.warn("Send to {} failed: {}", userId, e.getMessage());
            ok = false;
        }
        if (!ok) {
            dropConnection(userId, connection);
        }
        return ok;
    }

    // the session binding stays until the transport's own disconnect ends the session
    private void dropConnection(String userId, ClientConnection connection) {
        boolean removed;
        lock.lock();
        try {
            removed = connections.remove(userId, connection);
        } finally {
            lock.unlock();
        }
        if (removed) {
            logger.info("Dropped dead connection of {}", userId);
        }
        closeQuietly(userId, connection);
    }

    private String encodeQuietly(ServerMessage message) {
        try {
            return codec.encode(message);
        } catch (RuntimeException e) {
            logger.error("Could not encode {} message", message.getType(), e);
            return null;
        }
    }

    private void closeQuietly(String userId, ClientConnection connection) {
        try {
            connection.close();
        } catch (RuntimeException e) {
            logger.debug("Closing connection of {} failed: {}", userId, e.getMessage());
        }
    }
}
