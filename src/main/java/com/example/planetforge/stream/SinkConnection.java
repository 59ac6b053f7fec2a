package com.example.planetforge.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Connection backed by a unicast sink that the WebSocket session drains.
 */
class SinkConnection implements ClientConnection {

    private static final Logger logger = LoggerFactory.getLogger(SinkConnection.class);

    private final Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
    private final WebSocketSession session;

    SinkConnection(WebSocketSession session) {
        this.session = session;
    }

    Flux<String> outbound() {
        return sink.asFlux();
    }

    @Override
    public synchronized boolean send(String text) {
        Sinks.EmitResult result = sink.tryEmitNext(text);
        if (result.isFailure()) {
            logger.debug("Emit to websocket {} failed: {}", session.getId(), result);
            return false;
        }
        return true;
    }

    @Override
    public synchronized void close() {
        sink.tryEmitComplete();
        session.close(CloseStatus.NORMAL).subscribe(
                null,
                e -> logger.debug("Closing websocket {} failed: {}", session.getId(), e.getMessage()));
    }
}
