package com.example.planetforge.stream;

import com.example.planetforge.auth.IdentityProvider;
import com.example.planetforge.error.SessionNotFoundException;
import com.example.planetforge.error.UnauthenticatedException;
import com.example.planetforge.model.CloseReason;
import com.example.planetforge.service.SessionManager;
import com.example.planetforge.stream.message.ServerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.List;

/**
 * One reactive pipeline per client. Inbound messages are handled strictly in order on the
 * bounded-elastic scheduler; replies and server pushes share one outbound sink.
 */
@Component
public class StreamWebSocketHandler implements WebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(StreamWebSocketHandler.class);

    static final String TOKEN_PARAM = "token";

    private final IdentityProvider identityProvider;
    private final StreamMessageDispatcher dispatcher;
    private final ConnectionRegistry registry;
    private final SessionManager sessionManager;
    private final MessageCodec codec;
    private final Clock clock;

    public StreamWebSocketHandler(IdentityProvider identityProvider, StreamMessageDispatcher dispatcher,
                                  ConnectionRegistry registry, SessionManager sessionManager,
                                  MessageCodec codec, Clock clock) {
        this.identityProvider = identityProvider;
        this.dispatcher = dispatcher;
        this.registry = registry;
        this.sessionManager = sessionManager;
        this.codec = codec;
        this.clock = clock;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String token = extractToken(session);
        return Mono.fromCallable(() -> identityProvider.authenticate(token))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(userId -> serve(session, userId))
                .onErrorResume(UnauthenticatedException.class, e -> {
                    logger.info("Rejected websocket {}: {}", session.getId(), e.getMessage());
                    return session.close(CloseStatus.POLICY_VIOLATION.withReason("unauthenticated"));
                });
    }

    private Mono<Void> serve(WebSocketSession session, String userId) {
        SinkConnection connection = new SinkConnection(session);
        registry.connect(userId, connection);
        connection.send(codec.encode(ServerMessage.connected(userId, clock.instant())));
        logger.info("Websocket {} connected for {}", session.getId(), userId);

        Mono<Void> inbound = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(text -> Mono.fromCallable(() -> dispatcher.dispatch(userId, text))
                        .subscribeOn(Schedulers.boundedElastic()))
                .doOnNext(replies -> reply(connection, replies))
                .then()
                .doFinally(signal -> {
                    onDisconnect(userId, connection);
                    connection.close();
                });

        Mono<Void> outbound = session.send(connection.outbound().map(session::textMessage));

        return Mono.when(inbound, outbound);
    }

    private void reply(SinkConnection connection, List<ServerMessage> replies) {
        for (ServerMessage message : replies) {
            if (!connection.send(codec.encode(message))) {
                logger.debug("Reply {} not delivered, connection gone", message.getType());
                return;
            }
        }
    }

    // persistence of the closed session is queued, never awaited here
    private void onDisconnect(String userId, SinkConnection connection) {
        registry.disconnect(userId, connection).ifPresent(sessionId -> {
            try {
                sessionManager.endSession(sessionId, CloseReason.DISCONNECTED);
            } catch (SessionNotFoundException e) {
                logger.debug("Session {} was already closed at disconnect", sessionId);
            }
        });
        logger.info("Websocket of {} disconnected", userId);
    }

    static String extractToken(WebSocketSession session) {
        String fromQuery = UriComponentsBuilder.fromUri(session.getHandshakeInfo().getUri())
                .build()
                .getQueryParams()
                .getFirst(TOKEN_PARAM);
        if (fromQuery != null && !fromQuery.isBlank()) {
            return fromQuery;
        }
        return session.getHandshakeInfo().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
    }
}
