package com.orderstream.ordering.infrastructure.websocket;

import com.orderstream.syncmodel.EntityType;
import java.io.IOException;
import java.net.URI;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * WebSocket endpoint for the change stream. Each session gets its own {@link BridgeConnection};
 * the optional {@code types} query parameter ({@code ?types=Order,OrderItem}) narrows the
 * channels, otherwise every entity type is streamed. Client frames are ignored.
 */
@Component
public class ChangeStreamWebSocketHandler extends TextWebSocketHandler {

    static final String BRIDGE_ATTRIBUTE = "orderstream.bridge";
    static final String TYPES_PARAM = "types";

    private static final Logger log = LoggerFactory.getLogger(ChangeStreamWebSocketHandler.class);

    private final TransportBridge bridge;

    public ChangeStreamWebSocketHandler(TransportBridge bridge) {
        this.bridge = bridge;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        Set<EntityType> channels = requestedChannels(session.getUri());
        BridgeConnection connection = bridge.open(session.getId(), channels, new SessionSink(session));
        session.getAttributes().put(BRIDGE_ATTRIBUTE, connection);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("Ignoring client frame on session {}", session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on session {}", session.getId(), exception);
        closeBridge(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("Session {} closed: {}", session.getId(), status);
        closeBridge(session);
    }

    static Set<EntityType> requestedChannels(URI uri) {
        if (uri == null) {
            return EnumSet.allOf(EntityType.class);
        }
        List<String> params = UriComponentsBuilder.fromUri(uri).build().getQueryParams().get(TYPES_PARAM);
        if (params == null || params.isEmpty()) {
            return EnumSet.allOf(EntityType.class);
        }
        Set<EntityType> channels = EnumSet.noneOf(EntityType.class);
        for (String param : params) {
            for (String raw : param.split(",")) {
                if (raw.isBlank()) {
                    continue;
                }
                EntityType.fromString(raw).ifPresentOrElse(channels::add,
                        () -> log.warn("Ignoring unknown entity type '{}' in subscription", raw));
            }
        }
        return channels.isEmpty() ? EnumSet.allOf(EntityType.class) : channels;
    }

    private record SessionSink(WebSocketSession session) implements EnvelopeSink {

        @Override
        public void send(String frame) throws IOException {
            session.sendMessage(new TextMessage(frame));
        }

        @Override
        public void abort() throws IOException {
            if (session.isOpen()) {
                session.close(CloseStatus.SERVER_ERROR);
            }
        }
    }

    private void closeBridge(WebSocketSession session) {
        Object connection = session.getAttributes().remove(BRIDGE_ATTRIBUTE);
        if (connection instanceof BridgeConnection bridgeConnection) {
            bridgeConnection.close();
        }
    }
}
