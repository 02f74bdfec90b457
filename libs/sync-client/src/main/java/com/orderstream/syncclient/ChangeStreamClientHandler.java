package com.orderstream.syncclient;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Client side of the change stream: every text frame goes to the {@link EnvelopeRouter}
 * untouched, so parsing and cache mutation happen on the router's consumer thread.
 */
public class ChangeStreamClientHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ChangeStreamClientHandler.class);

    private final EnvelopeRouter router;
    private volatile boolean open;

    public ChangeStreamClientHandler(EnvelopeRouter router) {
        this.router = router;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        open = true;
        log.info("Change stream connected: {}", session.getUri());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        router.submit(message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Change stream transport error on {}", session.getId(), exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        open = false;
        log.info("Change stream closed: {}", status);
    }

    public boolean isOpen() {
        return open;
    }
}
