package io.jobcast4j.web;

import io.jobcast4j.internal.hub.BroadcastHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Viewer side of the status channel.
 *
 * <p>Each connection is registered with the hub on accept; any inbound message counts as a liveness
 * signal regardless of its content. The hub does all writing.
 */
public class StatusWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(StatusWebSocketHandler.class);

    private final BroadcastHub hub;
    private final Map<String, WebSocketViewerConnection> connections = new ConcurrentHashMap<>();

    public StatusWebSocketHandler(BroadcastHub hub) {
        this.hub = hub;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketViewerConnection connection = new WebSocketViewerConnection(session);
        connections.put(session.getId(), connection);
        hub.register(connection);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        hub.touch(session.getId());
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        hub.touch(session.getId());
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        hub.touch(session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("transport error id={} msg={}", session.getId(), exception.getMessage());
        release(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        release(session);
    }

    private void release(WebSocketSession session) {
        WebSocketViewerConnection connection = connections.remove(session.getId());
        if (connection != null) {
            hub.unregister(connection);
        }
    }
}
