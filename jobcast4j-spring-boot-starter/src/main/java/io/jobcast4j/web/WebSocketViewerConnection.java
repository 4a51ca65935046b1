package io.jobcast4j.web;

import io.jobcast4j.ViewerConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link ViewerConnection} over a Spring WebSocket session. Written to by the hub thread only.
 */
public class WebSocketViewerConnection implements ViewerConnection {
    private static final Logger log = LoggerFactory.getLogger(WebSocketViewerConnection.class);

    private final WebSocketSession session;

    public WebSocketViewerConnection(WebSocketSession session) {
        this.session = Objects.requireNonNull(session, "session must not be null");
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public String remoteAddress() {
        return session.getRemoteAddress() != null ? session.getRemoteAddress().toString() : "unknown";
    }

    @Override
    public void send(String payload) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("session closed id=" + session.getId());
        }
        session.sendMessage(new TextMessage(payload));
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.GOING_AWAY);
        } catch (IOException e) {
            log.debug("close failed id={} msg={}", session.getId(), e.getMessage());
        }
    }
}
