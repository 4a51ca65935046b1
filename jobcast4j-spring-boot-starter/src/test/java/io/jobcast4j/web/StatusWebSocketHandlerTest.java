package io.jobcast4j.web;

import io.jobcast4j.ViewerConnection;
import io.jobcast4j.internal.hub.BroadcastHub;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StatusWebSocketHandlerTest {

    @Mock
    private BroadcastHub hub;

    @Mock
    private WebSocketSession session;

    private StatusWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        lenient().when(session.getId()).thenReturn("sess-1");
        handler = new StatusWebSocketHandler(hub);
    }

    @Test
    void acceptedConnectionShouldRegisterWithHub() throws Exception {
        handler.afterConnectionEstablished(session);

        ArgumentCaptor<ViewerConnection> captor = ArgumentCaptor.forClass(ViewerConnection.class);
        verify(hub).register(captor.capture());
        assertThat(captor.getValue().id()).isEqualTo("sess-1");
    }

    @Test
    void anyInboundMessageShouldCountAsLiveness() throws Exception {
        handler.afterConnectionEstablished(session);

        handler.handleMessage(session, new TextMessage("ping"));
        handler.handleMessage(session, new TextMessage("{\"anything\":1}"));
        handler.handleMessage(session, new PongMessage());
        handler.handleMessage(session, new BinaryMessage(new byte[]{1}));

        verify(hub, times(4)).touch("sess-1");
        verify(session, never()).close(any(CloseStatus.class));
    }

    @Test
    void closeShouldUnregisterOnce() throws Exception {
        handler.afterConnectionEstablished(session);

        handler.handleTransportError(session, new IOException("reset"));
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        verify(hub, times(1)).unregister(any());
    }

    @Test
    void closeOfUnknownSessionShouldBeIgnored() throws Exception {
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        verify(hub, never()).unregister(any());
    }

    @Test
    void sendOnClosedSessionShouldFail() {
        when(session.isOpen()).thenReturn(false);
        WebSocketViewerConnection connection = new WebSocketViewerConnection(session);

        assertThatThrownBy(() -> connection.send("[]")).isInstanceOf(IOException.class);
    }

    @Test
    void sendShouldWriteTextFrame() throws Exception {
        when(session.isOpen()).thenReturn(true);
        WebSocketViewerConnection connection = new WebSocketViewerConnection(session);

        connection.send("[{\"id\":\"s1\"}]");

        verify(session).sendMessage(new TextMessage("[{\"id\":\"s1\"}]"));
    }

    @Test
    void closeShouldBeSafeToRepeat() throws Exception {
        when(session.isOpen()).thenReturn(true, false);
        WebSocketViewerConnection connection = new WebSocketViewerConnection(session);

        connection.close();
        connection.close();

        verify(session, times(1)).close(CloseStatus.GOING_AWAY);
    }
}
