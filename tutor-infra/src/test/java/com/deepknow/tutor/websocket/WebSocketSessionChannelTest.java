package com.deepknow.tutor.websocket;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.websocket.CloseReason;
import javax.websocket.RemoteEndpoint;
import javax.websocket.Session;
import java.io.IOException;
import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebSocketSessionChannelTest {

    @Mock
    private Session session;

    @Mock
    private RemoteEndpoint.Basic remote;

    private WebSocketSessionChannel channel;

    @BeforeEach
    void setUp() {
        channel = new WebSocketSessionChannel(session, "client");
    }

    @Test
    void sendsTextAndBinaryWhileOpen() throws Exception {
        when(session.isOpen()).thenReturn(true);
        when(session.getBasicRemote()).thenReturn(remote);
        ByteBuffer data = ByteBuffer.wrap(new byte[]{7});

        channel.sendText("{\"type\":\"error\"}");
        channel.sendBinary(data);

        verify(remote).sendText("{\"type\":\"error\"}");
        verify(remote).sendBinary(data);
    }

    @Test
    void dropsWhenSessionClosed() throws Exception {
        when(session.isOpen()).thenReturn(false);

        channel.sendText("x");

        verify(session, never()).getBasicRemote();
    }

    @Test
    void sendFailureIsLoggedNotThrown() throws Exception {
        when(session.isOpen()).thenReturn(true);
        when(session.getBasicRemote()).thenReturn(remote);
        doThrow(new IOException("broken pipe")).when(remote).sendText(any());

        assertDoesNotThrow(() -> channel.sendText("x"));
    }

    @Test
    void closeOnlyOnce() throws Exception {
        when(session.isOpen()).thenReturn(true);

        channel.close(1008, "Unknown scenario: z9");
        channel.close(1000, "again");

        ArgumentCaptor<CloseReason> reason = ArgumentCaptor.forClass(CloseReason.class);
        verify(session, times(1)).close(reason.capture());
        assertEquals(1008, reason.getValue().getCloseCode().getCode());
        assertEquals("Unknown scenario: z9", reason.getValue().getReasonPhrase());
        assertFalse(channel.isOpen());
    }

    @Test
    void longReasonIsTruncated() throws Exception {
        when(session.isOpen()).thenReturn(true);

        channel.close(1011, "x".repeat(300));

        ArgumentCaptor<CloseReason> reason = ArgumentCaptor.forClass(CloseReason.class);
        verify(session).close(reason.capture());
        assertEquals(120, reason.getValue().getReasonPhrase().length());
    }
}
