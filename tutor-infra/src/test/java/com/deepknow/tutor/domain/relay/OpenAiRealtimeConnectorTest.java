package com.deepknow.tutor.domain.relay;

import com.deepknow.tutor.config.RealtimeUpstreamProperties;
import com.deepknow.tutor.config.RealtimeUpstreamProperties.CredentialMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.websocket.ClientEndpointConfig;
import javax.websocket.CloseReason;
import javax.websocket.Endpoint;
import javax.websocket.Session;
import javax.websocket.WebSocketContainer;
import java.net.URI;
import java.nio.ByteBuffer;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OpenAiRealtimeConnectorTest {

    @Mock
    private WebSocketContainer container;

    @Mock
    private Session session;

    private RealtimeUpstreamProperties props;
    private OpenAiRealtimeConnector connector;

    @BeforeEach
    void setUp() {
        props = new RealtimeUpstreamProperties();
        props.setApiKey("sk-test");
        props.setApiKeyEnv("TUTOR_TEST_UNSET_KEY_VARIABLE");
    }

    @AfterEach
    void tearDown() {
        if (connector != null) connector.close();
    }

    @Test
    void appliesFrameLimitsToContainer() {
        props.setMaxMessageBytes(1024 * 1024);

        connector = new OpenAiRealtimeConnector(props, container);

        verify(container).setDefaultMaxTextMessageBufferSize(1024 * 1024);
        verify(container).setDefaultMaxBinaryMessageBufferSize(1024 * 1024);
    }

    @Test
    void headerModeSendsBearerAndBetaHeaders() {
        connector = new OpenAiRealtimeConnector(props, container);

        ClientEndpointConfig config = connector.buildConfig("sk-test");
        Map<String, List<String>> headers = new HashMap<>();
        config.getConfigurator().beforeRequest(headers);

        assertEquals(List.of("Bearer sk-test"), headers.get("Authorization"));
        assertEquals(List.of("realtime=v1"), headers.get("OpenAI-Beta"));
        assertTrue(config.getPreferredSubprotocols().isEmpty());
    }

    @Test
    void subprotocolModeCarriesKeyInProtocols() {
        props.setCredentialMode(CredentialMode.SUBPROTOCOL);
        connector = new OpenAiRealtimeConnector(props, container);

        ClientEndpointConfig config = connector.buildConfig("sk-test");
        Map<String, List<String>> headers = new HashMap<>();
        config.getConfigurator().beforeRequest(headers);

        assertEquals(List.of("realtime", "openai-insecure-api-key.sk-test", "openai-beta.realtime-v1"),
                config.getPreferredSubprotocols());
        assertFalse(headers.containsKey("Authorization"));
    }

    @Test
    void connectDialsModelUrlAndWiresListener() throws Exception {
        connector = new OpenAiRealtimeConnector(props, container);
        when(session.getId()).thenReturn("up-1");
        when(container.connectToServer(any(Endpoint.class), any(ClientEndpointConfig.class), any(URI.class)))
                .thenReturn(session);
        RecordingListener listener = new RecordingListener();

        RealtimeChannel channel = connector.connect(listener).get(5, TimeUnit.SECONDS);

        assertEquals("up-1", channel.id());
        ArgumentCaptor<Endpoint> endpoint = ArgumentCaptor.forClass(Endpoint.class);
        ArgumentCaptor<URI> uri = ArgumentCaptor.forClass(URI.class);
        verify(container).connectToServer(endpoint.capture(), any(ClientEndpointConfig.class), uri.capture());
        assertEquals("wss://api.openai.com/v1/realtime?model=gpt-realtime-mini-2025-12-15", uri.getValue().toString());

        endpoint.getValue().onClose(session, new CloseReason(CloseReason.CloseCodes.NORMAL_CLOSURE, "bye"));
        assertEquals(1000, listener.closeCode);
        assertEquals("bye", listener.closeReason);
    }

    @Test
    void missingApiKeyFailsHandshake() throws Exception {
        props.setApiKey(null);
        connector = new OpenAiRealtimeConnector(props, container);

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> connector.connect(new RecordingListener()).get(5, TimeUnit.SECONDS));

        assertTrue(e.getCause() instanceof IllegalStateException);
        assertTrue(e.getCause().getMessage().contains("TUTOR_TEST_UNSET_KEY_VARIABLE"));
        verify(container, never()).connectToServer(any(Endpoint.class), any(ClientEndpointConfig.class), any(URI.class));
    }

    @Test
    void slowHandshakeTimesOutAndLateConnectionIsClosed() throws Exception {
        props.setHandshakeTimeoutMillis(50);
        connector = new OpenAiRealtimeConnector(props, container);
        CountDownLatch release = new CountDownLatch(1);
        when(session.isOpen()).thenReturn(true);
        when(container.connectToServer(any(Endpoint.class), any(ClientEndpointConfig.class), any(URI.class)))
                .thenAnswer(inv -> {
                    release.await(5, TimeUnit.SECONDS);
                    return session;
                });

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> connector.connect(new RecordingListener()).get(5, TimeUnit.SECONDS));
        assertTrue(e.getCause() instanceof TimeoutException);

        release.countDown();
        verify(session, timeout(5000)).close(any(CloseReason.class));
    }

    static class RecordingListener implements UpstreamListener {
        int closeCode;
        String closeReason;

        @Override
        public void onText(String text) {}

        @Override
        public void onBinary(ByteBuffer data) {}

        @Override
        public void onClose(int code, String reason) {
            closeCode = code;
            closeReason = reason;
        }

        @Override
        public void onError(Throwable error) {}
    }
}
