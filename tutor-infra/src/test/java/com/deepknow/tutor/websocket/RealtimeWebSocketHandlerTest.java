package com.deepknow.tutor.websocket;

import com.deepknow.tutor.domain.relay.RealtimeChannel;
import com.deepknow.tutor.domain.session.service.RealtimeBridgeService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.websocket.CloseReason;
import javax.websocket.Session;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RealtimeWebSocketHandlerTest {

    @Mock
    private RealtimeBridgeService bridgeService;

    @Mock
    private Session session;

    private final RealtimeWebSocketHandler handler = new RealtimeWebSocketHandler();

    @BeforeEach
    void setUp() {
        RealtimeWebSocketHandler.setBridgeService(bridgeService);
        RealtimeWebSocketHandler.setMaxMessageBytes(2048);
        when(session.getId()).thenReturn("ws-1");
    }

    @AfterEach
    void tearDown() {
        RealtimeWebSocketHandler.setBridgeService(null);
    }

    @Test
    void openPassesScenarioAndUser() {
        when(session.getRequestParameterMap()).thenReturn(Map.of(
                "scenario", List.of("a2_cafe_medellin"),
                "user", List.of("maria")));

        handler.onOpen(session);

        verify(session).setMaxTextMessageBufferSize(2048);
        verify(session).setMaxBinaryMessageBufferSize(2048);
        verify(bridgeService).open(eq("ws-1"), eq("a2_cafe_medellin"), eq("maria"), any(RealtimeChannel.class));
    }

    @Test
    void userDefaultsToAnonymous() {
        when(session.getRequestParameterMap()).thenReturn(Map.of("scenario", List.of("a1_taxi_bogota")));

        handler.onOpen(session);

        verify(bridgeService).open(eq("ws-1"), eq("a1_taxi_bogota"), eq("anonymous"), any(RealtimeChannel.class));
    }

    @Test
    void framesAreHandedToService() {
        handler.onTextMessage("{\"type\":\"response.create\"}", session);
        handler.onBinaryMessage(ByteBuffer.allocate(16), session);

        verify(bridgeService).onClientText("ws-1", "{\"type\":\"response.create\"}");
        verify(bridgeService).onClientBinary("ws-1", 16);
    }

    @Test
    void closeAndErrorAreHandedToService() {
        RuntimeException error = new RuntimeException("reset");

        handler.onClose(session, new CloseReason(CloseReason.CloseCodes.NORMAL_CLOSURE, "bye"));
        handler.onError(session, error);

        verify(bridgeService).onClientClosed("ws-1");
        verify(bridgeService).onClientError("ws-1", error);
    }

    @Test
    void openIsRefusedBeforeServiceInjected() throws Exception {
        RealtimeWebSocketHandler.setBridgeService(null);

        handler.onOpen(session);
        handler.onTextMessage("{\"type\":\"response.create\"}", session);

        ArgumentCaptor<CloseReason> reason = ArgumentCaptor.forClass(CloseReason.class);
        verify(session).close(reason.capture());
        assertEquals(CloseReason.CloseCodes.UNEXPECTED_CONDITION.getCode(), reason.getValue().getCloseCode().getCode());
        assertEquals("SERVICE_NOT_READY", reason.getValue().getReasonPhrase());
        verifyNoInteractions(bridgeService);
    }
}
