package com.deepknow.tutor.websocket;

import com.deepknow.tutor.domain.session.service.RealtimeBridgeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.websocket.CloseReason;
import javax.websocket.OnClose;
import javax.websocket.OnError;
import javax.websocket.OnMessage;
import javax.websocket.OnOpen;
import javax.websocket.Session;
import javax.websocket.server.ServerEndpoint;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

/**
 * 浏览器侧实时会话端点：/ws?scenario=&lt;id&gt;&amp;user=&lt;id&gt;。
 * 只负责把容器回调转交给 {@link RealtimeBridgeService}，不持有会话状态。
 */
@Component
@ServerEndpoint(value = "/ws")
public class RealtimeWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(RealtimeWebSocketHandler.class);
    static final String DEFAULT_USER = "anonymous";

    // 由 RealtimeBridgeServiceInjector 在单例初始化时注入，端点注册晚于此
    private static RealtimeBridgeService bridgeService;
    private static int maxMessageBytes = 4 * 1024 * 1024;

    public static void setBridgeService(RealtimeBridgeService service) { bridgeService = service; }
    public static void setMaxMessageBytes(int bytes) { maxMessageBytes = bytes; }

    @OnOpen
    public void onOpen(Session session) {
        log.info("WS connected: {}", session.getId());
        if (bridgeService == null) {
            log.warn("RealtimeBridgeService not injected; refuse open for ws {}", session.getId());
            closeQuietly(session, new CloseReason(CloseReason.CloseCodes.UNEXPECTED_CONDITION, "SERVICE_NOT_READY"));
            return;
        }
        session.setMaxTextMessageBufferSize(maxMessageBytes);
        session.setMaxBinaryMessageBufferSize(maxMessageBytes);

        String scenarioId = parseQueryParam(session, "scenario");
        String userId = parseQueryParam(session, "user");
        if (userId == null || userId.isEmpty()) userId = DEFAULT_USER;

        bridgeService.open(session.getId(), scenarioId, userId, new WebSocketSessionChannel(session, "client"));
    }

    @OnMessage
    public void onTextMessage(String text, Session session) {
        if (bridgeService == null) return;
        log.trace("Received text: ws={} len={}", session.getId(), text.length());
        bridgeService.onClientText(session.getId(), text);
    }

    @OnMessage
    public void onBinaryMessage(ByteBuffer message, Session session) {
        if (bridgeService == null) return;
        bridgeService.onClientBinary(session.getId(), message.remaining());
    }

    @OnClose
    public void onClose(Session session, CloseReason reason) {
        log.info("WS closed: {} status={}", session.getId(), reason);
        if (bridgeService == null) {
            log.warn("RealtimeBridgeService not injected; skip close for ws {}", session.getId());
            return;
        }
        bridgeService.onClientClosed(session.getId());
    }

    @OnError
    public void onError(Session session, Throwable throwable) {
        String wsId = session != null ? session.getId() : null;
        log.warn("WS error: ws={} {}", wsId, throwable != null ? throwable.getMessage() : "unknown");
        if (bridgeService == null || wsId == null) return;
        bridgeService.onClientError(wsId, throwable);
    }

    /**
     * 取查询参数的第一个值，容器已完成 URL 解码。
     */
    static String parseQueryParam(Session session, String key) {
        Map<String, List<String>> params = session.getRequestParameterMap();
        if (params == null) return null;
        List<String> values = params.get(key);
        if (values == null || values.isEmpty()) return null;
        return values.get(0);
    }

    private static void closeQuietly(Session session, CloseReason reason) {
        try {
            session.close(reason);
        } catch (IOException e) {
            log.debug("Close ws {} failed", session.getId(), e);
        }
    }
}
