package com.deepknow.tutor.websocket;

import com.deepknow.tutor.domain.relay.RealtimeChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.websocket.CloseReason;
import javax.websocket.Session;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于 javax.websocket Session 的通道，服务端（浏览器侧）与客户端（上游侧）连接共用。
 */
public class WebSocketSessionChannel implements RealtimeChannel {
    private static final Logger log = LoggerFactory.getLogger(WebSocketSessionChannel.class);

    private final Session session;
    private final String label;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public WebSocketSessionChannel(Session session, String label) {
        this.session = session;
        this.label = label;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && session.isOpen();
    }

    @Override
    public void sendText(String text) {
        if (!isOpen()) {
            log.debug("Drop text on closed {} channel: ws={}", label, session.getId());
            return;
        }
        try {
            session.getBasicRemote().sendText(text);
        } catch (IOException e) {
            log.warn("Send text to {} failed: ws={}", label, session.getId(), e);
        }
    }

    @Override
    public void sendBinary(ByteBuffer data) {
        if (!isOpen()) {
            log.debug("Drop binary on closed {} channel: ws={}", label, session.getId());
            return;
        }
        try {
            session.getBasicRemote().sendBinary(data);
        } catch (IOException e) {
            log.warn("Send binary to {} failed: ws={}", label, session.getId(), e);
        }
    }

    @Override
    public void close(int code, String reason) {
        if (!closed.compareAndSet(false, true)) return;
        if (!session.isOpen()) return;
        try {
            session.close(new CloseReason(CloseReason.CloseCodes.getCloseCode(code), truncateReason(reason)));
            log.info("Closed {} channel: ws={} code={} reason={}", label, session.getId(), code, reason);
        } catch (IOException e) {
            log.warn("Close {} channel failed: ws={}", label, session.getId(), e);
        }
    }

    // 关闭原因在帧中最多 123 字节
    private static String truncateReason(String reason) {
        if (reason == null) return "";
        return reason.length() <= 120 ? reason : reason.substring(0, 120);
    }
}
