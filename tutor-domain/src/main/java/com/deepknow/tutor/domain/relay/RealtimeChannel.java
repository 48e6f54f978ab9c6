package com.deepknow.tutor.domain.relay;

import java.nio.ByteBuffer;

/**
 * 一条双工连接的最小抽象，客户端与上游连接共用。实现的 close 须幂等。
 */
public interface RealtimeChannel {
    String id();

    boolean isOpen();

    void sendText(String text);

    void sendBinary(ByteBuffer data);

    void close(int code, String reason);
}
