package com.deepknow.tutor.domain.session;

import com.deepknow.tutor.domain.relay.RealtimeChannel;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * 记录所有发送与关闭动作的内存通道。
 */
class RecordingChannel implements RealtimeChannel {
    private final String id;
    private boolean open = true;
    final List<String> texts = new ArrayList<>();
    final List<ByteBuffer> binaries = new ArrayList<>();
    Integer closeCode;
    String closeReason;

    RecordingChannel(String id) {
        this.id = id;
    }

    @Override
    public String id() { return id; }

    @Override
    public boolean isOpen() { return open; }

    @Override
    public void sendText(String text) { texts.add(text); }

    @Override
    public void sendBinary(ByteBuffer data) { binaries.add(data); }

    @Override
    public void close(int code, String reason) {
        if (!open) return;
        open = false;
        closeCode = code;
        closeReason = reason;
    }

    String lastText() {
        return texts.isEmpty() ? null : texts.get(texts.size() - 1);
    }
}
