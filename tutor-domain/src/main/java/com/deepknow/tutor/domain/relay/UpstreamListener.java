package com.deepknow.tutor.domain.relay;

import java.nio.ByteBuffer;

public interface UpstreamListener {
    void onText(String text);

    void onBinary(ByteBuffer data);

    void onClose(int code, String reason);

    void onError(Throwable error);
}
