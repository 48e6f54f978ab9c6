package com.deepknow.tutor.domain.session.service;

import com.deepknow.tutor.domain.relay.RealtimeChannel;

/**
 * 会话级桥接编排接口：管理客户端连接与上游 Realtime 连接的配对与中转。
 * 端点层只依赖此接口，具体实现放在 infra 层。
 */
public interface RealtimeBridgeService {
    /**
     * 为已升级的客户端连接建立桥接会话；场景未知时直接关闭客户端且不登记会话。
     */
    void open(String wsSessionId, String scenarioId, String userId, RealtimeChannel client);

    void onClientText(String wsSessionId, String text);

    void onClientBinary(String wsSessionId, int bytes);

    void onClientClosed(String wsSessionId);

    void onClientError(String wsSessionId, Throwable error);

    int activeSessionCount();
}
