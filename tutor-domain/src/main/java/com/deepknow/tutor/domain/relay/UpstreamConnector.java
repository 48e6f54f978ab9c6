package com.deepknow.tutor.domain.relay;

import java.util.concurrent.CompletableFuture;

/**
 * 上游 AI 流式服务连接器。握手异步完成；失败或超时时 future 以异常结束。
 */
public interface UpstreamConnector {
    CompletableFuture<RealtimeChannel> connect(UpstreamListener listener);
}
