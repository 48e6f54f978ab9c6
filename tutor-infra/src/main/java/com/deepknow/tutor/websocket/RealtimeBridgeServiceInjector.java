package com.deepknow.tutor.websocket;

import com.deepknow.tutor.config.RealtimeUpstreamProperties;
import com.deepknow.tutor.domain.session.service.RealtimeBridgeService;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;

/**
 * 端点实例由 WebSocket 容器创建，不经过 Spring，依赖通过静态字段注入。
 */
@Component
public class RealtimeBridgeServiceInjector {

    private final RealtimeBridgeService bridgeService;
    private final RealtimeUpstreamProperties upstreamProperties;

    public RealtimeBridgeServiceInjector(RealtimeBridgeService bridgeService,
                                         RealtimeUpstreamProperties upstreamProperties) {
        this.bridgeService = bridgeService;
        this.upstreamProperties = upstreamProperties;
    }

    @PostConstruct
    public void inject() {
        RealtimeWebSocketHandler.setBridgeService(bridgeService);
        RealtimeWebSocketHandler.setMaxMessageBytes(upstreamProperties.getMaxMessageBytes());
    }
}
