package com.deepknow.tutor.domain.session.model;

/**
 * 会话桥接生命周期。前三个状态中的任何失败都直接进入 CLOSED。
 */
public enum BridgeState {
    INIT,
    RESOLVING_SCENARIO,
    CONNECTING_UPSTREAM,
    ACTIVE,
    CLOSED
}
