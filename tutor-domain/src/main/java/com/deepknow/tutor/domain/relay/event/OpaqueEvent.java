package com.deepknow.tutor.domain.relay.event;

import com.fasterxml.jackson.databind.node.ObjectNode;

public final class OpaqueEvent extends RealtimeEvent {
    OpaqueEvent(ObjectNode payload) {
        super(payload);
    }
}
