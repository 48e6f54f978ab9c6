package com.deepknow.tutor.domain.relay.event;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * response.function_call_arguments.delta：一次函数调用的参数片段。name 通常只出现在首个片段。
 */
public final class FunctionCallArgumentsDelta extends RealtimeEvent {
    public static final String TYPE = "response.function_call_arguments.delta";

    FunctionCallArgumentsDelta(ObjectNode payload) {
        super(payload);
    }

    public String getCallId() { return textOrNull(getPayload(), "call_id"); }
    public String getName() { return textOrNull(getPayload(), "name"); }
    public String getDelta() { return textOrNull(getPayload(), "delta"); }
}
