package com.deepknow.tutor.domain.relay.event;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * response.function_call_arguments.done：函数调用参数流结束，可能直接携带完整 arguments。
 */
public final class FunctionCallArgumentsDone extends RealtimeEvent {
    public static final String TYPE = "response.function_call_arguments.done";

    FunctionCallArgumentsDone(ObjectNode payload) {
        super(payload);
    }

    public String getCallId() { return textOrNull(getPayload(), "call_id"); }
    public String getName() { return textOrNull(getPayload(), "name"); }
    public String getArguments() { return textOrNull(getPayload(), "arguments"); }
}
