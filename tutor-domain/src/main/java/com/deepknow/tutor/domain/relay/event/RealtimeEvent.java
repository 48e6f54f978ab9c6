package com.deepknow.tutor.domain.relay.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * 中转事件：以 type 为判别字段的 JSON 对象。
 * 桥接层只解释少数类型（函数调用参数流），其余作为 {@link OpaqueEvent} 原样携带全部字段。
 */
public abstract class RealtimeEvent {
    private final ObjectNode payload;

    protected RealtimeEvent(ObjectNode payload) {
        this.payload = payload;
    }

    public static RealtimeEvent of(ObjectNode payload) {
        String type = textOrNull(payload, "type");
        if (FunctionCallArgumentsDelta.TYPE.equals(type)) {
            return new FunctionCallArgumentsDelta(payload);
        }
        if (FunctionCallArgumentsDone.TYPE.equals(type)) {
            return new FunctionCallArgumentsDone(payload);
        }
        return new OpaqueEvent(payload);
    }

    public String getType() {
        return textOrNull(payload, "type");
    }

    public ObjectNode getPayload() {
        return payload;
    }

    protected static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && v.isTextual() ? v.asText() : null;
    }
}
