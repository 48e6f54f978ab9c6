package com.deepknow.tutor.domain.relay;

import com.deepknow.tutor.domain.relay.event.RealtimeEvent;
import com.deepknow.tutor.domain.scenario.model.Scenario;
import com.deepknow.tutor.domain.session.TutorRules;
import com.deepknow.tutor.domain.tool.ToolResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * Realtime 事件编解码：解析入站 JSON，构造桥接层主动发送的事件。
 */
public class RealtimeEventCodec {
    public static final String AUDIO_FORMAT = "pcm16";

    private final ObjectMapper mapper;

    public RealtimeEventCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * 解析为 JSON 对象；非法 JSON 或非对象返回 empty。
     */
    public Optional<ObjectNode> parseObject(String text) {
        if (text == null || text.isEmpty()) return Optional.empty();
        try {
            JsonNode node = mapper.readTree(text);
            return node != null && node.isObject() ? Optional.of((ObjectNode) node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    public Optional<RealtimeEvent> decode(String text) {
        return parseObject(text).map(RealtimeEvent::of);
    }

    /**
     * 解析工具参数，必须是 JSON 对象。
     *
     * @throws IllegalArgumentException 参数无法解析或不是对象
     */
    public ObjectNode parseArguments(String arguments) {
        JsonNode node;
        try {
            node = mapper.readTree(arguments == null ? "" : arguments);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e.getOriginalMessage(), e);
        }
        if (node == null || node.isMissingNode()) {
            throw new IllegalArgumentException("empty arguments");
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("expected a JSON object but got " + node.getNodeType());
        }
        return (ObjectNode) node;
    }

    public ObjectNode sessionUpdate(Scenario scenario) {
        ObjectNode turnDetection = mapper.createObjectNode()
                .put("type", "server_vad")
                .put("interrupt_response", true)
                .put("create_response", true);
        ObjectNode session = mapper.createObjectNode();
        session.put("instructions", TutorRules.mergeInstructions(scenario.getSystem()));
        session.set("turn_detection", turnDetection);
        session.set("modalities", mapper.createArrayNode().add("audio").add("text"));
        session.put("input_audio_format", AUDIO_FORMAT);
        session.put("output_audio_format", AUDIO_FORMAT);
        session.set("tools", mapper.valueToTree(scenario.getTools()));
        return event(EventTypes.SESSION_UPDATE).set("session", session);
    }

    public ObjectNode assistantMessage(String text) {
        ArrayNode content = mapper.createArrayNode();
        content.addObject().put("type", "input_text").put("text", text == null ? "" : text);
        ObjectNode item = mapper.createObjectNode()
                .put("type", "message")
                .put("role", "assistant");
        item.set("content", content);
        return event(EventTypes.CONVERSATION_ITEM_CREATE).set("item", item);
    }

    public ObjectNode responseCreate() {
        return event(EventTypes.RESPONSE_CREATE);
    }

    public ObjectNode functionCallOutput(String callId, ToolResult result) {
        ObjectNode item = mapper.createObjectNode()
                .put("type", "function_call_output")
                .put("call_id", callId)
                .put("output", write(result));
        return event(EventTypes.CONVERSATION_ITEM_CREATE).set("item", item);
    }

    public ObjectNode error(String message) {
        ObjectNode error = mapper.createObjectNode().put("message", message == null ? "" : message);
        return event(EventTypes.ERROR).set("error", error);
    }

    public String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Serialize event failed", e);
        }
    }

    private ObjectNode event(String type) {
        return mapper.createObjectNode().put("type", type);
    }
}
