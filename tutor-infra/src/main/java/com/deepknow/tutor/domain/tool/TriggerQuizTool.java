package com.deepknow.tutor.domain.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 触发小测：回显课程 id（默认当前场景）与考查重点（默认 vocabulary）。
 */
class TriggerQuizTool {
    static final String DEFAULT_FOCUS = "vocabulary";

    ToolResult execute(ObjectNode args, String scenarioId) {
        Map<String, Object> quiz = new LinkedHashMap<>();
        quiz.put("lesson_id", text(args, "lesson_id", scenarioId));
        quiz.put("focus", text(args, "focus", DEFAULT_FOCUS));
        return ToolResult.success().put("quiz", quiz).build();
    }

    private static String text(ObjectNode args, String field, String def) {
        if (args == null) return def;
        JsonNode v = args.get(field);
        return v != null && v.isTextual() ? v.asText() : def;
    }
}
