package com.deepknow.tutor.domain.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * 课程评分：三项分数取均值（保留两位小数）。缺失或非数值按 0 计。
 * 回显的分数保持输入的数值形式，整数不会变成小数。
 */
class GradeLessonTool {
    private static final Integer ZERO = 0;

    ToolResult execute(ObjectNode args) {
        Number vocabulary = number(args, "vocabulary_score");
        Number grammar = number(args, "grammar_score");
        Number fluency = number(args, "fluency_score");
        double average = (vocabulary.doubleValue() + grammar.doubleValue() + fluency.doubleValue()) / 3;

        ToolResult.Builder result = ToolResult.success()
                .put("score", Math.round(average * 100) / 100.0)
                .put("vocabulary_score", vocabulary)
                .put("grammar_score", grammar)
                .put("fluency_score", fluency);
        JsonNode notes = args == null ? null : args.get("notes");
        if (notes != null && notes.isTextual()) {
            result.put("notes", notes.asText());
        }
        return result.build();
    }

    private static Number number(ObjectNode args, String field) {
        if (args == null) return ZERO;
        JsonNode v = args.get(field);
        return v != null && v.isNumber() ? v.numberValue() : ZERO;
    }
}
