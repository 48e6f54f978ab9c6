package com.deepknow.tutor.domain.tool;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 固定工具集分发。新增工具时在此扩展 switch。
 */
public class DefaultToolDispatcher implements ToolDispatcher {
    private static final Logger log = LoggerFactory.getLogger(DefaultToolDispatcher.class);

    public static final String GRADE_LESSON = "grade_lesson";
    public static final String TRIGGER_QUIZ = "trigger_quiz";

    private final GradeLessonTool gradeLesson = new GradeLessonTool();
    private final TriggerQuizTool triggerQuiz = new TriggerQuizTool();

    @Override
    public ToolResult execute(String name, ObjectNode args, String scenarioId) {
        String toolName = name == null ? "" : name;
        ToolResult result;
        switch (toolName) {
            case GRADE_LESSON:
                result = gradeLesson.execute(args);
                break;
            case TRIGGER_QUIZ:
                result = triggerQuiz.execute(args, scenarioId);
                break;
            default:
                result = ToolResult.failure("Unknown tool: " + toolName);
        }
        log.info("Tool executed: name={} ok={} scenarioId={}", toolName, result.isOk(), scenarioId);
        return result;
    }
}
