package com.deepknow.tutor.domain.session.util;

import com.deepknow.tutor.domain.session.model.CompletedToolCall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ToolCallAccumulatorTest {

    private ToolCallAccumulator accumulator;

    @BeforeEach
    void setUp() {
        accumulator = new ToolCallAccumulator();
    }

    @Test
    void joinsFragmentsInArrivalOrder() {
        accumulator.onDelta("c1", "grade_lesson", "{\"vocabulary_score\":");
        accumulator.onDelta("c1", null, "8,\"grammar_score\":7,");
        accumulator.onDelta("c1", null, "\"fluency_score\":9}");

        CompletedToolCall call = accumulator.complete("c1", null, "ignored");

        assertEquals("c1", call.getCallId());
        assertEquals("grade_lesson", call.getName());
        assertEquals("{\"vocabulary_score\":8,\"grammar_score\":7,\"fluency_score\":9}", call.getArguments());
        assertFalse(accumulator.contains("c1"));
        assertEquals(0, accumulator.size());
    }

    @Test
    void reusedCallIdStartsFreshEntry() {
        accumulator.onDelta("c1", "grade_lesson", "{\"stale\":");
        accumulator.onDelta("c1", null, "true}");
        accumulator.complete("c1", null, null);

        accumulator.onDelta("c1", "trigger_quiz", "{\"focus\":");
        accumulator.onDelta("c1", null, "\"grammar\"}");
        CompletedToolCall second = accumulator.complete("c1", null, null);

        assertEquals("{\"focus\":\"grammar\"}", second.getArguments());
        assertEquals("trigger_quiz", second.getName());
        assertFalse(accumulator.contains("c1"));
    }

    @Test
    void interleavedCallsStayIndependent() {
        accumulator.onDelta("a", "grade_lesson", "{\"x\":");
        accumulator.onDelta("b", "trigger_quiz", "{\"focus\":");
        accumulator.onDelta("a", null, "1}");
        accumulator.onDelta("b", null, "\"grammar\"}");

        CompletedToolCall b = accumulator.complete("b", null, null);
        assertEquals("{\"focus\":\"grammar\"}", b.getArguments());
        assertEquals("trigger_quiz", b.getName());
        assertTrue(accumulator.contains("a"));

        CompletedToolCall a = accumulator.complete("a", null, null);
        assertEquals("{\"x\":1}", a.getArguments());
    }

    @Test
    void emptyNameDoesNotOverwriteKnownName() {
        accumulator.onDelta("c1", "trigger_quiz", "{");
        accumulator.onDelta("c1", "", "}");

        assertEquals("trigger_quiz", accumulator.complete("c1", null, null).getName());
    }

    @Test
    void laterNonEmptyNameWins() {
        accumulator.onDelta("c1", null, "{");
        accumulator.onDelta("c1", "grade_lesson", "}");

        assertEquals("grade_lesson", accumulator.complete("c1", "trigger_quiz", null).getName());
    }

    @Test
    void completionWithoutDeltasUsesEventArguments() {
        CompletedToolCall call = accumulator.complete("c9", "trigger_quiz", "{\"focus\":\"grammar\"}");

        assertEquals("trigger_quiz", call.getName());
        assertEquals("{\"focus\":\"grammar\"}", call.getArguments());
    }

    @Test
    void completionWithoutDeltasOrArgumentsFallsBackToEmptyObject() {
        assertEquals("{}", accumulator.complete("c9", "trigger_quiz", null).getArguments());
        assertEquals("{}", accumulator.complete("c10", "trigger_quiz", "").getArguments());
    }

    @Test
    void deltaWithoutCallIdIsIgnored() {
        assertFalse(accumulator.onDelta(null, "grade_lesson", "{"));
        assertFalse(accumulator.onDelta("", "grade_lesson", "{"));
        assertFalse(accumulator.onDelta("c1", "grade_lesson", null));
        assertEquals(0, accumulator.size());
    }

    @Test
    void completionWithoutCallIdReturnsNull() {
        accumulator.onDelta("c1", "grade_lesson", "{}");

        assertNull(accumulator.complete(null, "grade_lesson", "{}"));
        assertTrue(accumulator.contains("c1"));
    }

    @Test
    void clearDropsPendingCalls() {
        accumulator.onDelta("c1", "grade_lesson", "{");
        accumulator.onDelta("c2", "grade_lesson", "{");

        accumulator.clear();

        assertEquals(0, accumulator.size());
    }
}
