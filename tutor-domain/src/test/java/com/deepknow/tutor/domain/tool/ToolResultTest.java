package com.deepknow.tutor.domain.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ToolResultTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void failureCarriesError() {
        ToolResult result = ToolResult.failure("Unknown tool: foo");

        assertFalse(result.isOk());
        assertEquals("Unknown tool: foo", result.get("error"));
    }

    @Test
    void serializesOkFirstThenFieldsInOrder() throws Exception {
        ToolResult result = ToolResult.success()
                .put("score", 8.0)
                .put("vocabulary_score", 8.0)
                .build();

        String json = mapper.writeValueAsString(result);

        assertEquals("{\"ok\":true,\"score\":8.0,\"vocabulary_score\":8.0}", json);
    }

    @Test
    void fieldsAreImmutable() {
        ToolResult result = ToolResult.success().put("a", 1).build();

        assertThrows(UnsupportedOperationException.class, () -> result.getFields().put("b", 2));
    }
}
