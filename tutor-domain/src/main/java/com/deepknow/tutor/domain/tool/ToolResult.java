package com.deepknow.tutor.domain.tool;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 工具执行结果：ok 标志加工具自定义字段，序列化为 {"ok":...,...} 后作为调用输出回传上游。
 */
@JsonPropertyOrder({"ok"})
public final class ToolResult {
    private final boolean ok;
    private final Map<String, Object> fields;

    private ToolResult(boolean ok, Map<String, Object> fields) {
        this.ok = ok;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Builder success() {
        return new Builder(true);
    }

    public static ToolResult failure(String error) {
        return new Builder(false).put("error", error).build();
    }

    @JsonProperty("ok")
    public boolean isOk() { return ok; }

    @JsonAnyGetter
    public Map<String, Object> getFields() { return fields; }

    public Object get(String key) { return fields.get(key); }

    @Override
    public String toString() {
        return "ToolResult{ok=" + ok + ", fields=" + fields + '}';
    }

    public static final class Builder {
        private final boolean ok;
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder(boolean ok) {
            this.ok = ok;
        }

        public Builder put(String key, Object value) {
            fields.put(key, value);
            return this;
        }

        public ToolResult build() {
            return new ToolResult(ok, fields);
        }
    }
}
