package com.deepknow.tutor.domain.scenario.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 场景声明的函数工具。parameters 为 JSON Schema 子集，原样下发给上游。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ScenarioTool {
    private final String type;
    private final String name;
    private final String description;
    private final Map<String, Object> parameters;

    @JsonCreator
    public ScenarioTool(@JsonProperty("type") String type,
                        @JsonProperty("name") String name,
                        @JsonProperty("description") String description,
                        @JsonProperty("parameters") Map<String, Object> parameters) {
        this.type = type == null ? "function" : type;
        this.name = name;
        this.description = description;
        this.parameters = parameters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    @JsonProperty("type")
    public String getType() { return type; }
    @JsonProperty("name")
    public String getName() { return name; }
    @JsonProperty("description")
    public String getDescription() { return description; }
    @JsonProperty("parameters")
    public Map<String, Object> getParameters() { return parameters; }
}
