package com.deepknow.tutor.domain.scenario.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * 课程场景定义：系统提示词、开场白与可用工具。启动时加载一次，之后只读共享。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Scenario {
    private final String id;
    private final String level;
    private final String title;
    private final String system;
    private final String openingLine;
    private final List<ScenarioTool> tools;

    @JsonCreator
    public Scenario(@JsonProperty("id") String id,
                    @JsonProperty("level") String level,
                    @JsonProperty("title") String title,
                    @JsonProperty("system") String system,
                    @JsonProperty("opening_line") String openingLine,
                    @JsonProperty("tools") List<ScenarioTool> tools) {
        this.id = id;
        this.level = level;
        this.title = title;
        this.system = system == null ? "" : system;
        this.openingLine = openingLine == null ? "" : openingLine;
        this.tools = tools == null ? Collections.emptyList() : List.copyOf(tools);
    }

    public String getId() { return id; }
    public String getLevel() { return level; }
    public String getTitle() { return title; }
    public String getSystem() { return system; }
    public String getOpeningLine() { return openingLine; }
    public List<ScenarioTool> getTools() { return tools; }

    public ScenarioIndexEntry toIndexEntry() {
        return new ScenarioIndexEntry(id, level, title);
    }

    @Override
    public String toString() {
        return "Scenario{" +
                "id='" + id + '\'' +
                ", level='" + level + '\'' +
                ", title='" + title + '\'' +
                ", tools=" + tools.size() +
                '}';
    }
}
