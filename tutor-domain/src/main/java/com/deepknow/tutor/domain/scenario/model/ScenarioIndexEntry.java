package com.deepknow.tutor.domain.scenario.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class ScenarioIndexEntry {
    private final String id;
    private final String level;
    private final String title;

    @JsonCreator
    public ScenarioIndexEntry(@JsonProperty("id") String id,
                              @JsonProperty("level") String level,
                              @JsonProperty("title") String title) {
        this.id = id;
        this.level = level;
        this.title = title;
    }

    public String getId() { return id; }
    public String getLevel() { return level; }
    public String getTitle() { return title; }
}
