package com.deepknow.tutor.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

@Data
public class ScenarioDetail implements Serializable {
    private static final long serialVersionUID = -2875530460916645278L;

    private String id;
    private String level;
    private String title;
    private String system;
    @JsonProperty("opening_line")
    private String openingLine;
    private List<ToolSpec> tools = new ArrayList<>();
}
