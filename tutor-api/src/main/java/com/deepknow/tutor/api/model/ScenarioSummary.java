package com.deepknow.tutor.api.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScenarioSummary implements Serializable {
    private static final long serialVersionUID = 4310982257716305521L;

    private String id;
    private String level; // A1 | A2 | B1 ...
    private String title;
}
