package com.deepknow.tutor.api.model;

import lombok.Data;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 函数调用工具的声明（OpenAI function calling 子集）。
 */
@Data
public class ToolSpec implements Serializable {
    private static final long serialVersionUID = 7719160326145853905L;

    private String type = "function";
    private String name;
    private String description;
    private Map<String, Object> parameters = new LinkedHashMap<>();
}
