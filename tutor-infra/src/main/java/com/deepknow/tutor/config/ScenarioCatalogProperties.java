package com.deepknow.tutor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scenarios")
public class ScenarioCatalogProperties {
    // classpath 下的目录，包含 index.json 与 <id>.json
    private String location = "scenarios";

    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }
}
