package com.deepknow.tutor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "tutor.web")
public class TutorWebProperties {
    // 为空表示放行所有来源（开发环境）
    private List<String> allowedOrigins = new ArrayList<>();

    public List<String> getAllowedOrigins() { return allowedOrigins; }
    public void setAllowedOrigins(List<String> allowedOrigins) { this.allowedOrigins = allowedOrigins; }

    public boolean isOriginAllowed(String origin) {
        if (allowedOrigins == null || allowedOrigins.isEmpty()) return true;
        if (origin == null) return false;
        return allowedOrigins.stream().map(String::trim).anyMatch(origin::equals);
    }
}
