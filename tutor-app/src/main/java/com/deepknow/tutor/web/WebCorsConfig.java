package com.deepknow.tutor.web;

import com.deepknow.tutor.config.TutorWebProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
public class WebCorsConfig implements WebMvcConfigurer {

    private final TutorWebProperties webProperties;

    public WebCorsConfig(TutorWebProperties webProperties) {
        this.webProperties = webProperties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        List<String> origins = webProperties.getAllowedOrigins();
        String[] allowed = origins == null || origins.isEmpty()
                ? new String[]{"*"}
                : origins.stream().map(String::trim).toArray(String[]::new);
        registry.addMapping("/api/**")
                .allowedOrigins(allowed)
                .allowedMethods("GET", "OPTIONS")
                .allowedHeaders("Content-Type");
    }
}
