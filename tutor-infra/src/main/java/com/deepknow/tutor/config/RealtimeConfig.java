package com.deepknow.tutor.config;

import com.deepknow.tutor.domain.relay.OpenAiRealtimeConnector;
import com.deepknow.tutor.domain.relay.RealtimeEventCodec;
import com.deepknow.tutor.domain.relay.UpstreamConnector;
import com.deepknow.tutor.domain.scenario.ClasspathScenarioProvider;
import com.deepknow.tutor.domain.scenario.service.ScenarioProvider;
import com.deepknow.tutor.domain.tool.DefaultToolDispatcher;
import com.deepknow.tutor.domain.tool.ToolDispatcher;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        RealtimeUpstreamProperties.class,
        TutorWebProperties.class,
        ScenarioCatalogProperties.class
})
public class RealtimeConfig {

    @Bean
    public ScenarioProvider scenarioProvider(ObjectMapper objectMapper, ScenarioCatalogProperties props) {
        return new ClasspathScenarioProvider(objectMapper, props.getLocation());
    }

    @Bean
    public ToolDispatcher toolDispatcher() {
        return new DefaultToolDispatcher();
    }

    @Bean
    public RealtimeEventCodec realtimeEventCodec(ObjectMapper objectMapper) {
        return new RealtimeEventCodec(objectMapper);
    }

    @Bean(destroyMethod = "close")
    public UpstreamConnector upstreamConnector(RealtimeUpstreamProperties props) {
        return new OpenAiRealtimeConnector(props);
    }
}
