package com.deepknow.tutor.websocket;

import com.deepknow.tutor.config.TutorWebProperties;
import com.deepknow.tutor.domain.scenario.service.ScenarioProvider;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.socket.server.standard.ServerEndpointExporter;

@Configuration
public class WebSocketConfig {

    // 注册所有标注 @ServerEndpoint 的 bean 类型
    @Bean
    public ServerEndpointExporter serverEndpointExporter() {
        return new ServerEndpointExporter();
    }

    @Bean
    public FilterRegistrationBean<SessionUpgradeFilter> sessionUpgradeFilter(ScenarioProvider scenarioProvider,
                                                                             TutorWebProperties webProperties) {
        FilterRegistrationBean<SessionUpgradeFilter> registration =
                new FilterRegistrationBean<>(new SessionUpgradeFilter(scenarioProvider, webProperties));
        registration.addUrlPatterns("/ws");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        registration.setName("sessionUpgradeFilter");
        return registration;
    }
}
