package com.deepknow.tutor.websocket;

import com.deepknow.tutor.config.TutorWebProperties;
import com.deepknow.tutor.domain.scenario.service.ScenarioProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * 在 WebSocket 升级之前校验来源与场景，失败时直接返回 HTTP 状态码，不进行升级。
 */
public class SessionUpgradeFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(SessionUpgradeFilter.class);
    static final int SC_UPGRADE_REQUIRED = 426;

    private final ScenarioProvider scenarioProvider;
    private final TutorWebProperties webProperties;

    public SessionUpgradeFilter(ScenarioProvider scenarioProvider, TutorWebProperties webProperties) {
        this.scenarioProvider = scenarioProvider;
        this.webProperties = webProperties;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String upgrade = request.getHeader(HttpHeaders.UPGRADE);
        if (upgrade == null || !"websocket".equalsIgnoreCase(upgrade.trim())) {
            reject(response, SC_UPGRADE_REQUIRED, "Expected WebSocket upgrade");
            return;
        }

        String origin = request.getHeader(HttpHeaders.ORIGIN);
        if (origin != null && !webProperties.isOriginAllowed(origin)) {
            log.warn("Reject upgrade, origin not allowed: origin={}", origin);
            reject(response, HttpServletResponse.SC_FORBIDDEN, "Origin not allowed");
            return;
        }

        String scenarioId = request.getParameter("scenario");
        if (scenarioId == null || scenarioId.isEmpty()) {
            reject(response, HttpServletResponse.SC_BAD_REQUEST, "Missing scenario query parameter");
            return;
        }
        if (scenarioProvider.get(scenarioId).isEmpty()) {
            log.warn("Reject upgrade, unknown scenario: scenarioId={}", scenarioId);
            reject(response, HttpServletResponse.SC_BAD_REQUEST, "Unknown scenario: " + scenarioId);
            return;
        }
        filterChain.doFilter(request, response);
    }

    private static void reject(HttpServletResponse response, int status, String message) throws IOException {
        response.setStatus(status);
        response.setContentType("text/plain;charset=UTF-8");
        response.setHeader(HttpHeaders.CACHE_CONTROL, "no-store");
        response.getWriter().write(message);
    }
}
