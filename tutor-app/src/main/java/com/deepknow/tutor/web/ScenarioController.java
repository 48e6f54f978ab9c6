package com.deepknow.tutor.web;

import com.deepknow.tutor.api.ScenarioCatalogService;
import com.deepknow.tutor.api.model.ScenarioDetail;
import com.deepknow.tutor.api.model.ScenarioSummary;
import com.deepknow.tutor.domain.session.service.RealtimeBridgeService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class ScenarioController {

    private final ScenarioCatalogService scenarioCatalogService;
    private final RealtimeBridgeService bridgeService;

    public ScenarioController(ScenarioCatalogService scenarioCatalogService,
                              RealtimeBridgeService bridgeService) {
        this.scenarioCatalogService = scenarioCatalogService;
        this.bridgeService = bridgeService;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("ok", true);
        health.put("sessions", bridgeService.activeSessionCount());
        return health;
    }

    @GetMapping("/scenarios")
    public List<ScenarioSummary> listScenarios() {
        return scenarioCatalogService.listScenarios();
    }

    @GetMapping("/scenarios/{id}")
    public ResponseEntity<?> getScenario(@PathVariable("id") String id) {
        ScenarioDetail detail = scenarioCatalogService.getScenario(id);
        if (detail == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Scenario not found"));
        }
        return ResponseEntity.ok(detail);
    }
}
