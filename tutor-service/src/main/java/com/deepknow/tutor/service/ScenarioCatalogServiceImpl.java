package com.deepknow.tutor.service;

import com.deepknow.tutor.api.ScenarioCatalogService;
import com.deepknow.tutor.api.model.ScenarioDetail;
import com.deepknow.tutor.api.model.ScenarioSummary;
import com.deepknow.tutor.api.model.ToolSpec;
import com.deepknow.tutor.domain.scenario.model.Scenario;
import com.deepknow.tutor.domain.scenario.model.ScenarioTool;
import com.deepknow.tutor.domain.scenario.service.ScenarioProvider;
import org.apache.dubbo.config.annotation.DubboService;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

@DubboService
@Service
public class ScenarioCatalogServiceImpl implements ScenarioCatalogService {
    private final ScenarioProvider scenarioProvider;

    public ScenarioCatalogServiceImpl(ScenarioProvider scenarioProvider) {
        this.scenarioProvider = scenarioProvider;
    }

    @Override
    public List<ScenarioSummary> listScenarios() {
        return scenarioProvider.index().stream()
                .map(e -> new ScenarioSummary(e.getId(), e.getLevel(), e.getTitle()))
                .collect(Collectors.toList());
    }

    @Override
    public ScenarioDetail getScenario(String id) {
        if (id == null) return null;
        return scenarioProvider.get(id).map(ScenarioCatalogServiceImpl::toDetail).orElse(null);
    }

    private static ScenarioDetail toDetail(Scenario s) {
        ScenarioDetail d = new ScenarioDetail();
        d.setId(s.getId());
        d.setLevel(s.getLevel());
        d.setTitle(s.getTitle());
        d.setSystem(s.getSystem());
        d.setOpeningLine(s.getOpeningLine());
        d.setTools(s.getTools().stream().map(ScenarioCatalogServiceImpl::toSpec).collect(Collectors.toList()));
        return d;
    }

    private static ToolSpec toSpec(ScenarioTool t) {
        ToolSpec spec = new ToolSpec();
        spec.setType(t.getType());
        spec.setName(t.getName());
        spec.setDescription(t.getDescription());
        if (t.getParameters() != null) spec.setParameters(new LinkedHashMap<>(t.getParameters()));
        return spec;
    }
}
