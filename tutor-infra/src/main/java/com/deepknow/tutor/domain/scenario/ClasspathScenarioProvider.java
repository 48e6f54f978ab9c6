package com.deepknow.tutor.domain.scenario;

import com.deepknow.tutor.domain.scenario.model.Scenario;
import com.deepknow.tutor.domain.scenario.model.ScenarioIndexEntry;
import com.deepknow.tutor.domain.scenario.service.ScenarioProvider;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 内置场景目录：启动时从 classpath 读取 index.json 与各场景定义，构造后不可变。
 */
public class ClasspathScenarioProvider implements ScenarioProvider {
    private static final Logger log = LoggerFactory.getLogger(ClasspathScenarioProvider.class);

    private final List<ScenarioIndexEntry> index;
    private final Map<String, Scenario> scenarios;

    public ClasspathScenarioProvider(ObjectMapper objectMapper, String location) {
        String base = location == null || location.isEmpty() ? "scenarios" : trimSlashes(location);
        List<ScenarioIndexEntry> entries = read(objectMapper, base + "/index.json",
                new TypeReference<List<ScenarioIndexEntry>>() {});
        Map<String, Scenario> loaded = new LinkedHashMap<>();
        for (ScenarioIndexEntry entry : entries) {
            if (entry.getId() == null || entry.getId().isEmpty()) {
                throw new IllegalStateException("Scenario index entry without id in " + base + "/index.json");
            }
            Scenario scenario = read(objectMapper, base + "/" + entry.getId() + ".json", new TypeReference<Scenario>() {});
            if (!entry.getId().equals(scenario.getId())) {
                throw new IllegalStateException("Scenario id mismatch: index=" + entry.getId() + " file=" + scenario.getId());
            }
            loaded.put(entry.getId(), scenario);
        }
        this.index = List.copyOf(entries);
        this.scenarios = Collections.unmodifiableMap(loaded);
        log.info("Scenario catalog loaded: location={} count={} ids={}", base, scenarios.size(), scenarios.keySet());
    }

    @Override
    public List<ScenarioIndexEntry> index() {
        return index;
    }

    @Override
    public Optional<Scenario> get(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(scenarios.get(id));
    }

    private static <T> T read(ObjectMapper objectMapper, String path, TypeReference<T> type) {
        ClassPathResource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            throw new IllegalStateException("Scenario resource not found: classpath:" + path);
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load scenario resource: classpath:" + path, e);
        }
    }

    private static String trimSlashes(String s) {
        String t = s.trim();
        if (t.startsWith("classpath:")) t = t.substring("classpath:".length());
        while (t.startsWith("/")) t = t.substring(1);
        while (t.endsWith("/")) t = t.substring(0, t.length() - 1);
        return t;
    }
}
