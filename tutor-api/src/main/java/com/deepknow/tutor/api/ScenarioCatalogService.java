package com.deepknow.tutor.api;

import com.deepknow.tutor.api.model.ScenarioDetail;
import com.deepknow.tutor.api.model.ScenarioSummary;

import java.util.List;

/**
 * 课程场景目录：对外暴露场景索引与单个场景定义的只读查询。
 */
public interface ScenarioCatalogService {
    List<ScenarioSummary> listScenarios();

    /**
     * 按 id 查询场景定义；不存在时返回 null。
     */
    ScenarioDetail getScenario(String id);
}
