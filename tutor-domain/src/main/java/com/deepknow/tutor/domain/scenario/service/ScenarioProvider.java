package com.deepknow.tutor.domain.scenario.service;

import com.deepknow.tutor.domain.scenario.model.Scenario;
import com.deepknow.tutor.domain.scenario.model.ScenarioIndexEntry;

import java.util.List;
import java.util.Optional;

/**
 * 场景只读查询。实现须在构造完成后不可变，可被所有会话并发共享。
 */
public interface ScenarioProvider {
    /**
     * 场景索引，保持目录声明顺序。
     */
    List<ScenarioIndexEntry> index();

    /**
     * 按 id 查询；未知 id 返回 empty 而不是抛异常，调用方据此给出明确拒绝。
     */
    Optional<Scenario> get(String id);
}
