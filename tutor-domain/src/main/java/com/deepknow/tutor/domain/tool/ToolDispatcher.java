package com.deepknow.tutor.domain.tool;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * 工具分发：按名称精确匹配固定工具集。未知名称返回失败结果，从不抛异常。
 */
public interface ToolDispatcher {
    ToolResult execute(String name, ObjectNode args, String scenarioId);
}
