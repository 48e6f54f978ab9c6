package com.deepknow.tutor.domain.session.util;

import com.deepknow.tutor.domain.session.model.CompletedToolCall;
import com.deepknow.tutor.domain.session.model.PendingToolCall;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 函数调用参数累加器：按 call_id 收集流式参数片段，结束事件到达时拼接并移除。
 * 仅由所属会话的事件线程访问，不做同步。
 */
public class ToolCallAccumulator {
    static final String EMPTY_ARGUMENTS = "{}";

    private final Map<String, PendingToolCall> pending = new LinkedHashMap<>();

    /**
     * 记录一个参数片段。缺少 call_id 或 delta 的片段被忽略。
     *
     * @return 是否被记录
     */
    public boolean onDelta(String callId, String name, String delta) {
        if (callId == null || callId.isEmpty() || delta == null) return false;
        PendingToolCall call = pending.computeIfAbsent(callId, id -> new PendingToolCall(id, name));
        call.rename(name);
        call.append(delta);
        return true;
    }

    /**
     * 结束一次调用：有累积片段时按到达顺序拼接，否则退回事件自带的 arguments，再退回 "{}"。
     * 名称优先取累积记录中的非空名称。
     *
     * @return 组装后的调用；call_id 缺失时返回 null
     */
    public CompletedToolCall complete(String callId, String name, String arguments) {
        if (callId == null || callId.isEmpty()) return null;
        PendingToolCall call = pending.remove(callId);
        String args;
        String toolName;
        if (call != null) {
            args = call.joinedArguments();
            toolName = call.getName().isEmpty() ? name : call.getName();
        } else {
            args = arguments == null || arguments.isEmpty() ? EMPTY_ARGUMENTS : arguments;
            toolName = name;
        }
        return new CompletedToolCall(callId, toolName, args);
    }

    public boolean contains(String callId) {
        return pending.containsKey(callId);
    }

    public int size() {
        return pending.size();
    }

    public void clear() {
        pending.clear();
    }
}
