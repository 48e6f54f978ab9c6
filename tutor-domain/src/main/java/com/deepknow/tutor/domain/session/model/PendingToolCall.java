package com.deepknow.tutor.domain.session.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 尚未结束的函数调用：按到达顺序保存参数片段。
 */
public class PendingToolCall {
    private final String callId;
    private String name;
    private final List<String> fragments = new ArrayList<>();

    public PendingToolCall(String callId, String name) {
        this.callId = callId;
        this.name = name == null ? "" : name;
    }

    public String getCallId() { return callId; }
    public String getName() { return name; }
    public List<String> getFragments() { return Collections.unmodifiableList(fragments); }

    public void rename(String name) {
        if (name != null && !name.isEmpty()) this.name = name;
    }

    public void append(String delta) {
        fragments.add(delta);
    }

    public String joinedArguments() {
        return String.join("", fragments);
    }
}
