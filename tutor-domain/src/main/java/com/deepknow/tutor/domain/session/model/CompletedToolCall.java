package com.deepknow.tutor.domain.session.model;

/**
 * 参数流结束后组装出的完整调用。
 */
public final class CompletedToolCall {
    private final String callId;
    private final String name;
    private final String arguments;

    public CompletedToolCall(String callId, String name, String arguments) {
        this.callId = callId;
        this.name = name == null ? "" : name;
        this.arguments = arguments;
    }

    public String getCallId() { return callId; }
    public String getName() { return name; }
    public String getArguments() { return arguments; }

    @Override
    public String toString() {
        return "CompletedToolCall{" +
                "callId='" + callId + '\'' +
                ", name='" + name + '\'' +
                ", argsLen=" + (arguments == null ? 0 : arguments.length()) +
                '}';
    }
}
