package com.deepknow.tutor.domain.session;

import com.deepknow.tutor.domain.relay.ClientEventWhitelist;
import com.deepknow.tutor.domain.relay.RealtimeChannel;
import com.deepknow.tutor.domain.relay.RealtimeEventCodec;
import com.deepknow.tutor.domain.relay.UpstreamConnector;
import com.deepknow.tutor.domain.relay.UpstreamListener;
import com.deepknow.tutor.domain.relay.event.FunctionCallArgumentsDelta;
import com.deepknow.tutor.domain.relay.event.FunctionCallArgumentsDone;
import com.deepknow.tutor.domain.relay.event.RealtimeEvent;
import com.deepknow.tutor.domain.scenario.model.Scenario;
import com.deepknow.tutor.domain.scenario.service.ScenarioProvider;
import com.deepknow.tutor.domain.session.model.BridgeState;
import com.deepknow.tutor.domain.session.model.CompletedToolCall;
import com.deepknow.tutor.domain.session.util.ToolCallAccumulator;
import com.deepknow.tutor.domain.tool.ToolDispatcher;
import com.deepknow.tutor.domain.tool.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 单个会话的桥接 actor：持有一条客户端连接与一条上游连接。
 * 所有事件（客户端帧、上游帧、握手结果、关闭通知）都投递到本会话的 mailbox 串行执行，
 * 会话内可变状态只在 mailbox 线程上读写。
 */
public class RealtimeBridgeSession {
    private static final Logger log = LoggerFactory.getLogger(RealtimeBridgeSession.class);

    static final int NORMAL_CLOSURE = 1000;
    static final int POLICY_VIOLATION = 1008;
    static final int INTERNAL_ERROR = 1011;

    private final String wsSessionId;
    private final String scenarioId;
    private final String userId;
    private final RealtimeChannel client;
    private final ScenarioProvider scenarioProvider;
    private final UpstreamConnector upstreamConnector;
    private final ToolDispatcher toolDispatcher;
    private final RealtimeEventCodec codec;
    private final Executor mailbox;
    private final Runnable onTerminated;

    private final ToolCallAccumulator toolCalls = new ToolCallAccumulator();
    private volatile BridgeState state = BridgeState.INIT;
    private RealtimeChannel upstream;

    public RealtimeBridgeSession(String wsSessionId,
                                 String scenarioId,
                                 String userId,
                                 RealtimeChannel client,
                                 ScenarioProvider scenarioProvider,
                                 UpstreamConnector upstreamConnector,
                                 ToolDispatcher toolDispatcher,
                                 RealtimeEventCodec codec,
                                 Executor mailbox,
                                 Runnable onTerminated) {
        this.wsSessionId = wsSessionId;
        this.scenarioId = scenarioId;
        this.userId = userId;
        this.client = client;
        this.scenarioProvider = scenarioProvider;
        this.upstreamConnector = upstreamConnector;
        this.toolDispatcher = toolDispatcher;
        this.codec = codec;
        this.mailbox = mailbox;
        this.onTerminated = onTerminated;
    }

    public void start() {
        submit(this::resolveAndConnect);
    }

    public void onClientText(String text) {
        submit(() -> handleClientText(text));
    }

    public void onClientBinary(int bytes) {
        log.trace("Drop binary client frame: wsSessionId={} bytes={}", wsSessionId, bytes);
    }

    public void onClientClosed() {
        submit(() -> shutdown(NORMAL_CLOSURE, "Client disconnected", NORMAL_CLOSURE, "Client disconnected"));
    }

    public void onClientError(Throwable error) {
        log.warn("Client channel error: wsSessionId={}", wsSessionId, error);
        submit(() -> shutdown(NORMAL_CLOSURE, "Client disconnected", INTERNAL_ERROR, "Client error"));
    }

    public BridgeState getState() { return state; }
    public String getScenarioId() { return scenarioId; }
    public String getUserId() { return userId; }

    int pendingToolCallCount() {
        return toolCalls.size();
    }

    // ====== 生命周期 ======

    private void resolveAndConnect() {
        if (state != BridgeState.INIT) return;
        state = BridgeState.RESOLVING_SCENARIO;
        Optional<Scenario> resolved = scenarioProvider.get(scenarioId);
        if (resolved.isEmpty()) {
            log.warn("Unknown scenario, close session: wsSessionId={} scenarioId={}", wsSessionId, scenarioId);
            shutdown(NORMAL_CLOSURE, "Unknown scenario", POLICY_VIOLATION, "Unknown scenario: " + scenarioId);
            return;
        }
        Scenario scenario = resolved.get();

        state = BridgeState.CONNECTING_UPSTREAM;
        log.info("Connecting upstream: wsSessionId={} scenarioId={} userId={}", wsSessionId, scenarioId, userId);
        CompletableFuture<RealtimeChannel> handshake;
        try {
            handshake = upstreamConnector.connect(new SessionUpstreamListener());
        } catch (RuntimeException e) {
            handshake = CompletableFuture.failedFuture(e);
        }
        handshake.whenComplete((channel, error) -> {
            if (!submit(() -> onUpstreamConnected(scenario, channel, error)) && channel != null) {
                channel.close(NORMAL_CLOSURE, "Session closed");
            }
        });
    }

    private void onUpstreamConnected(Scenario scenario, RealtimeChannel channel, Throwable error) {
        if (state == BridgeState.CLOSED) {
            // 客户端在握手期间已离开
            if (channel != null) channel.close(NORMAL_CLOSURE, "Client disconnected");
            return;
        }
        if (error != null) {
            String message = describeConnectFailure(error);
            log.warn("Upstream connect failed: wsSessionId={} scenarioId={} reason={}", wsSessionId, scenarioId, message);
            sendClient(codec.error(message));
            shutdown(NORMAL_CLOSURE, "Upstream connect failed", INTERNAL_ERROR, message);
            return;
        }
        upstream = channel;
        if (!channel.isOpen()) {
            log.warn("Upstream closed during handshake: wsSessionId={}", wsSessionId);
            shutdown(NORMAL_CLOSURE, "Upstream closed", NORMAL_CLOSURE, "Upstream closed");
            return;
        }
        state = BridgeState.ACTIVE;
        log.info("Session active: wsSessionId={} scenarioId={} upstream={}", wsSessionId, scenarioId, channel.id());

        sendUpstream(codec.sessionUpdate(scenario));
        sendUpstream(codec.assistantMessage(scenario.getOpeningLine()));
        sendUpstream(codec.responseCreate());
    }

    private void shutdown(int upstreamCode, String upstreamReason, int clientCode, String clientReason) {
        if (state == BridgeState.CLOSED) return;
        BridgeState previous = state;
        state = BridgeState.CLOSED;
        runSafe(() -> { if (upstream != null) upstream.close(upstreamCode, upstreamReason); }, "Upstream close error");
        runSafe(() -> client.close(clientCode, clientReason), "Client close error");
        int dropped = toolCalls.size();
        toolCalls.clear();
        log.info("Session closed: wsSessionId={} from={} droppedToolCalls={}", wsSessionId, previous, dropped);
        runSafe(onTerminated, "Session terminate callback error");
    }

    // ====== 客户端 -> 上游 ======

    private void handleClientText(String text) {
        if (state != BridgeState.ACTIVE) {
            log.debug("Drop client message, session not active: wsSessionId={} state={}", wsSessionId, state);
            return;
        }
        Optional<ObjectNode> parsed = codec.parseObject(text);
        if (parsed.isEmpty()) {
            log.debug("Drop malformed client message: wsSessionId={} len={}", wsSessionId, text == null ? 0 : text.length());
            return;
        }
        JsonNode typeNode = parsed.get().get("type");
        String type = typeNode != null && typeNode.isTextual() ? typeNode.asText() : null;
        if (!ClientEventWhitelist.isAllowed(type)) {
            log.info("Reject client event: wsSessionId={} type={}", wsSessionId, type);
            sendClient(codec.error("Event type not allowed: " + type));
            return;
        }
        upstream.sendText(text);
    }

    // ====== 上游 -> 客户端 ======

    private void handleUpstreamText(String text) {
        Optional<RealtimeEvent> event = codec.decode(text);
        if (event.isPresent()) {
            RealtimeEvent e = event.get();
            if (e instanceof FunctionCallArgumentsDelta) {
                onToolCallDelta((FunctionCallArgumentsDelta) e);
            } else if (e instanceof FunctionCallArgumentsDone) {
                onToolCallDone((FunctionCallArgumentsDone) e);
            }
        } else {
            log.debug("Upstream message is not a JSON object, relay as-is: wsSessionId={}", wsSessionId);
        }
        client.sendText(text);
    }

    private void handleUpstreamClosed(int code, String reason) {
        if (state == BridgeState.CLOSED || state == BridgeState.CONNECTING_UPSTREAM) return;
        log.info("Upstream closed: wsSessionId={} code={} reason={}", wsSessionId, code, reason);
        String clientReason = reason == null || reason.isEmpty() ? "Upstream closed" : reason;
        shutdown(NORMAL_CLOSURE, "Upstream closed", NORMAL_CLOSURE, clientReason);
    }

    private void handleUpstreamError(Throwable error) {
        if (state != BridgeState.ACTIVE) {
            // 握手阶段的错误由握手结果统一处理
            log.debug("Upstream error before active: wsSessionId={} state={}", wsSessionId, state, error);
            return;
        }
        log.warn("Upstream error: wsSessionId={}", wsSessionId, error);
        shutdown(INTERNAL_ERROR, "Upstream error", INTERNAL_ERROR, "Upstream error");
    }

    // ====== 函数调用 ======

    private void onToolCallDelta(FunctionCallArgumentsDelta delta) {
        if (!toolCalls.onDelta(delta.getCallId(), delta.getName(), delta.getDelta())) {
            log.debug("Ignore tool call delta without call_id/delta: wsSessionId={}", wsSessionId);
        }
    }

    private void onToolCallDone(FunctionCallArgumentsDone done) {
        CompletedToolCall call = toolCalls.complete(done.getCallId(), done.getName(), done.getArguments());
        if (call == null) {
            log.debug("Ignore tool call done without call_id: wsSessionId={}", wsSessionId);
            return;
        }
        log.info("Tool call complete: wsSessionId={} {}", wsSessionId, call);

        ToolResult result;
        try {
            ObjectNode args = codec.parseArguments(call.getArguments());
            result = dispatch(call, args);
        } catch (IllegalArgumentException e) {
            log.warn("Tool arguments parse failed: wsSessionId={} callId={} reason={}", wsSessionId, call.getCallId(), e.getMessage());
            result = ToolResult.failure("Failed to parse tool arguments: " + e.getMessage());
        }

        sendUpstream(codec.functionCallOutput(call.getCallId(), result));
        sendUpstream(codec.responseCreate());
    }

    private ToolResult dispatch(CompletedToolCall call, ObjectNode args) {
        try {
            return toolDispatcher.execute(call.getName(), args, scenarioId);
        } catch (RuntimeException e) {
            log.warn("Tool execution failed: wsSessionId={} tool={}", wsSessionId, call.getName(), e);
            return ToolResult.failure("Tool execution failed: " + e.getMessage());
        }
    }

    // ====== 辅助 ======

    private void sendUpstream(ObjectNode event) {
        if (upstream == null || !upstream.isOpen()) {
            log.debug("Drop upstream event, channel not open: wsSessionId={} type={}", wsSessionId, event.path("type").asText());
            return;
        }
        upstream.sendText(codec.write(event));
    }

    private void sendClient(ObjectNode event) {
        if (!client.isOpen()) return;
        client.sendText(codec.write(event));
    }

    private boolean submit(Runnable task) {
        try {
            mailbox.execute(() -> runSafe(task, "Session task failed"));
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("Session mailbox closed, drop task: wsSessionId={}", wsSessionId);
            return false;
        }
    }

    private void runSafe(Runnable action, String warnTag) {
        try {
            action.run();
        } catch (Exception e) {
            log.warn(warnTag + ". wsSessionId=" + wsSessionId, e);
        }
    }

    private static String describeConnectFailure(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) return "Upstream handshake timed out";
        String msg = cause.getMessage();
        return msg == null || msg.isEmpty() ? "Failed to connect upstream" : msg;
    }

    /**
     * 上游回调运行在容器 IO 线程上，只负责投递到 mailbox。
     */
    private class SessionUpstreamListener implements UpstreamListener {
        @Override
        public void onText(String text) {
            submit(() -> handleUpstreamText(text));
        }

        @Override
        public void onBinary(ByteBuffer data) {
            ByteBuffer copy = ByteBuffer.allocate(data.remaining());
            copy.put(data.duplicate()).flip();
            submit(() -> client.sendBinary(copy));
        }

        @Override
        public void onClose(int code, String reason) {
            submit(() -> handleUpstreamClosed(code, reason));
        }

        @Override
        public void onError(Throwable error) {
            submit(() -> handleUpstreamError(error));
        }
    }
}
