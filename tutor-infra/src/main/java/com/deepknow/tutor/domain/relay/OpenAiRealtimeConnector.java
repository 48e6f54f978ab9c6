package com.deepknow.tutor.domain.relay;

import com.deepknow.tutor.config.RealtimeUpstreamProperties;
import com.deepknow.tutor.websocket.WebSocketSessionChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.websocket.ClientEndpointConfig;
import javax.websocket.CloseReason;
import javax.websocket.ContainerProvider;
import javax.websocket.Endpoint;
import javax.websocket.EndpointConfig;
import javax.websocket.MessageHandler;
import javax.websocket.Session;
import javax.websocket.WebSocketContainer;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * OpenAI Realtime WebSocket 连接器。
 * 握手在独立线程池中执行，不阻塞任何会话；超过 handshakeTimeoutMillis 视为失败。
 */
public class OpenAiRealtimeConnector implements UpstreamConnector, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OpenAiRealtimeConnector.class);
    private static final String TOMCAT_IO_TIMEOUT = "org.apache.tomcat.websocket.IO_TIMEOUT_MS";

    private final RealtimeUpstreamProperties props;
    private final WebSocketContainer container;
    private final ExecutorService connectExecutor;

    public OpenAiRealtimeConnector(RealtimeUpstreamProperties props) {
        this(props, ContainerProvider.getWebSocketContainer());
    }

    public OpenAiRealtimeConnector(RealtimeUpstreamProperties props, WebSocketContainer container) {
        this.props = props;
        this.container = container;
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "upstream-connect-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.connectExecutor = Executors.newCachedThreadPool(threadFactory);
        this.container.setDefaultMaxTextMessageBufferSize(props.getMaxMessageBytes());
        this.container.setDefaultMaxBinaryMessageBufferSize(props.getMaxMessageBytes());
    }

    @Override
    public CompletableFuture<RealtimeChannel> connect(UpstreamListener listener) {
        CompletableFuture<RealtimeChannel> future = new CompletableFuture<>();
        connectExecutor.execute(() -> {
            try {
                RealtimeChannel channel = doConnect(listener);
                if (!future.complete(channel)) {
                    // 握手已超时，调用方不会再使用该连接
                    log.warn("Upstream handshake finished after timeout; closing ws={}", channel.id());
                    channel.close(CloseReason.CloseCodes.NORMAL_CLOSURE.getCode(), "Handshake abandoned");
                }
            } catch (Exception e) {
                future.completeExceptionally(e);
            }
        });
        return future.orTimeout(props.getHandshakeTimeoutMillis(), TimeUnit.MILLISECONDS);
    }

    private RealtimeChannel doConnect(UpstreamListener listener) throws Exception {
        String apiKey = props.resolveApiKey();
        if (apiKey == null || apiKey.isEmpty()) {
            throw new IllegalStateException("OpenAI API key is not configured (env " + props.getApiKeyEnv() + ")");
        }
        URI uri = URI.create(props.getUrl() + "?model=" + URLEncoder.encode(props.getModel(), StandardCharsets.UTF_8));
        ClientEndpointConfig config = buildConfig(apiKey);
        config.getUserProperties().put(TOMCAT_IO_TIMEOUT, String.valueOf(props.getHandshakeTimeoutMillis()));

        log.info("Upstream connecting: url={} model={} credentialMode={}", props.getUrl(), props.getModel(), props.getCredentialMode());
        Session session = container.connectToServer(new UpstreamEndpoint(listener, props.getMaxMessageBytes()), config, uri);
        log.info("Upstream connected: ws={} subprotocol={}", session.getId(), session.getNegotiatedSubprotocol());
        return new WebSocketSessionChannel(session, "upstream");
    }

    ClientEndpointConfig buildConfig(String apiKey) {
        ClientEndpointConfig.Builder builder = ClientEndpointConfig.Builder.create();
        if (props.getCredentialMode() == RealtimeUpstreamProperties.CredentialMode.SUBPROTOCOL) {
            // 无法设置自定义请求头的环境下，OpenAI 接受通过子协议携带密钥
            List<String> protocols = new ArrayList<>();
            protocols.add("realtime");
            protocols.add("openai-insecure-api-key." + apiKey);
            protocols.add("openai-beta.realtime-v1");
            builder.preferredSubprotocols(protocols);
        } else {
            builder.configurator(new ClientEndpointConfig.Configurator() {
                @Override
                public void beforeRequest(Map<String, List<String>> headers) {
                    headers.put("Authorization", List.of("Bearer " + apiKey));
                    headers.put("OpenAI-Beta", List.of("realtime=v1"));
                }
            });
        }
        return builder.build();
    }

    @Override
    public void close() {
        connectExecutor.shutdownNow();
    }

    /**
     * 上游连接端点：把容器回调转交给会话监听器。
     */
    static class UpstreamEndpoint extends Endpoint {
        private final UpstreamListener listener;
        private final int maxMessageBytes;

        UpstreamEndpoint(UpstreamListener listener, int maxMessageBytes) {
            this.listener = listener;
            this.maxMessageBytes = maxMessageBytes;
        }

        @Override
        public void onOpen(Session session, EndpointConfig config) {
            session.setMaxTextMessageBufferSize(maxMessageBytes);
            session.setMaxBinaryMessageBufferSize(maxMessageBytes);
            session.addMessageHandler(String.class, new MessageHandler.Whole<String>() {
                @Override
                public void onMessage(String message) {
                    listener.onText(message);
                }
            });
            session.addMessageHandler(ByteBuffer.class, new MessageHandler.Whole<ByteBuffer>() {
                @Override
                public void onMessage(ByteBuffer message) {
                    listener.onBinary(message);
                }
            });
        }

        @Override
        public void onClose(Session session, CloseReason closeReason) {
            listener.onClose(closeReason.getCloseCode().getCode(), closeReason.getReasonPhrase());
        }

        @Override
        public void onError(Session session, Throwable thr) {
            listener.onError(thr);
        }
    }
}
