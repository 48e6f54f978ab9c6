package com.deepknow.tutor.domain.session;

import com.deepknow.tutor.domain.relay.RealtimeChannel;
import com.deepknow.tutor.domain.relay.RealtimeEventCodec;
import com.deepknow.tutor.domain.relay.UpstreamConnector;
import com.deepknow.tutor.domain.scenario.service.ScenarioProvider;
import com.deepknow.tutor.domain.session.service.RealtimeBridgeService;
import com.deepknow.tutor.domain.tool.ToolDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

@Service
public class RealtimeBridgeServiceImpl implements RealtimeBridgeService {
    private static final Logger logger = LoggerFactory.getLogger(RealtimeBridgeServiceImpl.class);

    private final ConcurrentHashMap<String, RealtimeBridgeSession> activeSessions = new ConcurrentHashMap<>();

    private final ScenarioProvider scenarioProvider;
    private final UpstreamConnector upstreamConnector;
    private final ToolDispatcher toolDispatcher;
    private final RealtimeEventCodec codec;
    private final Function<String, Executor> mailboxFactory;

    @Autowired
    public RealtimeBridgeServiceImpl(ScenarioProvider scenarioProvider,
                                     UpstreamConnector upstreamConnector,
                                     ToolDispatcher toolDispatcher,
                                     RealtimeEventCodec codec) {
        this(scenarioProvider, upstreamConnector, toolDispatcher, codec, RealtimeBridgeServiceImpl::newMailbox);
    }

    RealtimeBridgeServiceImpl(ScenarioProvider scenarioProvider,
                              UpstreamConnector upstreamConnector,
                              ToolDispatcher toolDispatcher,
                              RealtimeEventCodec codec,
                              Function<String, Executor> mailboxFactory) {
        this.scenarioProvider = scenarioProvider;
        this.upstreamConnector = upstreamConnector;
        this.toolDispatcher = toolDispatcher;
        this.codec = codec;
        this.mailboxFactory = mailboxFactory;
    }

    @Override
    public void open(String wsSessionId, String scenarioId, String userId, RealtimeChannel client) {
        if (scenarioId == null || scenarioProvider.get(scenarioId).isEmpty()) {
            logger.warn("Reject session, unknown scenario: wsSessionId={}, scenarioId={}", wsSessionId, scenarioId);
            client.close(RealtimeBridgeSession.POLICY_VIOLATION, "Unknown scenario: " + scenarioId);
            return;
        }
        if (activeSessions.containsKey(wsSessionId)) {
            logger.warn("Session already open, ignore: wsSessionId={}", wsSessionId);
            return;
        }

        Executor mailbox = mailboxFactory.apply(wsSessionId);
        RealtimeBridgeSession[] holder = new RealtimeBridgeSession[1];
        Runnable onTerminated = () -> {
            activeSessions.remove(wsSessionId, holder[0]);
            if (mailbox instanceof ExecutorService) {
                ((ExecutorService) mailbox).shutdown();
            }
            logger.info("Closed session: wsSessionId={}, scenarioId={}", wsSessionId, scenarioId);
        };
        RealtimeBridgeSession session = new RealtimeBridgeSession(
                wsSessionId, scenarioId, userId, client,
                scenarioProvider, upstreamConnector, toolDispatcher, codec,
                mailbox, onTerminated);
        holder[0] = session;

        logger.info("Open session: wsSessionId={}, scenarioId={}, userId={}", wsSessionId, scenarioId, userId);
        activeSessions.put(wsSessionId, session);
        session.start();
    }

    @Override
    public void onClientText(String wsSessionId, String text) {
        RealtimeBridgeSession session = activeSessions.get(wsSessionId);
        if (session != null) {
            session.onClientText(text);
        } else {
            logger.debug("Message arrived for unknown session: wsSessionId={}", wsSessionId);
        }
    }

    @Override
    public void onClientBinary(String wsSessionId, int bytes) {
        RealtimeBridgeSession session = activeSessions.get(wsSessionId);
        if (session != null) {
            session.onClientBinary(bytes);
        }
    }

    @Override
    public void onClientClosed(String wsSessionId) {
        RealtimeBridgeSession session = activeSessions.get(wsSessionId);
        if (session != null) {
            session.onClientClosed();
        }
    }

    @Override
    public void onClientError(String wsSessionId, Throwable error) {
        RealtimeBridgeSession session = activeSessions.get(wsSessionId);
        if (session != null) {
            session.onClientError(error);
        } else {
            logger.warn("Client error on unknown session: wsSessionId={}", wsSessionId, error);
        }
    }

    @Override
    public int activeSessionCount() {
        return activeSessions.size();
    }

    RealtimeBridgeSession find(String wsSessionId) {
        return activeSessions.get(wsSessionId);
    }

    /**
     * 每个会话一个单线程 mailbox，保证同一会话的事件按到达顺序处理。
     */
    private static Executor newMailbox(String wsSessionId) {
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "bridge-session-" + wsSessionId);
            t.setDaemon(true);
            return t;
        };
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), tf);
    }
}
