package me.go_gradually.liveavatar.application.bridge.usecase;

import me.go_gradually.liveavatar.application.bridge.model.BridgeSession;
import me.go_gradually.liveavatar.application.bridge.model.ClientCommand;
import me.go_gradually.liveavatar.application.bridge.model.ClientCommandType;
import me.go_gradually.liveavatar.application.bridge.model.ClientSink;
import me.go_gradually.liveavatar.application.bridge.model.OutboundMessage;
import me.go_gradually.liveavatar.application.bridge.model.SessionConfigException;
import me.go_gradually.liveavatar.application.bridge.model.StartSessionCommand;
import me.go_gradually.liveavatar.application.bridge.model.UpstreamConnectCommand;
import me.go_gradually.liveavatar.application.bridge.model.UpstreamCredential;
import me.go_gradually.liveavatar.application.bridge.policy.BridgePolicy;
import me.go_gradually.liveavatar.application.bridge.port.UpstreamGateway;
import me.go_gradually.liveavatar.application.shared.port.MetricsPort;
import me.go_gradually.liveavatar.domain.session.ClientId;
import me.go_gradually.liveavatar.domain.session.ConnectionMode;
import me.go_gradually.liveavatar.domain.session.SessionConfig;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

public class SessionRegistry {
    private static final Logger log = Logger.getLogger(SessionRegistry.class.getName());

    private final ConcurrentHashMap<ClientId, VoiceLiveBridgeSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ClientId, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final AtomicLong audioWithoutSession = new AtomicLong();
    private final UpstreamGateway gateway;
    private final SessionSetup setup;
    private final FunctionCallOrchestrator orchestrator;
    private final ExecutorService executor;
    private final BridgePolicy policy;
    private final MetricsPort metrics;

    public SessionRegistry(UpstreamGateway gateway,
                           SessionSetup setup,
                           FunctionCallOrchestrator orchestrator,
                           ExecutorService executor,
                           BridgePolicy policy,
                           MetricsPort metrics) {
        this.gateway = gateway;
        this.setup = setup;
        this.orchestrator = orchestrator;
        this.executor = executor;
        this.policy = policy;
        this.metrics = metrics;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String firstNonBlank(String candidate, String fallback) {
        return isBlank(candidate) ? fallback : candidate;
    }

    public Optional<BridgeSession> startSession(ClientId clientId, StartSessionCommand command, ClientSink sink) {
        ReentrantLock lock = acquire(clientId);
        try {
            teardown(clientId);
            UpstreamConnectCommand connectCommand;
            try {
                connectCommand = resolveConnection(command);
            } catch (SessionConfigException e) {
                metrics.incrementSessionFailed();
                log.warning("bridge.session.config_error clientId=" + clientId + " reason=" + e.getMessage());
                notifyClient(sink, OutboundMessage.sessionError(e.getMessage()), clientId);
                return Optional.empty();
            }

            VoiceLiveBridgeSession session = new VoiceLiveBridgeSession(
                    clientId,
                    command.config(),
                    connectCommand,
                    sink,
                    gateway,
                    setup,
                    orchestrator,
                    policy,
                    metrics,
                    closed -> sessions.remove(clientId, closed)
            );
            sessions.put(clientId, session);
            try {
                executor.execute(session);
            } catch (RejectedExecutionException e) {
                sessions.remove(clientId, session);
                session.stop();
                metrics.incrementSessionFailed();
                log.log(Level.WARNING, "bridge.session.rejected clientId=" + clientId, e);
                notifyClient(sink, OutboundMessage.sessionError("Server is not accepting new sessions"), clientId);
                return Optional.empty();
            }
            log.info(() -> "bridge.session.scheduled clientId=" + clientId + " mode=" + command.config().mode().code()
                    + " active=" + sessions.size());
            return Optional.of(session);
        } finally {
            release(clientId, lock);
        }
    }

    public void stopSession(ClientId clientId) {
        ReentrantLock lock = acquire(clientId);
        try {
            teardown(clientId);
        } finally {
            release(clientId, lock);
        }
    }

    public void dispatch(ClientId clientId, ClientCommand command) {
        BridgeSession session = sessions.get(clientId);
        if (session == null) {
            warnNoSession(clientId, command);
            return;
        }
        try {
            switch (command.type()) {
                case AUDIO_CHUNK -> session.appendAudio(command.value());
                case SEND_TEXT -> session.sendText(command.value());
                case AVATAR_SDP_OFFER -> session.submitAvatarOffer(command.value());
                case INTERRUPT -> session.interrupt();
                case UPDATE_SCENE -> session.updateScene(command.avatar());
            }
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "bridge.dispatch.failed clientId=" + clientId + " type=" + command.type(), e);
        }
    }

    public Optional<BridgeSession> findSession(ClientId clientId) {
        return Optional.ofNullable(sessions.get(clientId));
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    public void stopAll() {
        List<ClientId> clientIds = List.copyOf(sessions.keySet());
        for (ClientId clientId : clientIds) {
            stopSession(clientId);
        }
        log.info(() -> "bridge.registry.stopped sessions=" + clientIds.size());
    }

    UpstreamConnectCommand resolveConnection(StartSessionCommand command) {
        SessionConfig config = command.config();
        String endpoint = firstNonBlank(command.endpoint(), policy.defaultEndpoint());
        if (isBlank(endpoint)) {
            throw new SessionConfigException("Voice Live endpoint is not configured");
        }
        UpstreamCredential credential;
        if (!isBlank(command.entraToken())) {
            credential = UpstreamCredential.bearerToken(command.entraToken());
        } else if (!isBlank(command.apiKey())) {
            credential = UpstreamCredential.apiKey(command.apiKey());
        } else if (!isBlank(policy.defaultApiKey())) {
            credential = UpstreamCredential.apiKey(policy.defaultApiKey());
        } else {
            throw new SessionConfigException("No API key or Entra token available");
        }

        if (config.mode() == ConnectionMode.AGENT
                && (isBlank(config.agentId()) || isBlank(config.agentProjectName()))) {
            throw new SessionConfigException("agentId and agentProjectName are required in agent mode");
        }
        if (config.mode() == ConnectionMode.AGENT_V2
                && (isBlank(config.agentName()) || isBlank(config.agentProjectName()))) {
            throw new SessionConfigException("agentName and agentProjectName are required in agent-v2 mode");
        }

        return new UpstreamConnectCommand(
                endpoint,
                credential,
                policy.apiVersion(),
                config.mode(),
                config.sessionModel(),
                config.agentId(),
                config.agentName(),
                config.agentProjectName()
        );
    }

    private void teardown(ClientId clientId) {
        VoiceLiveBridgeSession existing = sessions.get(clientId);
        if (existing == null) {
            return;
        }
        existing.stop();
        try {
            if (!existing.awaitTermination(policy.terminationTimeout())) {
                log.warning("bridge.session.termination_timeout clientId=" + clientId
                        + " timeoutMs=" + policy.terminationTimeout().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warning("bridge.session.termination_interrupted clientId=" + clientId);
        } finally {
            sessions.remove(clientId, existing);
        }
        log.info(() -> "bridge.session.removed clientId=" + clientId + " active=" + sessions.size());
    }

    private void warnNoSession(ClientId clientId, ClientCommand command) {
        if (command.type() == ClientCommandType.AUDIO_CHUNK) {
            long dropped = audioWithoutSession.incrementAndGet();
            metrics.incrementAudioChunkDropped();
            int interval = Math.max(1, policy.audioDropLogInterval());
            if (dropped != 1 && dropped % interval != 0) {
                return;
            }
            log.warning("bridge.audio.dropped clientId=" + clientId + " count=" + dropped + " reason=no_session");
            return;
        }
        log.warning("bridge.dispatch.no_session clientId=" + clientId + " type=" + command.type());
    }

    private void notifyClient(ClientSink sink, OutboundMessage message, ClientId clientId) {
        try {
            sink.send(message);
        } catch (RuntimeException e) {
            log.warning("bridge.client.send_failed clientId=" + clientId + " type=" + message.type().wireName()
                    + " reason=" + e.getMessage());
        }
    }

    int lockCount() {
        return locks.size();
    }

    // 잠금을 얻은 뒤 맵에서 이미 빠진 잠금이면 다시 얻는다.
    private ReentrantLock acquire(ClientId clientId) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(clientId, ignored -> new ReentrantLock());
            lock.lock();
            if (locks.get(clientId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    // 세션이 없는 클라이언트의 잠금은 쥔 채로 제거한다.
    private void release(ClientId clientId, ReentrantLock lock) {
        try {
            if (!sessions.containsKey(clientId)) {
                locks.remove(clientId, lock);
            }
        } finally {
            lock.unlock();
        }
    }
}
