package me.go_gradually.liveavatar.application.bridge.usecase;

import me.go_gradually.liveavatar.application.bridge.model.BridgeSession;
import me.go_gradually.liveavatar.application.bridge.model.ClientSink;
import me.go_gradually.liveavatar.application.bridge.model.OutboundMessage;
import me.go_gradually.liveavatar.application.bridge.model.ServerEvent;
import me.go_gradually.liveavatar.application.bridge.model.ServerEventType;
import me.go_gradually.liveavatar.application.bridge.model.SessionUpdate;
import me.go_gradually.liveavatar.application.bridge.model.UpstreamConnectCommand;
import me.go_gradually.liveavatar.application.bridge.model.UpstreamConnectionException;
import me.go_gradually.liveavatar.application.bridge.model.UpstreamReceipt;
import me.go_gradually.liveavatar.application.bridge.policy.BridgePolicy;
import me.go_gradually.liveavatar.application.bridge.port.UpstreamConnection;
import me.go_gradually.liveavatar.application.bridge.port.UpstreamGateway;
import me.go_gradually.liveavatar.application.shared.port.MetricsPort;
import me.go_gradually.liveavatar.domain.functioncall.FunctionCallContext;
import me.go_gradually.liveavatar.domain.session.ClientId;
import me.go_gradually.liveavatar.domain.session.GreetingPolicy;
import me.go_gradually.liveavatar.domain.session.SessionConfig;
import me.go_gradually.liveavatar.domain.session.SessionStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One client's conversation with the upstream service. {@link #run()} is executed by a single worker task
 * that owns the receive loop; the client command methods and {@link #stop()} may be called from other threads.
 */
public class VoiceLiveBridgeSession implements BridgeSession, Runnable {
    private static final Logger log = Logger.getLogger(VoiceLiveBridgeSession.class.getName());

    private final ClientId clientId;
    private final SessionConfig config;
    private final UpstreamConnectCommand connectCommand;
    private final ClientSink sink;
    private final UpstreamGateway gateway;
    private final SessionSetup setup;
    private final FunctionCallOrchestrator orchestrator;
    private final BridgePolicy policy;
    private final MetricsPort metrics;
    private final EventTranslator translator;
    private final Consumer<VoiceLiveBridgeSession> closeListener;

    private final AtomicReference<SessionStatus> status = new AtomicReference<>(SessionStatus.IDLE);
    private final AtomicBoolean runClaimed = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean terminalReported = new AtomicBoolean(false);
    private final AtomicBoolean deferredGreeting = new AtomicBoolean(false);
    private final AtomicLong droppedAudioChunks = new AtomicLong();
    private final Map<String, FunctionCallContext> inFlightCalls = new ConcurrentHashMap<>();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile UpstreamConnection connection;
    private volatile Thread worker;

    public VoiceLiveBridgeSession(ClientId clientId,
                                  SessionConfig config,
                                  UpstreamConnectCommand connectCommand,
                                  ClientSink sink,
                                  UpstreamGateway gateway,
                                  SessionSetup setup,
                                  FunctionCallOrchestrator orchestrator,
                                  BridgePolicy policy,
                                  MetricsPort metrics,
                                  Consumer<VoiceLiveBridgeSession> closeListener) {
        this.clientId = clientId;
        this.config = config;
        this.connectCommand = connectCommand;
        this.sink = sink;
        this.gateway = gateway;
        this.setup = setup;
        this.orchestrator = orchestrator;
        this.policy = policy;
        this.metrics = metrics;
        this.translator = new EventTranslator(clientId);
        this.closeListener = closeListener == null ? ignored -> {
        } : closeListener;
    }

    @Override
    public void run() {
        if (!runClaimed.compareAndSet(false, true)) {
            return;
        }
        worker = Thread.currentThread();
        try {
            if (!status.compareAndSet(SessionStatus.IDLE, SessionStatus.CONNECTING)) {
                return;
            }
            Instant startedAt = Instant.now();
            UpstreamConnection opened = gateway.connect(connectCommand);
            connection = opened;
            if (stopRequested.get()) {
                return;
            }
            GreetingPolicy greeting = setup.perform(clientId, config, opened, this::awaitEvent, this::sendToClient);
            if (!status.compareAndSet(SessionStatus.CONNECTING, SessionStatus.ACTIVE)) {
                return;
            }
            metrics.incrementSessionStarted();
            metrics.recordSessionSetupLatency(Duration.between(startedAt, Instant.now()));
            applyGreeting(greeting);
            receiveLoop(opened);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info(() -> "bridge.session.interrupted clientId=" + clientId);
        } catch (RuntimeException e) {
            reportTerminalFailure(e);
        } finally {
            release();
            worker = null;
            terminated.countDown();
            closeListener.accept(this);
        }
    }

    @Override
    public ClientId clientId() {
        return clientId;
    }

    @Override
    public SessionStatus status() {
        return status.get();
    }

    boolean hasDeferredGreeting() {
        return deferredGreeting.get();
    }

    @Override
    public void appendAudio(String base64Audio) {
        UpstreamConnection current = connection;
        if (current == null || stopRequested.get()) {
            long dropped = droppedAudioChunks.incrementAndGet();
            metrics.incrementAudioChunkDropped();
            int interval = Math.max(1, policy.audioDropLogInterval());
            if (dropped == 1 || dropped % interval == 0) {
                log.warning("bridge.audio.dropped clientId=" + clientId + " count=" + dropped + " reason=no_connection");
            }
            return;
        }
        if (base64Audio == null || base64Audio.isEmpty()) {
            return;
        }
        try {
            current.appendInputAudio(base64Audio);
        } catch (UpstreamConnectionException e) {
            log.warning("bridge.audio.append_failed clientId=" + clientId + " reason=" + e.getMessage());
        }
    }

    @Override
    public void sendText(String text) {
        UpstreamConnection current = activeConnection("send_text");
        if (current == null || text == null || text.isBlank()) {
            return;
        }
        try {
            current.createUserMessage(text);
            current.createResponse();
        } catch (UpstreamConnectionException e) {
            log.warning("bridge.text.send_failed clientId=" + clientId + " reason=" + e.getMessage());
        }
    }

    @Override
    public void submitAvatarOffer(String clientSdp) {
        UpstreamConnection current = activeConnection("avatar_sdp_offer");
        if (current == null) {
            return;
        }
        if (clientSdp == null || clientSdp.isBlank()) {
            log.warning("bridge.avatar.empty_offer clientId=" + clientId);
            return;
        }
        try {
            current.connectAvatar(clientSdp);
            log.info(() -> "bridge.avatar.offer_sent clientId=" + clientId + " length=" + clientSdp.length());
        } catch (UpstreamConnectionException e) {
            log.warning("bridge.avatar.offer_failed clientId=" + clientId + " reason=" + e.getMessage());
        }
    }

    @Override
    public void interrupt() {
        interruptFor(OutboundMessage.REASON_MANUAL_INTERRUPT);
    }

    @Override
    public void updateScene(Map<String, Object> avatar) {
        UpstreamConnection current = activeConnection("update_scene");
        if (current == null) {
            return;
        }
        if (avatar == null || avatar.isEmpty()) {
            log.warning("bridge.scene.empty clientId=" + clientId);
            return;
        }
        try {
            current.updateSession(SessionUpdate.scene(config, avatar));
        } catch (UpstreamConnectionException e) {
            log.warning("bridge.scene.update_failed clientId=" + clientId + " reason=" + e.getMessage());
        }
    }

    @Override
    public void stop() {
        stopRequested.set(true);
        moveToClosing();
        if (runClaimed.compareAndSet(false, true)) {
            // 워커가 아직 시작되지 않았으면 여기서 바로 종료 처리한다.
            release();
            terminated.countDown();
            return;
        }
        UpstreamConnection current = connection;
        if (current != null) {
            current.close();
        }
        Thread running = worker;
        if (running != null && running != Thread.currentThread()) {
            running.interrupt();
        }
    }

    @Override
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void receiveLoop(UpstreamConnection opened) throws InterruptedException {
        while (true) {
            UpstreamReceipt receipt = opened.receive();
            switch (receipt.kind()) {
                case EVENT -> handleSafely(receipt.event());
                case RECOVERABLE_ERROR -> recoverable(receipt);
                case CLOSED -> throw new UpstreamConnectionException("Upstream connection closed: " + receipt.detail());
            }
        }
    }

    private ServerEvent awaitEvent(ServerEventType wanted, Duration timeout) throws InterruptedException {
        UpstreamConnection current = connection;
        if (current == null) {
            throw new UpstreamConnectionException("Upstream connection is not available");
        }
        log.fine(() -> "bridge.wait.start clientId=" + clientId + " wanted=" + wanted.wireName());
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.warning("bridge.wait.timeout clientId=" + clientId + " wanted=" + wanted.wireName());
                return null;
            }
            UpstreamReceipt receipt = current.poll(Duration.ofNanos(remaining));
            if (receipt == null) {
                continue;
            }
            switch (receipt.kind()) {
                case CLOSED -> throw new UpstreamConnectionException("Upstream connection closed: " + receipt.detail());
                case RECOVERABLE_ERROR -> recoverable(receipt);
                case EVENT -> {
                    if (receipt.event().type() == wanted) {
                        metrics.incrementEventReceived(wanted.wireName());
                        return receipt.event();
                    }
                    handleSafely(receipt.event());
                }
            }
        }
    }

    private void handleSafely(ServerEvent event) throws InterruptedException {
        try {
            handle(event);
        } catch (UpstreamConnectionException e) {
            throw e;
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "bridge.event.failed clientId=" + clientId + " type=" + event.type(), e);
        }
    }

    private void handle(ServerEvent event) throws InterruptedException {
        ServerEventType type = event.type();
        metrics.incrementEventReceived(type == ServerEventType.UNKNOWN ? "unknown" : type.wireName());
        if (!type.isHighFrequency()) {
            log.fine(() -> "bridge.event.received clientId=" + clientId + " type=" + type.wireName());
        }
        Optional<OutboundMessage> outbound = translator.translate(event);
        outbound.ifPresent(this::sendToClient);
        switch (type) {
            case SESSION_AVATAR_CONNECTING -> {
                // 응답 SDP가 만들어졌으면 클라이언트 전달 성공 여부와 관계없이 인사를 보낸다.
                if (outbound.isPresent()) {
                    releaseDeferredGreeting();
                }
            }
            case INPUT_AUDIO_BUFFER_SPEECH_STARTED -> interruptFor(OutboundMessage.REASON_USER_INTERRUPTION);
            case CONVERSATION_ITEM_CREATED -> {
                ServerEvent.ItemCreated item = (ServerEvent.ItemCreated) event;
                if (item.isFunctionCall()) {
                    orchestrator.orchestrate(item, inFlightCalls, this::awaitEvent, requireConnection(), this::sendToClient);
                }
            }
            case FUNCTION_CALL_ARGUMENTS_DONE -> log.fine(() -> "bridge.function_call.unexpected_arguments clientId="
                    + clientId + " callId=" + ((ServerEvent.FunctionCallArgumentsDone) event).callId());
            default -> {
            }
        }
    }

    private void applyGreeting(GreetingPolicy greeting) {
        switch (greeting) {
            case IMMEDIATE -> sendGreeting("immediate");
            case DEFERRED_UNTIL_AVATAR_CONNECT -> deferredGreeting.set(true);
            case NONE -> log.fine(() -> "bridge.greeting.disabled clientId=" + clientId);
        }
    }

    private void releaseDeferredGreeting() {
        if (deferredGreeting.compareAndSet(true, false)) {
            sendGreeting("after_avatar_connect");
        }
    }

    private void sendGreeting(String trigger) {
        UpstreamConnection current = connection;
        if (current == null) {
            return;
        }
        try {
            current.createResponse();
            log.info(() -> "bridge.greeting.sent clientId=" + clientId + " trigger=" + trigger);
        } catch (UpstreamConnectionException e) {
            log.warning("bridge.greeting.failed clientId=" + clientId + " reason=" + e.getMessage());
        }
    }

    private void interruptFor(String reason) {
        sendToClient(OutboundMessage.stopPlayback(reason));
        UpstreamConnection current = connection;
        if (current == null) {
            return;
        }
        try {
            current.cancelResponse();
        } catch (RuntimeException e) {
            log.warning("bridge.interrupt.cancel_failed clientId=" + clientId + " reason=" + e.getMessage());
        }
    }

    private void recoverable(UpstreamReceipt receipt) {
        metrics.incrementRecoverableEventError();
        log.warning("bridge.event.unparsable clientId=" + clientId + " detail=" + receipt.detail());
    }

    private boolean sendToClient(OutboundMessage message) {
        try {
            boolean delivered = sink.send(message);
            if (!delivered) {
                log.fine(() -> "bridge.client.send_skipped clientId=" + clientId + " type=" + message.type().wireName());
            }
            return delivered;
        } catch (RuntimeException e) {
            log.warning("bridge.client.send_failed clientId=" + clientId + " type=" + message.type().wireName()
                    + " reason=" + e.getMessage());
            return false;
        }
    }

    private UpstreamConnection activeConnection(String command) {
        UpstreamConnection current = connection;
        if (current == null || stopRequested.get()) {
            log.warning("bridge.command.ignored clientId=" + clientId + " command=" + command + " reason=no_connection");
            return null;
        }
        return current;
    }

    private UpstreamConnection requireConnection() {
        UpstreamConnection current = connection;
        if (current == null) {
            throw new UpstreamConnectionException("Upstream connection is not available");
        }
        return current;
    }

    private void reportTerminalFailure(RuntimeException failure) {
        if (stopRequested.get()) {
            log.info(() -> "bridge.session.stopped clientId=" + clientId + " reason=" + failure.getMessage());
            return;
        }
        metrics.incrementSessionFailed();
        log.log(Level.WARNING, "bridge.session.failed clientId=" + clientId + " status=" + status.get(), failure);
        if (terminalReported.compareAndSet(false, true)) {
            String message = failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
            sendToClient(OutboundMessage.sessionError(message));
        }
    }

    private void moveToClosing() {
        while (true) {
            SessionStatus current = status.get();
            if (current.isTerminal()) {
                return;
            }
            if (status.compareAndSet(current, SessionStatus.CLOSING)) {
                return;
            }
        }
    }

    private void release() {
        moveToClosing();
        UpstreamConnection current = connection;
        connection = null;
        if (current != null) {
            current.close();
        }
        inFlightCalls.clear();
        deferredGreeting.set(false);
        if (status.compareAndSet(SessionStatus.CLOSING, SessionStatus.CLOSED)) {
            metrics.incrementSessionClosed();
            log.info(() -> "bridge.session.closed clientId=" + clientId);
        }
    }
}
