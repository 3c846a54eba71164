package me.go_gradually.liveavatar.application.bridge.usecase;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.liveavatar.application.bridge.model.BridgeSession;
import me.go_gradually.liveavatar.application.bridge.model.ClientCommand;
import me.go_gradually.liveavatar.application.bridge.model.OutboundMessageType;
import me.go_gradually.liveavatar.application.bridge.model.ServerEvent;
import me.go_gradually.liveavatar.application.bridge.model.StartSessionCommand;
import me.go_gradually.liveavatar.application.bridge.model.UpstreamConnectCommand;
import me.go_gradually.liveavatar.application.bridge.model.UpstreamCredential;
import me.go_gradually.liveavatar.application.bridge.port.UpstreamGateway;
import me.go_gradually.liveavatar.application.shared.port.MetricsPort;
import me.go_gradually.liveavatar.application.tool.usecase.ToolRegistry;
import me.go_gradually.liveavatar.domain.session.ClientId;
import me.go_gradually.liveavatar.domain.session.ConnectionMode;
import me.go_gradually.liveavatar.domain.session.SessionConfig;
import me.go_gradually.liveavatar.domain.session.SessionStatus;
import me.go_gradually.liveavatar.domain.voice.VoiceSelection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static me.go_gradually.liveavatar.application.bridge.usecase.RecordingSink.awaitCondition;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionRegistryTest {

    @Mock
    private UpstreamGateway gateway;
    @Mock
    private MetricsPort metrics;

    private final TestBridgePolicy policy = new TestBridgePolicy();
    private final ClientId clientId = ClientId.of("client-1");
    private ExecutorService executor;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        FunctionCallOrchestrator orchestrator = new FunctionCallOrchestrator(new ToolRegistry(List.of()),
                new ObjectMapper(), policy, metrics);
        registry = new SessionRegistry(gateway, new SessionSetup(policy), orchestrator, executor, policy, metrics);
    }

    @AfterEach
    void tearDown() {
        registry.stopAll();
        executor.shutdownNow();
    }

    @Test
    void startSession_withoutEndpointReportsConfigError() {
        policy.endpoint = null;
        RecordingSink sink = new RecordingSink();

        Optional<BridgeSession> session = registry.startSession(clientId, command(config(), null, null), sink);

        assertTrue(session.isEmpty());
        assertEquals(List.of(OutboundMessageType.SESSION_ERROR), sink.types());
        assertEquals(0, registry.activeSessionCount());
        verify(gateway, never()).connect(any());
    }

    @Test
    void startSession_withoutAnyCredentialReportsConfigError() {
        policy.apiKey = "";
        RecordingSink sink = new RecordingSink();

        assertTrue(registry.startSession(clientId, command(config(), null, null), sink).isEmpty());
        assertEquals(1, sink.count(OutboundMessageType.SESSION_ERROR));
    }

    @Test
    void resolveConnection_prefersEntraTokenThenClientKeyThenServerKey() {
        UpstreamConnectCommand token = registry.resolveConnection(command(config(), "client-key", "token"));
        UpstreamConnectCommand clientKey = registry.resolveConnection(command(config(), "client-key", null));
        UpstreamConnectCommand serverKey = registry.resolveConnection(command(config(), null, null));

        assertEquals(UpstreamCredential.bearerToken("token"), token.credential());
        assertEquals(UpstreamCredential.apiKey("client-key"), clientKey.credential());
        assertEquals(UpstreamCredential.apiKey("server-key"), serverKey.credential());
        assertEquals(policy.endpoint, serverKey.endpoint());
        assertEquals("gpt-4o-realtime", serverKey.model());
    }

    @Test
    void agentMode_requiresAgentIdAndProject() {
        SessionConfig agent = builder().mode(ConnectionMode.AGENT).agent(null, null, "project").build();
        RecordingSink sink = new RecordingSink();

        assertTrue(registry.startSession(clientId, command(agent, null, null), sink).isEmpty());
        assertTrue(String.valueOf(sink.messages.get(0).get("error")).contains("agentId"));

        SessionConfig agentV2 = builder().mode(ConnectionMode.AGENT_V2).agent(null, "helper", "project").build();
        UpstreamConnectCommand resolved = registry.resolveConnection(command(agentV2, null, null));
        assertEquals("agent-v2", resolved.model());
        assertEquals("helper", resolved.agentName());
    }

    @Test
    void startSession_replacesPreviousSessionAfterTearingItDown() throws Exception {
        FakeUpstreamConnection first = acknowledgedConnection("sess-1");
        FakeUpstreamConnection second = acknowledgedConnection("sess-2");
        when(gateway.connect(any())).thenReturn(first, second);
        RecordingSink firstSink = new RecordingSink();
        RecordingSink secondSink = new RecordingSink();

        BridgeSession firstSession = registry.startSession(clientId, command(config(), null, null), firstSink).orElseThrow();
        firstSink.await(OutboundMessageType.SESSION_STARTED);

        BridgeSession secondSession = registry.startSession(clientId, command(config(), null, null), secondSink).orElseThrow();

        assertEquals(SessionStatus.CLOSED, firstSession.status());
        assertFalse(first.isOpen());
        assertEquals(0, firstSink.count(OutboundMessageType.SESSION_ERROR));
        secondSink.await(OutboundMessageType.SESSION_STARTED);
        assertEquals(1, registry.activeSessionCount());
        assertEquals(Optional.of(secondSession), registry.findSession(clientId));
    }

    @Test
    void stopSession_isIdempotent() throws Exception {
        FakeUpstreamConnection connection = acknowledgedConnection("sess-1");
        when(gateway.connect(any())).thenReturn(connection);
        RecordingSink sink = new RecordingSink();
        BridgeSession session = registry.startSession(clientId, command(config(), null, null), sink).orElseThrow();
        sink.await(OutboundMessageType.SESSION_STARTED);

        registry.stopSession(clientId);
        registry.stopSession(clientId);
        registry.stopSession(ClientId.of("unknown"));

        assertEquals(SessionStatus.CLOSED, session.status());
        assertEquals(0, registry.activeSessionCount());
        assertEquals(0, sink.count(OutboundMessageType.SESSION_ERROR));
    }

    @Test
    void stopSession_forClientsWithoutSessionKeepsNoLocks() {
        for (int i = 0; i < 1000; i++) {
            registry.stopSession(ClientId.of("client-" + i));
        }

        assertEquals(0, registry.activeSessionCount());
        assertEquals(0, registry.lockCount());
    }

    @Test
    void lockIsReleasedOnceTheSessionIsStopped() throws Exception {
        FakeUpstreamConnection connection = acknowledgedConnection("sess-1");
        when(gateway.connect(any())).thenReturn(connection);
        RecordingSink sink = new RecordingSink();
        registry.startSession(clientId, command(config(), null, null), sink);
        sink.await(OutboundMessageType.SESSION_STARTED);
        assertEquals(1, registry.lockCount());

        registry.stopSession(clientId);

        assertEquals(0, registry.lockCount());
    }

    @Test
    void configErrorLeavesNoLockBehind() {
        policy.endpoint = null;

        registry.startSession(clientId, command(config(), null, null), new RecordingSink());

        assertEquals(0, registry.lockCount());
    }

    @Test
    void concurrentStartAndStop_keepAtMostOneSessionPerClient() throws Exception {
        when(gateway.connect(any())).thenAnswer(invocation -> acknowledgedConnection("sess"));
        ExecutorService callers = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                boolean start = i % 2 == 0;
                futures.add(callers.submit(() -> {
                    if (start) {
                        registry.startSession(clientId, command(config(), null, null), new RecordingSink());
                    } else {
                        registry.stopSession(clientId);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            callers.shutdownNow();
        }

        assertTrue(registry.activeSessionCount() <= 1);
        registry.stopSession(clientId);
        assertEquals(0, registry.activeSessionCount());
        assertEquals(0, registry.lockCount());
    }

    @Test
    void dispatch_routesCommandsToSession() throws Exception {
        FakeUpstreamConnection connection = acknowledgedConnection("sess-1");
        when(gateway.connect(any())).thenReturn(connection);
        RecordingSink sink = new RecordingSink();
        registry.startSession(clientId, command(config(), null, null), sink);
        sink.await(OutboundMessageType.SESSION_STARTED);

        registry.dispatch(clientId, ClientCommand.audioChunk("AAA="));
        registry.dispatch(clientId, ClientCommand.interrupt());

        assertEquals(List.of("AAA="), connection.audioChunks);
        assertEquals(1, sink.count(OutboundMessageType.STOP_PLAYBACK));
    }

    @Test
    void dispatch_withoutSessionIsIgnored() {
        registry.dispatch(clientId, ClientCommand.audioChunk("AAA="));
        registry.dispatch(clientId, ClientCommand.sendText("hello"));

        verify(metrics).incrementAudioChunkDropped();
        assertEquals(0, registry.activeSessionCount());
    }

    @Test
    void sessionEndingOnItsOwn_leavesRegistry() throws Exception {
        FakeUpstreamConnection connection = acknowledgedConnection("sess-1");
        when(gateway.connect(any())).thenReturn(connection);
        RecordingSink sink = new RecordingSink();
        registry.startSession(clientId, command(config(), null, null), sink);
        sink.await(OutboundMessageType.SESSION_STARTED);

        connection.dropRemotely();

        sink.await(OutboundMessageType.SESSION_ERROR);
        awaitCondition(() -> registry.activeSessionCount() == 0, "registry cleanup");
    }

    @Test
    void startSession_passesResolvedCommandToGateway() throws Exception {
        FakeUpstreamConnection connection = acknowledgedConnection("sess-1");
        when(gateway.connect(any())).thenReturn(connection);
        RecordingSink sink = new RecordingSink();

        registry.startSession(clientId, command(config(), "client-key", null), sink);
        sink.await(OutboundMessageType.SESSION_STARTED);

        ArgumentCaptor<UpstreamConnectCommand> captor = ArgumentCaptor.forClass(UpstreamConnectCommand.class);
        verify(gateway).connect(captor.capture());
        assertEquals("2025-10-01", captor.getValue().apiVersion());
        assertEquals(UpstreamCredential.apiKey("client-key"), captor.getValue().credential());
    }

    private FakeUpstreamConnection acknowledgedConnection(String sessionId) {
        FakeUpstreamConnection connection = new FakeUpstreamConnection();
        connection.emit(new ServerEvent.SessionUpdated(sessionId, List.of()));
        return connection;
    }

    private StartSessionCommand command(SessionConfig config, String apiKey, String entraToken) {
        return new StartSessionCommand(config, null, apiKey, entraToken);
    }

    private SessionConfig config() {
        return builder().proactiveGreeting(false).build();
    }

    private SessionConfig.Builder builder() {
        return SessionConfig.builder("gpt-4o-realtime", VoiceSelection.standard("en-US-AvaNeural", 0.9, 1.0));
    }
}
