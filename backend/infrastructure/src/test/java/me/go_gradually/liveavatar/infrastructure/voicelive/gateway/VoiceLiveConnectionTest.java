package me.go_gradually.liveavatar.infrastructure.voicelive.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.liveavatar.application.bridge.model.ServerEvent;
import me.go_gradually.liveavatar.application.bridge.model.UpstreamConnectionException;
import me.go_gradually.liveavatar.application.bridge.model.UpstreamReceipt;
import me.go_gradually.liveavatar.infrastructure.voicelive.protocol.ServerEventParser;
import me.go_gradually.liveavatar.infrastructure.voicelive.protocol.VoiceLiveCommandSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VoiceLiveConnectionTest {

    @Mock
    private WebSocket webSocket;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private VoiceLiveConnection connection;

    @BeforeEach
    void setUp() {
        connection = new VoiceLiveConnection(objectMapper, new ServerEventParser(objectMapper),
                new VoiceLiveCommandSerializer());
        connection.attach(webSocket);
    }

    @Test
    void onText_joinsPartialFramesBeforeParsing() throws Exception {
        WebSocket.Listener listener = connection.listener();

        listener.onText(webSocket, "{\"type\":\"response.audio.delta\",", false);
        listener.onText(webSocket, "\"delta\":\"UklG\"}", true);

        UpstreamReceipt receipt = connection.poll(Duration.ofMillis(100));
        assertEquals(new ServerEvent.AudioDelta("UklG"), receipt.event());
        verify(webSocket, times(2)).request(1);
        assertNull(connection.poll(Duration.ofMillis(10)));
    }

    @Test
    void malformedFrame_isRecoverable() throws Exception {
        when(webSocket.sendText(anyString(), eq(true))).thenReturn(CompletableFuture.completedFuture(webSocket));
        connection.listener().onText(webSocket, "{oops", true);

        assertEquals(UpstreamReceipt.Kind.RECOVERABLE_ERROR, connection.receive().kind());
        connection.createResponse();
        verify(webSocket).sendText("{\"type\":\"response.create\"}", true);
    }

    @Test
    void remoteClose_staysVisibleToEveryReceive() throws Exception {
        connection.listener().onClose(webSocket, 1011, "server error");

        assertTrue(connection.receive().isClosed());
        assertTrue(connection.receive().isClosed());
        assertTrue(connection.poll(Duration.ofMillis(10)).isClosed());
        assertThrows(UpstreamConnectionException.class, connection::createResponse);
    }

    @Test
    void onError_closesConnection() throws Exception {
        connection.listener().onError(webSocket, new IOException("reset"));

        UpstreamReceipt receipt = connection.receive();
        assertTrue(receipt.isClosed());
        assertTrue(receipt.detail().contains("reset"));
        assertThrows(UpstreamConnectionException.class, connection::createResponse);
    }

    @Test
    void send_writesSerializedCommand() throws Exception {
        when(webSocket.sendText(anyString(), eq(true))).thenReturn(CompletableFuture.completedFuture(webSocket));

        connection.createFunctionCallOutput("item-1", "call-1", "{\"time\":\"now\"}");

        ArgumentCaptor<CharSequence> captor = ArgumentCaptor.forClass(CharSequence.class);
        verify(webSocket).sendText(captor.capture(), eq(true));
        JsonNode sent = objectMapper.readTree(captor.getValue().toString());
        assertEquals("conversation.item.create", sent.path("type").asText());
        assertEquals("item-1", sent.path("previous_item_id").asText());
        assertEquals("call-1", sent.path("item").path("call_id").asText());
    }

    @Test
    void send_failureBecomesConnectionException() {
        when(webSocket.sendText(anyString(), eq(true)))
                .thenReturn(CompletableFuture.failedFuture(new IOException("Output closed")));

        assertThrows(UpstreamConnectionException.class, () -> connection.appendInputAudio("AAA="));
    }

    @Test
    void close_sendsNormalClosureOnce() throws Exception {
        when(webSocket.sendClose(eq(WebSocket.NORMAL_CLOSURE), anyString()))
                .thenReturn(CompletableFuture.completedFuture(webSocket));

        connection.close();
        connection.close();

        verify(webSocket, times(1)).sendClose(eq(WebSocket.NORMAL_CLOSURE), anyString());
        assertTrue(connection.receive().isClosed());
        assertThrows(UpstreamConnectionException.class, connection::cancelResponse);
        verify(webSocket, never()).sendText(anyString(), eq(true));
    }

    @Test
    void close_afterRemoteCloseSkipsHandshakeWhenOutputClosed() {
        when(webSocket.isOutputClosed()).thenReturn(true);
        connection.listener().onClose(webSocket, 1000, "done");

        connection.close();

        verify(webSocket, never()).sendClose(anyInt(), anyString());
    }
}
