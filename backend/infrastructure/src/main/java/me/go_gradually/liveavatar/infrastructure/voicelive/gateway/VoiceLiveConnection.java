package me.go_gradually.liveavatar.infrastructure.voicelive.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.liveavatar.application.bridge.model.SessionUpdate;
import me.go_gradually.liveavatar.application.bridge.model.UpstreamConnectionException;
import me.go_gradually.liveavatar.application.bridge.model.UpstreamReceipt;
import me.go_gradually.liveavatar.application.bridge.port.UpstreamConnection;
import me.go_gradually.liveavatar.infrastructure.voicelive.protocol.ServerEventParser;
import me.go_gradually.liveavatar.infrastructure.voicelive.protocol.VoiceLiveCommandSerializer;

import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One Voice Live WebSocket. Inbound frames are parsed into a receipt queue; outbound sends are serialized
 * because the JDK WebSocket rejects a send while the previous one is still pending.
 */
class VoiceLiveConnection implements UpstreamConnection {
    private static final Logger log = Logger.getLogger(VoiceLiveConnection.class.getName());

    private final BlockingQueue<UpstreamReceipt> receipts = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean released = new AtomicBoolean(false);
    private final Object sendLock = new Object();
    private final ObjectMapper objectMapper;
    private final ServerEventParser parser;
    private final VoiceLiveCommandSerializer serializer;
    private final ReceiptListener listener = new ReceiptListener();
    private volatile WebSocket webSocket;

    VoiceLiveConnection(ObjectMapper objectMapper, ServerEventParser parser, VoiceLiveCommandSerializer serializer) {
        this.objectMapper = objectMapper;
        this.parser = parser;
        this.serializer = serializer;
    }

    WebSocket.Listener listener() {
        return listener;
    }

    void attach(WebSocket webSocket) {
        this.webSocket = webSocket;
    }

    @Override
    public void updateSession(SessionUpdate update) {
        send(serializer.sessionUpdate(update));
    }

    @Override
    public void appendInputAudio(String base64Audio) {
        send(serializer.appendInputAudio(base64Audio));
    }

    @Override
    public void createResponse() {
        send(serializer.createResponse());
    }

    @Override
    public void cancelResponse() {
        send(serializer.cancelResponse());
    }

    @Override
    public void createFunctionCallOutput(String previousItemId, String callId, String output) {
        send(serializer.functionCallOutput(previousItemId, callId, output));
    }

    @Override
    public void createUserMessage(String text) {
        send(serializer.userMessage(text));
    }

    @Override
    public void connectAvatar(String clientSdp) {
        send(serializer.connectAvatar(clientSdp));
    }

    @Override
    public UpstreamReceipt receive() throws InterruptedException {
        return keepClosedVisible(receipts.take());
    }

    @Override
    public UpstreamReceipt poll(Duration timeout) throws InterruptedException {
        UpstreamReceipt receipt = receipts.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return receipt == null ? null : keepClosedVisible(receipt);
    }

    @Override
    public void close() {
        markClosed("closed locally");
        WebSocket current = webSocket;
        if (current == null || !released.compareAndSet(false, true) || current.isOutputClosed()) {
            return;
        }
        try {
            current.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            current.abort();
        } catch (Exception e) {
            log.fine(() -> "voicelive.close.failed reason=" + e.getMessage());
            current.abort();
        }
    }

    private void send(Map<String, Object> payload) {
        WebSocket current = webSocket;
        if (closed.get() || current == null) {
            throw new UpstreamConnectionException("Voice Live connection is closed");
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new UpstreamConnectionException("Failed to serialize " + payload.get("type"), e);
        }
        synchronized (sendLock) {
            try {
                current.sendText(json, true).join();
            } catch (RuntimeException e) {
                throw new UpstreamConnectionException("Failed to send " + payload.get("type"), e);
            }
        }
    }

    private UpstreamReceipt keepClosedVisible(UpstreamReceipt receipt) {
        if (receipt.isClosed()) {
            // 이후 호출도 CLOSED를 받도록 다시 넣어 둔다.
            receipts.offer(receipt);
        }
        return receipt;
    }

    private boolean markClosed(String detail) {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        receipts.offer(UpstreamReceipt.closed(detail));
        return true;
    }

    final class ReceiptListener implements WebSocket.Listener {
        private final StringBuilder textBuffer = new StringBuilder();

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            textBuffer.append(data);
            if (last) {
                String payload = textBuffer.toString();
                textBuffer.setLength(0);
                receipts.offer(parser.parse(payload));
            }
            webSocket.request(1);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.info(() -> "voicelive.closed status=" + statusCode + " reason=" + reason);
            markClosed("Voice Live closed the connection: " + statusCode + " " + reason);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.log(Level.WARNING, "voicelive.error", error);
            markClosed(error == null ? "Voice Live connection error" : "Voice Live connection error: " + error.getMessage());
        }
    }
}
