package me.go_gradually.liveavatar.presentation.bridge.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.liveavatar.application.bridge.model.ClientCommand;
import me.go_gradually.liveavatar.application.bridge.model.ClientSink;
import me.go_gradually.liveavatar.application.bridge.model.OutboundMessage;
import me.go_gradually.liveavatar.application.bridge.model.SessionConfigException;
import me.go_gradually.liveavatar.application.bridge.model.StartSessionCommand;
import me.go_gradually.liveavatar.application.bridge.usecase.SessionRegistry;
import me.go_gradually.liveavatar.domain.session.ClientId;
import me.go_gradually.liveavatar.presentation.bridge.dto.ClientConfigMapper;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

@Component
public class AvatarBridgeWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = Logger.getLogger(AvatarBridgeWebSocketHandler.class.getName());
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 1_048_576;

    private final SessionRegistry sessionRegistry;
    private final ClientConfigMapper clientConfigMapper;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, ClientConnection> connectionBySocketId = new ConcurrentHashMap<>();

    public AvatarBridgeWebSocketHandler(SessionRegistry sessionRegistry, ClientConfigMapper clientConfigMapper) {
        this.sessionRegistry = sessionRegistry;
        this.clientConfigMapper = clientConfigMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession rawSession) throws Exception {
        rawSession.setTextMessageSizeLimit(BUFFER_SIZE_LIMIT);
        WebSocketSession session = new ConcurrentWebSocketSessionDecorator(rawSession, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        String clientId = readClientId(rawSession.getUri());
        if (clientId == null) {
            session.close(CloseStatus.BAD_DATA.withReason("clientId is required"));
            return;
        }
        connectionBySocketId.put(rawSession.getId(), new ClientConnection(ClientId.of(clientId), session));
        log.info(() -> "ws.connected clientId=" + clientId + " socketId=" + rawSession.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession rawSession, TextMessage message) {
        ClientConnection connection = connectionBySocketId.get(rawSession.getId());
        if (connection == null) {
            log.warning("ws.message.unknown_socket socketId=" + rawSession.getId());
            return;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.warning("ws.message.malformed clientId=" + connection.clientId() + " reason=" + e.getOriginalMessage());
            return;
        }
        String type = root.path("type").asText("");
        ClientId clientId = connection.clientId();
        switch (type) {
            case "start_session" -> startSession(connection, root.path("config"));
            case "stop_session" -> sessionRegistry.stopSession(clientId);
            case "audio_chunk" -> sessionRegistry.dispatch(clientId, ClientCommand.audioChunk(readString(root, "data")));
            case "send_text" -> sessionRegistry.dispatch(clientId, ClientCommand.sendText(readString(root, "text")));
            case "avatar_sdp_offer" ->
                    sessionRegistry.dispatch(clientId, ClientCommand.avatarSdpOffer(readString(root, "clientSdp")));
            case "interrupt" -> sessionRegistry.dispatch(clientId, ClientCommand.interrupt());
            case "update_scene" ->
                    sessionRegistry.dispatch(clientId, ClientCommand.updateScene(clientConfigMapper.toMap(root.path("avatar"))));
            default -> log.warning("ws.message.unknown_type clientId=" + clientId + " type=" + type);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession rawSession, Throwable exception) {
        log.log(Level.WARNING, "ws.transport_error socketId=" + rawSession.getId(), exception);
        release(rawSession);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession rawSession, CloseStatus status) {
        log.info(() -> "ws.closed socketId=" + rawSession.getId() + " status=" + status.getCode());
        release(rawSession);
    }

    private void startSession(ClientConnection connection, JsonNode config) {
        StartSessionCommand command;
        try {
            command = clientConfigMapper.toStartCommand(config);
        } catch (SessionConfigException e) {
            log.warning("ws.start_session.invalid_config clientId=" + connection.clientId() + " reason=" + e.getMessage());
            connection.sink().send(OutboundMessage.sessionError(e.getMessage()));
            return;
        }
        sessionRegistry.startSession(connection.clientId(), command, connection.sink());
    }

    private void release(WebSocketSession rawSession) {
        ClientConnection connection = connectionBySocketId.remove(rawSession.getId());
        if (connection != null) {
            sessionRegistry.stopSession(connection.clientId());
        }
    }

    private String readString(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText() : "";
    }

    static String readClientId(URI uri) {
        if (uri == null || uri.getPath() == null) {
            return null;
        }
        String path = uri.getPath();
        int separator = path.lastIndexOf('/');
        String clientId = separator < 0 ? path : path.substring(separator + 1);
        return clientId.isBlank() ? null : clientId;
    }

    private final class ClientConnection {
        private final ClientId clientId;
        private final WebSocketSession session;
        private final ClientSink sink;

        private ClientConnection(ClientId clientId, WebSocketSession session) {
            this.clientId = clientId;
            this.session = session;
            this.sink = this::send;
        }

        private ClientId clientId() {
            return clientId;
        }

        private ClientSink sink() {
            return sink;
        }

        private boolean send(OutboundMessage message) {
            if (!session.isOpen()) {
                return false;
            }
            try {
                session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message.toWire())));
                return true;
            } catch (IOException | RuntimeException e) {
                // 전송 실패는 재시도하지 않는다.
                log.fine(() -> "ws.send.failed clientId=" + clientId + " type=" + message.type().wireName()
                        + " reason=" + e.getMessage());
                return false;
            }
        }
    }
}
