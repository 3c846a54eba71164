package me.go_gradually.liveavatar.infrastructure.voicelive.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.liveavatar.application.bridge.model.UpstreamConnectCommand;
import me.go_gradually.liveavatar.application.bridge.model.UpstreamConnectionException;
import me.go_gradually.liveavatar.application.bridge.model.UpstreamCredential;
import me.go_gradually.liveavatar.application.bridge.port.UpstreamConnection;
import me.go_gradually.liveavatar.application.bridge.port.UpstreamGateway;
import me.go_gradually.liveavatar.domain.session.ConnectionMode;
import me.go_gradually.liveavatar.infrastructure.shared.config.AppProperties;
import me.go_gradually.liveavatar.infrastructure.voicelive.protocol.ServerEventParser;
import me.go_gradually.liveavatar.infrastructure.voicelive.protocol.VoiceLiveCommandSerializer;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.logging.Logger;

@Component
public class VoiceLiveUpstreamGateway implements UpstreamGateway {
    private static final Logger log = Logger.getLogger(VoiceLiveUpstreamGateway.class.getName());
    private static final String REALTIME_PATH = "/voice-live/realtime";

    private final AppProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ServerEventParser parser;
    private final VoiceLiveCommandSerializer serializer = new VoiceLiveCommandSerializer();

    public VoiceLiveUpstreamGateway(AppProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.parser = new ServerEventParser(objectMapper);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getVoiceLive().getConnectTimeout())
                .build();
    }

    @Override
    public UpstreamConnection connect(UpstreamConnectCommand command) {
        URI realtimeUri = toRealtimeUri(command);
        VoiceLiveConnection connection = new VoiceLiveConnection(objectMapper, parser, serializer);
        WebSocket.Builder builder = httpClient.newWebSocketBuilder()
                .connectTimeout(properties.getVoiceLive().getConnectTimeout());
        UpstreamCredential credential = command.credential();
        if (credential.kind() == UpstreamCredential.Kind.BEARER_TOKEN) {
            builder.header("Authorization", "Bearer " + credential.value());
        } else {
            builder.header("api-key", credential.value());
        }
        try {
            WebSocket webSocket = builder.buildAsync(realtimeUri, connection.listener()).join();
            connection.attach(webSocket);
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new UpstreamConnectionException("Failed to connect to Voice Live: " + cause.getMessage(), cause);
        }
        log.info(() -> "voicelive.connected host=" + realtimeUri.getHost() + " mode=" + command.mode().code()
                + " auth=" + credential.kind());
        return connection;
    }

    // https://host/path -> wss://host/path/voice-live/realtime?api-version=..&model=.. (에이전트 모드는 라우팅 파라미터 추가)
    static URI toRealtimeUri(UpstreamConnectCommand command) {
        URI baseUri;
        try {
            baseUri = URI.create(command.endpoint().trim());
        } catch (IllegalArgumentException e) {
            throw new UpstreamConnectionException("Invalid Voice Live endpoint: " + command.endpoint(), e);
        }
        if (baseUri.getHost() == null) {
            throw new UpstreamConnectionException("Invalid Voice Live endpoint: " + command.endpoint());
        }
        String scheme = baseUri.getScheme() == null ? "https" : baseUri.getScheme().toLowerCase(Locale.ROOT);
        String wsScheme = "http".equals(scheme) || "ws".equals(scheme) ? "ws" : "wss";
        String path = baseUri.getRawPath() == null ? "" : baseUri.getRawPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }

        StringBuilder uri = new StringBuilder()
                .append(wsScheme).append("://").append(baseUri.getHost());
        if (baseUri.getPort() != -1) {
            uri.append(':').append(baseUri.getPort());
        }
        uri.append(path).append(REALTIME_PATH)
                .append("?api-version=").append(encode(command.apiVersion()))
                .append("&model=").append(encode(command.model()));
        if (command.mode() == ConnectionMode.AGENT) {
            uri.append("&agent-id=").append(encode(command.agentId()))
                    .append("&agent-project-name=").append(encode(command.agentProjectName()));
        } else if (command.mode() == ConnectionMode.AGENT_V2) {
            uri.append("&agent-name=").append(encode(command.agentName()))
                    .append("&agent-project-name=").append(encode(command.agentProjectName()));
        }
        return URI.create(uri.toString());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
