package me.go_gradually.liveavatar.infrastructure.voicelive.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.liveavatar.application.bridge.model.IceServer;
import me.go_gradually.liveavatar.application.bridge.model.ServerEvent;
import me.go_gradually.liveavatar.application.bridge.model.ServerEventType;
import me.go_gradually.liveavatar.application.bridge.model.UpstreamReceipt;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class ServerEventParser {
    // GA 이벤트명(output_*)도 beta 이벤트명으로 정규화해 같은 처리 경로를 탄다.
    private static final Map<String, String> ALIASES = Map.of(
            "response.output_audio.delta", "response.audio.delta",
            "response.output_audio.done", "response.audio.done",
            "response.output_audio_transcript.delta", "response.audio_transcript.delta",
            "response.output_audio_transcript.done", "response.audio_transcript.done",
            "response.output_text.delta", "response.text.delta",
            "response.output_text.done", "response.text.done"
    );

    private final ObjectMapper objectMapper;

    public ServerEventParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public UpstreamReceipt parse(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            return UpstreamReceipt.recoverableError("Unreadable event: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return UpstreamReceipt.recoverableError("Event is not a JSON object");
        }
        String rawType = text(root, "type");
        if (rawType == null || rawType.isBlank()) {
            return UpstreamReceipt.recoverableError("Event type is missing");
        }
        String wireName = ALIASES.getOrDefault(rawType, rawType);
        ServerEventType type = ServerEventType.fromWireName(wireName);
        return UpstreamReceipt.event(toEvent(type, rawType, root));
    }

    private ServerEvent toEvent(ServerEventType type, String rawType, JsonNode root) {
        return switch (type) {
            case SESSION_UPDATED -> new ServerEvent.SessionUpdated(
                    text(root.path("session"), "id"),
                    iceServers(root.path("session").path("avatar").path("ice_servers")));
            case SESSION_AVATAR_CONNECTING -> new ServerEvent.AvatarConnecting(text(root, "server_sdp"));
            case RESPONSE_AUDIO_DELTA -> new ServerEvent.AudioDelta(text(root, "delta"));
            case RESPONSE_AUDIO_DONE -> new ServerEvent.AudioDone();
            case RESPONSE_AUDIO_TRANSCRIPT_DELTA -> new ServerEvent.AudioTranscriptDelta(text(root, "delta"));
            case RESPONSE_AUDIO_TRANSCRIPT_DONE -> new ServerEvent.AudioTranscriptDone(text(root, "transcript"));
            case RESPONSE_TEXT_DELTA -> new ServerEvent.TextDelta(text(root, "delta"));
            case RESPONSE_TEXT_DONE -> new ServerEvent.TextDone(text(root, "text"));
            case RESPONSE_CREATED -> new ServerEvent.ResponseCreated(text(root.path("response"), "id"));
            case RESPONSE_DONE -> new ServerEvent.ResponseDone();
            case INPUT_AUDIO_BUFFER_SPEECH_STARTED -> new ServerEvent.SpeechStarted(text(root, "item_id"));
            case INPUT_AUDIO_BUFFER_SPEECH_STOPPED -> new ServerEvent.SpeechStopped();
            case INPUT_AUDIO_TRANSCRIPTION_COMPLETED -> new ServerEvent.InputTranscriptionCompleted(
                    text(root, "item_id"), text(root, "transcript"));
            case CONVERSATION_ITEM_CREATED -> {
                JsonNode item = root.path("item");
                yield new ServerEvent.ItemCreated(text(item, "id"), text(item, "type"), text(item, "name"),
                        text(item, "call_id"));
            }
            case FUNCTION_CALL_ARGUMENTS_DONE -> new ServerEvent.FunctionCallArgumentsDone(
                    text(root, "call_id"), text(root, "name"), text(root, "arguments"));
            case ERROR -> {
                JsonNode error = root.path("error");
                String message = text(error, "message");
                yield new ServerEvent.ServiceError(text(error, "code"), message == null ? text(root, "message") : message);
            }
            case RESPONSE_VIDEO_DELTA -> new ServerEvent.VideoDelta(text(root, "delta"));
            case UNKNOWN -> new ServerEvent.Unknown(rawType);
        };
    }

    private List<IceServer> iceServers(JsonNode node) {
        if (!node.isArray()) {
            return List.of();
        }
        List<IceServer> servers = new ArrayList<>();
        for (JsonNode server : node) {
            List<String> urls = new ArrayList<>();
            JsonNode urlsNode = server.path("urls");
            if (urlsNode.isArray()) {
                urlsNode.forEach(url -> urls.add(url.asText()));
            } else if (urlsNode.isTextual()) {
                urls.add(urlsNode.asText());
            }
            servers.add(new IceServer(urls, text(server, "username"), text(server, "credential")));
        }
        return servers;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        return value.asText();
    }
}
