package me.go_gradually.liveavatar.infrastructure.voicelive.protocol;

import me.go_gradually.liveavatar.application.bridge.model.SessionUpdate;
import me.go_gradually.liveavatar.domain.avatar.AvatarSelection;
import me.go_gradually.liveavatar.domain.session.SessionConfig;
import me.go_gradually.liveavatar.domain.session.TranscriptionOptions;
import me.go_gradually.liveavatar.domain.session.TurnDetection;
import me.go_gradually.liveavatar.domain.session.TurnDetectionType;
import me.go_gradually.liveavatar.domain.voice.VoiceSelection;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class VoiceLiveCommandSerializer {
    private static final String AUDIO_FORMAT = "pcm16";

    public Map<String, Object> sessionUpdate(SessionUpdate update) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("type", "session.update");
        root.put("session", update.isSceneOnly()
                ? scenePayload(update.config(), update.rawAvatar())
                : sessionPayload(update.config()));
        return root;
    }

    public Map<String, Object> appendInputAudio(String base64Audio) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("type", "input_audio_buffer.append");
        root.put("audio", base64Audio);
        return root;
    }

    public Map<String, Object> createResponse() {
        return Map.of("type", "response.create");
    }

    public Map<String, Object> cancelResponse() {
        return Map.of("type", "response.cancel");
    }

    public Map<String, Object> functionCallOutput(String previousItemId, String callId, String output) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("type", "function_call_output");
        item.put("call_id", callId);
        item.put("output", output);

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("type", "conversation.item.create");
        if (previousItemId != null && !previousItemId.isBlank()) {
            root.put("previous_item_id", previousItemId);
        }
        root.put("item", item);
        return root;
    }

    public Map<String, Object> userMessage(String text) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("type", "message");
        item.put("role", "user");
        item.put("content", List.of(Map.of("type", "input_text", "text", text)));

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("type", "conversation.item.create");
        root.put("item", item);
        return root;
    }

    public Map<String, Object> connectAvatar(String clientSdp) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("type", "session.avatar.connect");
        root.put("client_sdp", clientSdp);
        return root;
    }

    Map<String, Object> sessionPayload(SessionConfig config) {
        Map<String, Object> session = new LinkedHashMap<>();
        session.put("modalities", List.of("text", "audio"));
        if (config.instructions() != null && !config.instructions().isBlank()) {
            session.put("instructions", config.instructions());
        }
        session.put("voice", voice(config.voice()));
        if (config.avatar() != null) {
            session.put("avatar", avatar(config.avatar()));
        }
        session.put("input_audio_format", AUDIO_FORMAT);
        session.put("output_audio_format", AUDIO_FORMAT);
        session.put("input_audio_transcription", transcription(config.transcription()));
        session.put("turn_detection", turnDetection(config.turnDetection()));
        if (!config.tools().isEmpty()) {
            session.put("tools", config.tools());
            session.put("tool_choice", "auto");
        }
        if (config.sendsTemperature()) {
            session.put("temperature", config.temperature());
        }
        if (config.noiseReduction()) {
            session.put("input_audio_noise_reduction", Map.of("type", "azure_deep_noise_suppression"));
        }
        if (config.echoCancellation()) {
            session.put("input_audio_echo_cancellation", Map.of("type", "server_echo_cancellation"));
        }
        session.putAll(config.sessionExtensions());
        return session;
    }

    // 장면 갱신에서도 오디오 포맷과 턴 감지를 다시 보내야 서버가 기본값으로 되돌리지 않는다.
    Map<String, Object> scenePayload(SessionConfig config, Map<String, Object> rawAvatar) {
        Map<String, Object> session = new LinkedHashMap<>();
        session.put("avatar", rawAvatar);
        session.put("input_audio_format", AUDIO_FORMAT);
        session.put("output_audio_format", AUDIO_FORMAT);
        session.put("turn_detection", turnDetection(config.turnDetection()));
        return session;
    }

    private Map<String, Object> voice(VoiceSelection voice) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", voice.type().code());
        payload.put("name", voice.name());
        putIfPresent(payload, "endpoint_id", voice.endpointId());
        putIfPresent(payload, "model", voice.model());
        putIfPresent(payload, "temperature", voice.temperature());
        putIfPresent(payload, "rate", voice.rate());
        return payload;
    }

    private Map<String, Object> avatar(AvatarSelection avatar) {
        Map<String, Object> video = new LinkedHashMap<>();
        video.put("codec", AvatarSelection.VIDEO_CODEC);
        if (avatar.cropTopLeft() != null) {
            video.put("crop", Map.of(
                    "top_left", avatar.cropTopLeft(),
                    "bottom_right", avatar.cropBottomRight()
            ));
        }
        if (avatar.backgroundImageUrl() != null) {
            video.put("background", Map.of("image_url", avatar.backgroundImageUrl()));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("character", avatar.character());
        putIfPresent(payload, "style", avatar.style());
        if (avatar.isCustomized()) {
            payload.put("customized", true);
        }
        payload.put("video", video);
        if (avatar.isPhoto()) {
            payload.put("type", AvatarSelection.PHOTO_AVATAR_TYPE);
            payload.put("model", AvatarSelection.PHOTO_AVATAR_MODEL);
            if (avatar.scene() != null) {
                payload.put("scene", avatar.scene().toServiceScene());
            }
        }
        payload.put("output_protocol", avatar.outputMode().code());
        return payload;
    }

    private Map<String, Object> transcription(TranscriptionOptions transcription) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", transcription.model());
        putIfPresent(payload, "language", transcription.language());
        return payload;
    }

    private Map<String, Object> turnDetection(TurnDetection turnDetection) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", turnDetection.type().code());
        payload.put("threshold", turnDetection.threshold());
        payload.put("prefix_padding_ms", turnDetection.prefixPaddingMs());
        if (turnDetection.type() == TurnDetectionType.AZURE_SEMANTIC_VAD) {
            payload.put("speech_duration_ms", turnDetection.speechDurationMs());
        }
        payload.put("silence_duration_ms", turnDetection.silenceDurationMs());
        if (turnDetection.type() == TurnDetectionType.AZURE_SEMANTIC_VAD) {
            payload.put("remove_filler_words", turnDetection.removeFillerWords());
            payload.put("interrupt_response", turnDetection.interruptResponse());
            TurnDetection.EndOfUtterance endOfUtterance = turnDetection.endOfUtterance();
            if (endOfUtterance != null) {
                Map<String, Object> eou = new LinkedHashMap<>();
                eou.put("model", endOfUtterance.model());
                eou.put("threshold_level", endOfUtterance.thresholdLevel());
                eou.put("timeout_ms", endOfUtterance.timeoutMs());
                payload.put("end_of_utterance_detection", eou);
            }
        }
        return payload;
    }

    private static void putIfPresent(Map<String, Object> payload, String key, Object value) {
        if (value != null) {
            payload.put(key, value);
        }
    }
}
