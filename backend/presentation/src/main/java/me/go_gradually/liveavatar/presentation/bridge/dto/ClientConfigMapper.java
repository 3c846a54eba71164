package me.go_gradually.liveavatar.presentation.bridge.dto;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.liveavatar.application.bridge.model.SessionConfigException;
import me.go_gradually.liveavatar.application.bridge.model.StartSessionCommand;
import me.go_gradually.liveavatar.application.bridge.policy.BridgePolicy;
import me.go_gradually.liveavatar.domain.avatar.AvatarOutputMode;
import me.go_gradually.liveavatar.domain.avatar.AvatarSelection;
import me.go_gradually.liveavatar.domain.avatar.PhotoScene;
import me.go_gradually.liveavatar.domain.session.ConnectionMode;
import me.go_gradually.liveavatar.domain.session.SessionConfig;
import me.go_gradually.liveavatar.domain.session.TranscriptionOptions;
import me.go_gradually.liveavatar.domain.session.TurnDetection;
import me.go_gradually.liveavatar.domain.voice.VoiceSelection;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class ClientConfigMapper {
    private static final TypeReference<List<Map<String, Object>>> TOOL_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {
    };

    private final BridgePolicy policy;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ClientConfigMapper(BridgePolicy policy) {
        this.policy = policy;
    }

    public StartSessionCommand toStartCommand(JsonNode config) {
        JsonNode node = config == null || config.isMissingNode() || config.isNull()
                ? objectMapper.createObjectNode()
                : config;
        try {
            return new StartSessionCommand(
                    toSessionConfig(node),
                    readString(node, "endpoint"),
                    readString(node, "apiKey"),
                    readString(node, "entraToken")
            );
        } catch (IllegalArgumentException e) {
            throw new SessionConfigException(e.getMessage(), e);
        }
    }

    public Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(node, OBJECT_MAP);
    }

    private SessionConfig toSessionConfig(JsonNode node) {
        ConnectionMode mode = ConnectionMode.fromCode(readString(node, "mode"));
        String model = readString(node, "model", policy.defaultModel());
        return SessionConfig.builder(model, toVoice(node))
                .mode(mode)
                .agent(readString(node, "agentId"), readString(node, "agentName"), readString(node, "agentProjectName"))
                .instructions(readString(node, "instructions"))
                .temperature(readDouble(node, "temperature", SessionConfig.DEFAULT_TEMPERATURE))
                .avatar(toAvatar(node))
                .turnDetection(TurnDetection.of(
                        readString(node, "turnDetectionType"),
                        readString(node, "eouDetectionType"),
                        readBoolean(node, "removeFillerWords", false)))
                .transcription(TranscriptionOptions.resolve(mode, model,
                        readString(node, "srModel"), readString(node, "recognitionLanguage")))
                .noiseReduction(readBoolean(node, "useNS", false))
                .echoCancellation(readBoolean(node, "useEC", false))
                .proactiveGreeting(readBoolean(node, "enableProactive", true))
                .tools(toTools(node.path("tools")))
                .sessionExtensions(withoutNulls(toMap(node.path("sessionExtensions"))))
                .build();
    }

    private VoiceSelection toVoice(JsonNode node) {
        String voiceType = readString(node, "voiceType", "standard");
        double temperature = readDouble(node, "voiceTemperature", 0.9);
        double speed = readDouble(node, "voiceSpeed", 1.0);
        return switch (voiceType) {
            case "custom" -> VoiceSelection.custom(readString(node, "customVoiceName"),
                    readString(node, "voiceDeploymentId"), speed);
            case "personal" -> VoiceSelection.personal(readString(node, "personalVoiceName"),
                    readString(node, "personalVoiceModel"), temperature);
            default -> VoiceSelection.standard(readString(node, "voiceName", policy.defaultVoice()), temperature, speed);
        };
    }

    private AvatarSelection toAvatar(JsonNode node) {
        if (!readBoolean(node, "avatarEnabled", false)) {
            return null;
        }
        AvatarOutputMode outputMode = AvatarOutputMode.fromCode(readString(node, "avatarOutputMode"));
        String background = readString(node, "avatarBackgroundImageUrl");
        if (readBoolean(node, "isCustomAvatar", false)) {
            return AvatarSelection.custom(readString(node, "customAvatarName"), background, outputMode);
        }
        if (readBoolean(node, "isPhotoAvatar", false)) {
            return AvatarSelection.photo(readString(node, "photoAvatarName"), background, outputMode,
                    toScene(node.path("photoScene")));
        }
        return AvatarSelection.standard(readString(node, "avatarName"), background, outputMode);
    }

    private PhotoScene toScene(JsonNode scene) {
        if (!scene.isObject() || scene.isEmpty()) {
            return null;
        }
        PhotoScene defaults = PhotoScene.defaults();
        return new PhotoScene(
                readDouble(scene, "zoom", defaults.zoom()),
                readDouble(scene, "positionX", defaults.positionX()),
                readDouble(scene, "positionY", defaults.positionY()),
                readDouble(scene, "rotationX", defaults.rotationX()),
                readDouble(scene, "rotationY", defaults.rotationY()),
                readDouble(scene, "rotationZ", defaults.rotationZ()),
                readDouble(scene, "amplitude", defaults.amplitude())
        );
    }

    private List<Map<String, Object>> toTools(JsonNode tools) {
        if (!tools.isArray()) {
            return List.of();
        }
        return objectMapper.convertValue(tools, TOOL_LIST);
    }

    private Map<String, Object> withoutNulls(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (value != null) {
                copy.put(key, value);
            }
        });
        return copy;
    }

    private String readString(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }

    private String readString(JsonNode node, String field, String defaultValue) {
        String value = readString(node, field);
        return value == null ? defaultValue : value;
    }

    private double readDouble(JsonNode node, String field, double defaultValue) {
        JsonNode value = node.path(field);
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new SessionConfigException("Invalid number for " + field + ": " + value.asText());
            }
        }
        return defaultValue;
    }

    private boolean readBoolean(JsonNode node, String field, boolean defaultValue) {
        JsonNode value = node.path(field);
        if (!value.isMissingNode() && !value.isNull()) {
            return value.asBoolean(defaultValue);
        }
        return defaultValue;
    }
}
