package me.go_gradually.liveavatar.application.bridge.model;

import java.util.Map;

public record ClientCommand(ClientCommandType type, String value, Map<String, Object> avatar) {
    public ClientCommand {
        if (type == null) {
            throw new IllegalArgumentException("Command type is required");
        }
        avatar = avatar == null ? Map.of() : avatar;
    }

    public static ClientCommand audioChunk(String base64Audio) {
        return new ClientCommand(ClientCommandType.AUDIO_CHUNK, base64Audio, null);
    }

    public static ClientCommand sendText(String text) {
        return new ClientCommand(ClientCommandType.SEND_TEXT, text, null);
    }

    public static ClientCommand avatarSdpOffer(String clientSdp) {
        return new ClientCommand(ClientCommandType.AVATAR_SDP_OFFER, clientSdp, null);
    }

    public static ClientCommand interrupt() {
        return new ClientCommand(ClientCommandType.INTERRUPT, null, null);
    }

    public static ClientCommand updateScene(Map<String, Object> avatar) {
        return new ClientCommand(ClientCommandType.UPDATE_SCENE, null, avatar);
    }
}
