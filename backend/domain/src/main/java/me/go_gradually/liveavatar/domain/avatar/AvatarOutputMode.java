package me.go_gradually.liveavatar.domain.avatar;

import java.util.Locale;

public enum AvatarOutputMode {
    WEBRTC("webrtc"),
    WEBSOCKET("websocket");

    private final String code;

    AvatarOutputMode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isPeerToPeer() {
        return this == WEBRTC;
    }

    public static AvatarOutputMode fromCode(String code) {
        if (code != null && "websocket".equals(code.trim().toLowerCase(Locale.ROOT))) {
            return WEBSOCKET;
        }
        return WEBRTC;
    }
}
