package me.go_gradually.liveavatar.domain.session;

import java.util.Locale;

public enum ConnectionMode {
    MODEL("model"),
    AGENT("agent"),
    AGENT_V2("agent-v2");

    private final String code;

    ConnectionMode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isAgent() {
        return this != MODEL;
    }

    public static ConnectionMode fromCode(String code) {
        if (code == null || code.isBlank()) {
            return MODEL;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (ConnectionMode mode : values()) {
            if (mode.code.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + code);
    }
}
