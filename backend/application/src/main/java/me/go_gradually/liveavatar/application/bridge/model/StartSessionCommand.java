package me.go_gradually.liveavatar.application.bridge.model;

import me.go_gradually.liveavatar.domain.session.SessionConfig;

public record StartSessionCommand(SessionConfig config, String endpoint, String apiKey, String entraToken) {
    public StartSessionCommand {
        if (config == null) {
            throw new IllegalArgumentException("Session config is required");
        }
    }
}
