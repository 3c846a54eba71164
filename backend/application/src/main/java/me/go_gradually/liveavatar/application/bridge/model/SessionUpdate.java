package me.go_gradually.liveavatar.application.bridge.model;

import me.go_gradually.liveavatar.domain.session.SessionConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record SessionUpdate(SessionConfig config, Map<String, Object> rawAvatar) {
    public SessionUpdate {
        if (config == null) {
            throw new IllegalArgumentException("Session config is required");
        }
    }

    public static SessionUpdate full(SessionConfig config) {
        return new SessionUpdate(config, null);
    }

    public static SessionUpdate scene(SessionConfig config, Map<String, Object> rawAvatar) {
        if (rawAvatar == null || rawAvatar.isEmpty()) {
            throw new IllegalArgumentException("Avatar scene is required");
        }
        return new SessionUpdate(config, Collections.unmodifiableMap(new LinkedHashMap<>(rawAvatar)));
    }

    public boolean isSceneOnly() {
        return rawAvatar != null;
    }
}
