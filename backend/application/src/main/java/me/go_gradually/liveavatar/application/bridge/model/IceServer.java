package me.go_gradually.liveavatar.application.bridge.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record IceServer(List<String> urls, String username, String credential) {
    public IceServer {
        urls = urls == null ? List.of() : List.copyOf(urls);
    }

    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("urls", urls);
        if (username != null && !username.isBlank()) {
            wire.put("username", username);
        }
        if (credential != null && !credential.isBlank()) {
            wire.put("credential", credential);
        }
        return wire;
    }
}
