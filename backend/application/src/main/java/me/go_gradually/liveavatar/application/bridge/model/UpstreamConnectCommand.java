package me.go_gradually.liveavatar.application.bridge.model;

import me.go_gradually.liveavatar.domain.session.ConnectionMode;

public record UpstreamConnectCommand(String endpoint,
                                     UpstreamCredential credential,
                                     String apiVersion,
                                     ConnectionMode mode,
                                     String model,
                                     String agentId,
                                     String agentName,
                                     String agentProjectName) {
    public UpstreamConnectCommand {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("Endpoint is required");
        }
        if (credential == null) {
            throw new IllegalArgumentException("Credential is required");
        }
        if (mode == null) {
            mode = ConnectionMode.MODEL;
        }
    }
}
