package me.go_gradually.liveavatar.presentation.meta.controller;

import me.go_gradually.liveavatar.application.bridge.policy.BridgePolicy;
import me.go_gradually.liveavatar.application.bridge.usecase.SessionRegistry;
import me.go_gradually.liveavatar.presentation.meta.dto.ClientDefaultsResponse;
import me.go_gradually.liveavatar.presentation.meta.dto.HealthResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MetaController {
    private static final String SERVICE_NAME = "voice-live-avatar";

    private final BridgePolicy bridgePolicy;
    private final SessionRegistry sessionRegistry;

    public MetaController(BridgePolicy bridgePolicy, SessionRegistry sessionRegistry) {
        this.bridgePolicy = bridgePolicy;
        this.sessionRegistry = sessionRegistry;
    }

    @GetMapping("/api/config")
    public ClientDefaultsResponse config() {
        return new ClientDefaultsResponse(
                bridgePolicy.defaultModel(),
                bridgePolicy.defaultVoice(),
                nullToEmpty(bridgePolicy.defaultEndpoint()),
                !isBlank(bridgePolicy.defaultApiKey())
        );
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("healthy", SERVICE_NAME, sessionRegistry.activeSessionCount());
    }

    private String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
