package me.go_gradually.liveavatar.application.bridge.policy;

import java.time.Duration;

public interface BridgePolicy {
    String defaultEndpoint();

    String defaultApiKey();

    String defaultModel();

    String defaultVoice();

    String apiVersion();

    Duration setupTimeout();

    Duration functionCallTimeout();

    Duration terminationTimeout();

    int audioDropLogInterval();
}
