package me.go_gradually.liveavatar.application.shared.port;

import java.time.Duration;

public interface MetricsPort {
    void recordSessionSetupLatency(Duration duration);

    void recordFunctionCallLatency(Duration duration);

    void incrementSessionStarted();

    void incrementSessionFailed();

    void incrementSessionClosed();

    void incrementFunctionCallCompleted();

    void incrementFunctionCallError();

    void incrementEventReceived(String eventType);

    void incrementRecoverableEventError();

    void incrementAudioChunkDropped();
}
