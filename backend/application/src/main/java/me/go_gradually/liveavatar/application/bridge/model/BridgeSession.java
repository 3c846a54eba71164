package me.go_gradually.liveavatar.application.bridge.model;

import me.go_gradually.liveavatar.domain.session.ClientId;
import me.go_gradually.liveavatar.domain.session.SessionStatus;

import java.time.Duration;
import java.util.Map;

public interface BridgeSession {
    ClientId clientId();

    SessionStatus status();

    void appendAudio(String base64Audio);

    void sendText(String text);

    void submitAvatarOffer(String clientSdp);

    void interrupt();

    void updateScene(Map<String, Object> avatar);

    void stop();

    boolean awaitTermination(Duration timeout) throws InterruptedException;
}
