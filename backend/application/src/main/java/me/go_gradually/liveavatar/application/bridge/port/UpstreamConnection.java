package me.go_gradually.liveavatar.application.bridge.port;

import me.go_gradually.liveavatar.application.bridge.model.SessionUpdate;
import me.go_gradually.liveavatar.application.bridge.model.UpstreamReceipt;

import java.time.Duration;

/**
 * Duplex connection to the upstream service. Send methods are safe to call from any thread and throw
 * {@link me.go_gradually.liveavatar.application.bridge.model.UpstreamConnectionException} once the
 * connection is gone.
 */
public interface UpstreamConnection {
    void updateSession(SessionUpdate update);

    void appendInputAudio(String base64Audio);

    void createResponse();

    void cancelResponse();

    void createFunctionCallOutput(String previousItemId, String callId, String output);

    void createUserMessage(String text);

    void connectAvatar(String clientSdp);

    // 닫힌 뒤에는 매번 CLOSED receipt를 돌려준다.
    UpstreamReceipt receive() throws InterruptedException;

    // 시간 안에 도착한 receipt가 없으면 null
    UpstreamReceipt poll(Duration timeout) throws InterruptedException;

    void close();
}
