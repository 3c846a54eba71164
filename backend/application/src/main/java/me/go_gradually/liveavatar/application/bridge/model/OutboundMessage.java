package me.go_gradually.liveavatar.application.bridge.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class OutboundMessage {
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_USER = "user";
    public static final String REASON_MANUAL_INTERRUPT = "manual_interrupt";
    public static final String REASON_USER_INTERRUPTION = "user_interruption";
    private static final String AUDIO_FORMAT = "pcm16";
    private static final int AUDIO_SAMPLE_RATE = 24000;

    private final OutboundMessageType type;
    private final Map<String, Object> payload;

    private OutboundMessage(OutboundMessageType type, Map<String, Object> payload) {
        this.type = type;
        this.payload = Collections.unmodifiableMap(payload);
    }

    public static OutboundMessage sessionStarted(String sessionId, String model, boolean avatarEnabled, String avatarOutputMode) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("model", model);
        config.put("avatarEnabled", avatarEnabled);
        config.put("avatarOutputMode", avatarOutputMode);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", "success");
        payload.put("sessionId", sessionId);
        payload.put("config", config);
        return new OutboundMessage(OutboundMessageType.SESSION_STARTED, payload);
    }

    public static OutboundMessage sessionError(String error) {
        return single(OutboundMessageType.SESSION_ERROR, "error", error);
    }

    public static OutboundMessage iceServers(List<IceServer> servers) {
        List<Map<String, Object>> wire = servers.stream().map(IceServer::toWire).toList();
        return single(OutboundMessageType.ICE_SERVERS, "iceServers", wire);
    }

    public static OutboundMessage audioData(String base64Audio) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("data", base64Audio);
        payload.put("format", AUDIO_FORMAT);
        payload.put("sampleRate", AUDIO_SAMPLE_RATE);
        return new OutboundMessage(OutboundMessageType.AUDIO_DATA, payload);
    }

    public static OutboundMessage audioDone() {
        return new OutboundMessage(OutboundMessageType.AUDIO_DONE, new LinkedHashMap<>());
    }

    public static OutboundMessage transcriptDelta(String role, String delta) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("role", role);
        payload.put("delta", delta);
        return new OutboundMessage(OutboundMessageType.TRANSCRIPT_DELTA, payload);
    }

    public static OutboundMessage transcriptDone(String role, String transcript, String itemId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("role", role);
        payload.put("transcript", transcript == null ? "" : transcript);
        if (itemId != null) {
            payload.put("itemId", itemId);
        }
        return new OutboundMessage(OutboundMessageType.TRANSCRIPT_DONE, payload);
    }

    public static OutboundMessage textDelta(String delta) {
        return single(OutboundMessageType.TEXT_DELTA, "delta", delta);
    }

    public static OutboundMessage textDone(String text) {
        return single(OutboundMessageType.TEXT_DONE, "text", text == null ? "" : text);
    }

    public static OutboundMessage responseCreated(String responseId) {
        return single(OutboundMessageType.RESPONSE_CREATED, "responseId", responseId == null ? "" : responseId);
    }

    public static OutboundMessage responseDone() {
        return new OutboundMessage(OutboundMessageType.RESPONSE_DONE, new LinkedHashMap<>());
    }

    public static OutboundMessage speechStarted(String itemId) {
        return single(OutboundMessageType.SPEECH_STARTED, "itemId", itemId == null ? "" : itemId);
    }

    public static OutboundMessage speechStopped() {
        return new OutboundMessage(OutboundMessageType.SPEECH_STOPPED, new LinkedHashMap<>());
    }

    public static OutboundMessage avatarSdpAnswer(String serverSdp) {
        return single(OutboundMessageType.AVATAR_SDP_ANSWER, "serverSdp", serverSdp);
    }

    public static OutboundMessage videoData(String delta) {
        return single(OutboundMessageType.VIDEO_DATA, "delta", delta);
    }

    public static OutboundMessage functionCallStarted(String functionName, String callId) {
        return new OutboundMessage(OutboundMessageType.FUNCTION_CALL_STARTED, functionCallPayload(functionName, callId));
    }

    public static OutboundMessage functionCallResult(String functionName, String callId, Map<String, Object> result) {
        Map<String, Object> payload = functionCallPayload(functionName, callId);
        payload.put("result", result);
        return new OutboundMessage(OutboundMessageType.FUNCTION_CALL_RESULT, payload);
    }

    public static OutboundMessage functionCallError(String functionName, String callId, String error) {
        Map<String, Object> payload = functionCallPayload(functionName, callId);
        payload.put("error", error);
        return new OutboundMessage(OutboundMessageType.FUNCTION_CALL_ERROR, payload);
    }

    public static OutboundMessage stopPlayback(String reason) {
        return single(OutboundMessageType.STOP_PLAYBACK, "reason", reason);
    }

    public static OutboundMessage error(String error) {
        return single(OutboundMessageType.ERROR, "error", error);
    }

    public OutboundMessageType type() {
        return type;
    }

    public Map<String, Object> payload() {
        return payload;
    }

    public Object get(String key) {
        return payload.get(key);
    }

    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("type", type.wireName());
        wire.putAll(payload);
        return wire;
    }

    @Override
    public String toString() {
        return "OutboundMessage{" + type.wireName() + "}";
    }

    private static Map<String, Object> functionCallPayload(String functionName, String callId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("functionName", functionName);
        payload.put("callId", callId);
        return payload;
    }

    private static OutboundMessage single(OutboundMessageType type, String key, Object value) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(key, value);
        return new OutboundMessage(type, payload);
    }
}
