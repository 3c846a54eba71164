package me.go_gradually.liveavatar.application.bridge.model;

import java.util.HashMap;
import java.util.Map;

public enum ServerEventType {
    SESSION_UPDATED("session.updated"),
    SESSION_AVATAR_CONNECTING("session.avatar.connecting"),
    RESPONSE_AUDIO_DELTA("response.audio.delta"),
    RESPONSE_AUDIO_DONE("response.audio.done"),
    RESPONSE_AUDIO_TRANSCRIPT_DELTA("response.audio_transcript.delta"),
    RESPONSE_AUDIO_TRANSCRIPT_DONE("response.audio_transcript.done"),
    RESPONSE_TEXT_DELTA("response.text.delta"),
    RESPONSE_TEXT_DONE("response.text.done"),
    RESPONSE_CREATED("response.created"),
    RESPONSE_DONE("response.done"),
    INPUT_AUDIO_BUFFER_SPEECH_STARTED("input_audio_buffer.speech_started"),
    INPUT_AUDIO_BUFFER_SPEECH_STOPPED("input_audio_buffer.speech_stopped"),
    INPUT_AUDIO_TRANSCRIPTION_COMPLETED("conversation.item.input_audio_transcription.completed"),
    CONVERSATION_ITEM_CREATED("conversation.item.created"),
    FUNCTION_CALL_ARGUMENTS_DONE("response.function_call_arguments.done"),
    ERROR("error"),
    RESPONSE_VIDEO_DELTA("response.video.delta"),
    UNKNOWN("");

    private static final Map<String, ServerEventType> BY_WIRE_NAME = new HashMap<>();

    static {
        for (ServerEventType type : values()) {
            if (type != UNKNOWN) {
                BY_WIRE_NAME.put(type.wireName, type);
            }
        }
    }

    private final String wireName;

    ServerEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ServerEventType fromWireName(String wireName) {
        if (wireName == null) {
            return UNKNOWN;
        }
        return BY_WIRE_NAME.getOrDefault(wireName, UNKNOWN);
    }

    // 초당 여러 번 오는 이벤트는 이벤트별 로그에서 뺀다.
    public boolean isHighFrequency() {
        return this == RESPONSE_AUDIO_DELTA
                || this == RESPONSE_AUDIO_TRANSCRIPT_DELTA
                || this == RESPONSE_TEXT_DELTA
                || this == RESPONSE_VIDEO_DELTA;
    }
}
