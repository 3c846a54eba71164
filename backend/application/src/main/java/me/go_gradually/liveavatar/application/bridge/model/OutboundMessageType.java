package me.go_gradually.liveavatar.application.bridge.model;

public enum OutboundMessageType {
    SESSION_STARTED("session_started"),
    SESSION_ERROR("session_error"),
    ICE_SERVERS("ice_servers"),
    AUDIO_DATA("audio_data"),
    AUDIO_DONE("audio_done"),
    TRANSCRIPT_DELTA("transcript_delta"),
    TRANSCRIPT_DONE("transcript_done"),
    TEXT_DELTA("text_delta"),
    TEXT_DONE("text_done"),
    RESPONSE_CREATED("response_created"),
    RESPONSE_DONE("response_done"),
    SPEECH_STARTED("speech_started"),
    SPEECH_STOPPED("speech_stopped"),
    AVATAR_SDP_ANSWER("avatar_sdp_answer"),
    VIDEO_DATA("video_data"),
    FUNCTION_CALL_STARTED("function_call_started"),
    FUNCTION_CALL_RESULT("function_call_result"),
    FUNCTION_CALL_ERROR("function_call_error"),
    STOP_PLAYBACK("stop_playback"),
    ERROR("error");

    private final String wireName;

    OutboundMessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
