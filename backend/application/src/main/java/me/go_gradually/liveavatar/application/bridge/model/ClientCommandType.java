package me.go_gradually.liveavatar.application.bridge.model;

public enum ClientCommandType {
    AUDIO_CHUNK,
    SEND_TEXT,
    AVATAR_SDP_OFFER,
    INTERRUPT,
    UPDATE_SCENE
}
