package me.go_gradually.liveavatar.domain.session;

public enum TurnDetectionType {
    SERVER_VAD("server_vad"),
    AZURE_SEMANTIC_VAD("azure_semantic_vad");

    private final String code;

    TurnDetectionType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static TurnDetectionType fromCode(String code) {
        if ("azure_semantic_vad".equals(code)) {
            return AZURE_SEMANTIC_VAD;
        }
        return SERVER_VAD;
    }
}
