package me.go_gradually.liveavatar.domain.voice;

public enum VoiceType {
    AZURE_STANDARD("azure-standard"),
    AZURE_CUSTOM("azure-custom"),
    AZURE_PERSONAL("azure-personal"),
    OPENAI("openai");

    private final String code;

    VoiceType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
