package me.go_gradually.liveavatar.domain.session;

public record TranscriptionOptions(String model, String language) {
    public static final String DEFAULT_SR_MODEL = "azure-speech";
    private static final String REALTIME_MODEL_TRANSCRIBER = "whisper-1";
    private static final String LANGUAGE_LOCKED_MODEL = "mai-ears-1";

    public TranscriptionOptions {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("Transcription model is required");
        }
    }

    public static TranscriptionOptions resolve(ConnectionMode mode,
                                               String conversationModel,
                                               String srModel,
                                               String recognitionLanguage) {
        String speechModel = isBlank(srModel) ? DEFAULT_SR_MODEL : srModel;
        boolean realtimeModel = conversationModel != null && conversationModel.contains("realtime");
        String model = mode == ConnectionMode.MODEL && realtimeModel ? REALTIME_MODEL_TRANSCRIBER : speechModel;
        // mai-ears-1은 언어 지정을 지원하지 않고, auto는 서버 자동 감지에 맡긴다.
        String language = LANGUAGE_LOCKED_MODEL.equals(speechModel)
                || isBlank(recognitionLanguage)
                || "auto".equals(recognitionLanguage) ? null : recognitionLanguage;
        return new TranscriptionOptions(model, language);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
