package me.go_gradually.liveavatar.domain.voice;

public record VoiceSelection(VoiceType type,
                             String name,
                             String endpointId,
                             String model,
                             Double temperature,
                             String rate) {
    public static final String DEFAULT_PERSONAL_MODEL = "DragonLatestNeural";

    public VoiceSelection {
        if (type == null) {
            throw new IllegalArgumentException("Voice type is required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Voice name is required");
        }
    }

    public static VoiceSelection standard(String voiceName, double temperature, double speed) {
        if (voiceName == null || voiceName.isBlank()) {
            throw new IllegalArgumentException("Voice name is required");
        }
        // 하이픈이 있는 이름(en-US-AvaNeural 등)은 Azure 음성, 없으면 OpenAI 음성(alloy 등)이다.
        if (!voiceName.contains("-")) {
            return new VoiceSelection(VoiceType.OPENAI, voiceName, null, null, null, null);
        }
        Double dragonTemperature = voiceName.contains("Dragon") ? temperature : null;
        return new VoiceSelection(VoiceType.AZURE_STANDARD, voiceName, null, null, dragonTemperature, rate(speed));
    }

    public static VoiceSelection custom(String voiceName, String deploymentId, double speed) {
        if (deploymentId == null || deploymentId.isBlank()) {
            throw new IllegalArgumentException("Custom voice deployment id is required");
        }
        return new VoiceSelection(VoiceType.AZURE_CUSTOM, voiceName, deploymentId, null, null, rate(speed));
    }

    public static VoiceSelection personal(String voiceName, String personalModel, double temperature) {
        String model = personalModel == null || personalModel.isBlank() ? DEFAULT_PERSONAL_MODEL : personalModel;
        return new VoiceSelection(VoiceType.AZURE_PERSONAL, voiceName, null, model, temperature, null);
    }

    private static String rate(double speed) {
        return Double.toString(speed);
    }
}
