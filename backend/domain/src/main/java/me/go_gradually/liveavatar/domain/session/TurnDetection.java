package me.go_gradually.liveavatar.domain.session;

public record TurnDetection(TurnDetectionType type,
                            double threshold,
                            int prefixPaddingMs,
                            int speechDurationMs,
                            int silenceDurationMs,
                            boolean removeFillerWords,
                            boolean interruptResponse,
                            EndOfUtterance endOfUtterance) {
    private static final double DEFAULT_THRESHOLD = 0.3;
    private static final int DEFAULT_PREFIX_PADDING_MS = 300;
    private static final int DEFAULT_SPEECH_DURATION_MS = 80;
    private static final int DEFAULT_SILENCE_DURATION_MS = 500;

    public TurnDetection {
        if (type == null) {
            throw new IllegalArgumentException("Turn detection type is required");
        }
    }

    public static TurnDetection serverVad() {
        return new TurnDetection(TurnDetectionType.SERVER_VAD, DEFAULT_THRESHOLD, DEFAULT_PREFIX_PADDING_MS,
                0, DEFAULT_SILENCE_DURATION_MS, false, false, null);
    }

    public static TurnDetection azureSemanticVad(boolean removeFillerWords, boolean semanticEndOfUtterance) {
        return new TurnDetection(TurnDetectionType.AZURE_SEMANTIC_VAD, DEFAULT_THRESHOLD, DEFAULT_PREFIX_PADDING_MS,
                DEFAULT_SPEECH_DURATION_MS, DEFAULT_SILENCE_DURATION_MS, removeFillerWords, true,
                semanticEndOfUtterance ? EndOfUtterance.semanticDetection() : null);
    }

    public static TurnDetection of(String typeCode, String endOfUtteranceCode, boolean removeFillerWords) {
        if (TurnDetectionType.fromCode(typeCode) == TurnDetectionType.AZURE_SEMANTIC_VAD) {
            return azureSemanticVad(removeFillerWords, "semantic_detection_v1".equals(endOfUtteranceCode));
        }
        return serverVad();
    }

    public record EndOfUtterance(String model, String thresholdLevel, int timeoutMs) {
        public static EndOfUtterance semanticDetection() {
            return new EndOfUtterance("semantic_detection_v1", "default", 1000);
        }
    }
}
