package me.go_gradually.liveavatar.domain.session;

import me.go_gradually.liveavatar.domain.avatar.AvatarOutputMode;
import me.go_gradually.liveavatar.domain.avatar.AvatarSelection;
import me.go_gradually.liveavatar.domain.voice.VoiceSelection;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of the client-provided session configuration.
 * <p>
 * {@code sessionExtensions} is part of the client wire schema: its entries are merged verbatim into
 * the upstream {@code session} object, for service fields that have no typed counterpart here.
 */
public record SessionConfig(ConnectionMode mode,
                            String model,
                            String agentId,
                            String agentName,
                            String agentProjectName,
                            String instructions,
                            double temperature,
                            VoiceSelection voice,
                            AvatarSelection avatar,
                            TurnDetection turnDetection,
                            TranscriptionOptions transcription,
                            boolean noiseReduction,
                            boolean echoCancellation,
                            boolean proactiveGreeting,
                            List<Map<String, Object>> tools,
                            Map<String, Object> sessionExtensions) {
    public static final double DEFAULT_TEMPERATURE = 0.9;

    public SessionConfig {
        if (mode == null) {
            mode = ConnectionMode.MODEL;
        }
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("Model is required");
        }
        if (voice == null) {
            throw new IllegalArgumentException("Voice is required");
        }
        if (turnDetection == null) {
            turnDetection = TurnDetection.serverVad();
        }
        if (transcription == null) {
            transcription = TranscriptionOptions.resolve(mode, model, null, null);
        }
        tools = tools == null ? List.of() : List.copyOf(tools);
        sessionExtensions = sessionExtensions == null ? Map.of() : Map.copyOf(new LinkedHashMap<>(sessionExtensions));
    }

    public boolean avatarEnabled() {
        return avatar != null;
    }

    public AvatarOutputMode avatarOutputMode() {
        return avatar == null ? AvatarOutputMode.WEBRTC : avatar.outputMode();
    }

    public String sessionModel() {
        return mode.isAgent() ? mode.code() : model;
    }

    public boolean sendsTemperature() {
        // agent-v2는 에이전트 정의의 temperature를 쓴다.
        return mode != ConnectionMode.AGENT_V2;
    }

    public static Builder builder(String model, VoiceSelection voice) {
        return new Builder(model, voice);
    }

    public static final class Builder {
        private ConnectionMode mode = ConnectionMode.MODEL;
        private final String model;
        private String agentId;
        private String agentName;
        private String agentProjectName;
        private String instructions;
        private double temperature = DEFAULT_TEMPERATURE;
        private final VoiceSelection voice;
        private AvatarSelection avatar;
        private TurnDetection turnDetection;
        private TranscriptionOptions transcription;
        private boolean noiseReduction;
        private boolean echoCancellation;
        private boolean proactiveGreeting = true;
        private List<Map<String, Object>> tools;
        private Map<String, Object> sessionExtensions;

        private Builder(String model, VoiceSelection voice) {
            this.model = model;
            this.voice = voice;
        }

        public Builder mode(ConnectionMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder agent(String agentId, String agentName, String agentProjectName) {
            this.agentId = agentId;
            this.agentName = agentName;
            this.agentProjectName = agentProjectName;
            return this;
        }

        public Builder instructions(String instructions) {
            this.instructions = instructions;
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder avatar(AvatarSelection avatar) {
            this.avatar = avatar;
            return this;
        }

        public Builder turnDetection(TurnDetection turnDetection) {
            this.turnDetection = turnDetection;
            return this;
        }

        public Builder transcription(TranscriptionOptions transcription) {
            this.transcription = transcription;
            return this;
        }

        public Builder noiseReduction(boolean noiseReduction) {
            this.noiseReduction = noiseReduction;
            return this;
        }

        public Builder echoCancellation(boolean echoCancellation) {
            this.echoCancellation = echoCancellation;
            return this;
        }

        public Builder proactiveGreeting(boolean proactiveGreeting) {
            this.proactiveGreeting = proactiveGreeting;
            return this;
        }

        public Builder tools(List<Map<String, Object>> tools) {
            this.tools = tools;
            return this;
        }

        public Builder sessionExtensions(Map<String, Object> sessionExtensions) {
            this.sessionExtensions = sessionExtensions;
            return this;
        }

        public SessionConfig build() {
            return new SessionConfig(mode, model, agentId, agentName, agentProjectName, instructions, temperature,
                    voice, avatar, turnDetection, transcription, noiseReduction, echoCancellation, proactiveGreeting,
                    tools, sessionExtensions);
        }
    }
}
