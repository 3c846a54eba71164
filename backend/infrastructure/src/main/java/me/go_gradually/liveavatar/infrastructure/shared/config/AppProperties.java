package me.go_gradually.liveavatar.infrastructure.shared.config;

import me.go_gradually.liveavatar.application.bridge.policy.BridgePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "liveavatar")
public class AppProperties implements BridgePolicy {
    private VoiceLive voiceLive = new VoiceLive();
    private Session session = new Session();

    public VoiceLive getVoiceLive() {
        return voiceLive;
    }

    public void setVoiceLive(VoiceLive voiceLive) {
        this.voiceLive = voiceLive;
    }

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session;
    }

    @Override
    public String defaultEndpoint() {
        return voiceLive.getEndpoint();
    }

    @Override
    public String defaultApiKey() {
        return voiceLive.getApiKey();
    }

    @Override
    public String defaultModel() {
        return voiceLive.getModel();
    }

    @Override
    public String defaultVoice() {
        return voiceLive.getVoice();
    }

    @Override
    public String apiVersion() {
        return voiceLive.getApiVersion();
    }

    @Override
    public Duration setupTimeout() {
        return session.getSetupTimeout();
    }

    @Override
    public Duration functionCallTimeout() {
        return session.getFunctionCallTimeout();
    }

    @Override
    public Duration terminationTimeout() {
        return session.getTerminationTimeout();
    }

    @Override
    public int audioDropLogInterval() {
        return session.getAudioDropLogInterval();
    }

    public static class VoiceLive {
        private String endpoint = "";
        private String apiKey = "";
        private String apiVersion = "2025-10-01";
        private String model = "gpt-4o-realtime";
        private String voice = "en-US-AvaMultilingualNeural";
        private Duration connectTimeout = Duration.ofSeconds(10);

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getApiVersion() {
            return apiVersion;
        }

        public void setApiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getVoice() {
            return voice;
        }

        public void setVoice(String voice) {
            this.voice = voice;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    public static class Session {
        private Duration setupTimeout = Duration.ofSeconds(15);
        private Duration functionCallTimeout = Duration.ofSeconds(15);
        private Duration terminationTimeout = Duration.ofSeconds(5);
        private int audioDropLogInterval = 500;
        private int workerThreads = 0;

        public Duration getSetupTimeout() {
            return setupTimeout;
        }

        public void setSetupTimeout(Duration setupTimeout) {
            this.setupTimeout = setupTimeout;
        }

        public Duration getFunctionCallTimeout() {
            return functionCallTimeout;
        }

        public void setFunctionCallTimeout(Duration functionCallTimeout) {
            this.functionCallTimeout = functionCallTimeout;
        }

        public Duration getTerminationTimeout() {
            return terminationTimeout;
        }

        public void setTerminationTimeout(Duration terminationTimeout) {
            this.terminationTimeout = terminationTimeout;
        }

        public int getAudioDropLogInterval() {
            return audioDropLogInterval;
        }

        public void setAudioDropLogInterval(int audioDropLogInterval) {
            this.audioDropLogInterval = audioDropLogInterval;
        }

        // 0이면 제한 없음
        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }
    }
}
