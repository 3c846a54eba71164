package me.go_gradually.liveavatar.application.bridge.model;

public record UpstreamCredential(Kind kind, String value) {
    public UpstreamCredential {
        if (kind == null || value == null || value.isBlank()) {
            throw new IllegalArgumentException("Credential is required");
        }
    }

    public static UpstreamCredential apiKey(String value) {
        return new UpstreamCredential(Kind.API_KEY, value);
    }

    public static UpstreamCredential bearerToken(String value) {
        return new UpstreamCredential(Kind.BEARER_TOKEN, value);
    }

    @Override
    public String toString() {
        return "UpstreamCredential{" + kind + "}";
    }

    public enum Kind {
        API_KEY,
        BEARER_TOKEN
    }
}
