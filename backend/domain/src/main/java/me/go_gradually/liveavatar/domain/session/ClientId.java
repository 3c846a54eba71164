package me.go_gradually.liveavatar.domain.session;

public record ClientId(String value) {
    public ClientId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ClientId is required");
        }
    }

    public static ClientId of(String value) {
        return new ClientId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
