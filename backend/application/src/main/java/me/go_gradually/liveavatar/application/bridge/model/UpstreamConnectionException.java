package me.go_gradually.liveavatar.application.bridge.model;

public class UpstreamConnectionException extends RuntimeException {
    public UpstreamConnectionException(String message) {
        super(message);
    }

    public UpstreamConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
