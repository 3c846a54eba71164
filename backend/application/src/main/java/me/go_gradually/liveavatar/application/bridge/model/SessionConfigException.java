package me.go_gradually.liveavatar.application.bridge.model;

public class SessionConfigException extends RuntimeException {
    public SessionConfigException(String message) {
        super(message);
    }

    public SessionConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
