package me.go_gradually.liveavatar.application.bridge.model;

public class SessionSetupTimeoutException extends RuntimeException {
    public SessionSetupTimeoutException(String message) {
        super(message);
    }

    public SessionSetupTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
