package me.go_gradually.liveavatar.application.bridge.model;

public class FunctionCallException extends RuntimeException {
    public FunctionCallException(String message) {
        super(message);
    }

    public FunctionCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
