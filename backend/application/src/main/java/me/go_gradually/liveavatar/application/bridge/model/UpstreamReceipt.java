package me.go_gradually.liveavatar.application.bridge.model;

public record UpstreamReceipt(Kind kind, ServerEvent event, String detail) {
    public UpstreamReceipt {
        if (kind == null) {
            throw new IllegalArgumentException("Receipt kind is required");
        }
        if (kind == Kind.EVENT && event == null) {
            throw new IllegalArgumentException("Event receipt requires an event");
        }
    }

    public static UpstreamReceipt event(ServerEvent event) {
        return new UpstreamReceipt(Kind.EVENT, event, null);
    }

    public static UpstreamReceipt recoverableError(String detail) {
        return new UpstreamReceipt(Kind.RECOVERABLE_ERROR, null, detail);
    }

    public static UpstreamReceipt closed(String detail) {
        return new UpstreamReceipt(Kind.CLOSED, null, detail);
    }

    public boolean isEvent() {
        return kind == Kind.EVENT;
    }

    public boolean isClosed() {
        return kind == Kind.CLOSED;
    }

    public enum Kind {
        EVENT,
        RECOVERABLE_ERROR,
        CLOSED
    }
}
