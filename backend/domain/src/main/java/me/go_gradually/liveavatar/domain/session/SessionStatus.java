package me.go_gradually.liveavatar.domain.session;

import java.util.EnumSet;
import java.util.Set;

public enum SessionStatus {
    IDLE,
    CONNECTING,
    ACTIVE,
    CLOSING,
    CLOSED;

    public boolean canTransitionTo(SessionStatus next) {
        return allowedNext().contains(next);
    }

    public boolean isTerminal() {
        return this == CLOSING || this == CLOSED;
    }

    private Set<SessionStatus> allowedNext() {
        return switch (this) {
            // 태스크가 실행되기 전에 stop이 들어오면 IDLE에서 바로 CLOSING으로 간다.
            case IDLE -> EnumSet.of(CONNECTING, CLOSING);
            case CONNECTING -> EnumSet.of(ACTIVE, CLOSING);
            case ACTIVE -> EnumSet.of(CLOSING);
            case CLOSING -> EnumSet.of(CLOSED);
            case CLOSED -> EnumSet.noneOf(SessionStatus.class);
        };
    }
}
