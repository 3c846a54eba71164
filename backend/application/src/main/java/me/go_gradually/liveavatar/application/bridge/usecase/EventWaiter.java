package me.go_gradually.liveavatar.application.bridge.usecase;

import me.go_gradually.liveavatar.application.bridge.model.ServerEvent;
import me.go_gradually.liveavatar.application.bridge.model.ServerEventType;

import java.time.Duration;

@FunctionalInterface
public interface EventWaiter {
    // 시간이 먼저 지나면 null
    ServerEvent await(ServerEventType wanted, Duration timeout) throws InterruptedException;
}
