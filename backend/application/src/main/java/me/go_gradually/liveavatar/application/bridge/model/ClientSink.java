package me.go_gradually.liveavatar.application.bridge.model;

@FunctionalInterface
public interface ClientSink {
    // 클라이언트에 닿지 못하면 false
    boolean send(OutboundMessage message);
}
