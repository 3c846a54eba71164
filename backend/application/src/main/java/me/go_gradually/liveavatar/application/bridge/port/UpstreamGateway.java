package me.go_gradually.liveavatar.application.bridge.port;

import me.go_gradually.liveavatar.application.bridge.model.UpstreamConnectCommand;

public interface UpstreamGateway {
    UpstreamConnection connect(UpstreamConnectCommand command);
}
