package me.go_gradually.liveavatar.application.bridge.usecase;

import me.go_gradually.liveavatar.application.bridge.model.ClientSink;
import me.go_gradually.liveavatar.application.bridge.model.OutboundMessage;
import me.go_gradually.liveavatar.application.bridge.model.ServerEvent;
import me.go_gradually.liveavatar.application.bridge.model.ServerEventType;
import me.go_gradually.liveavatar.application.bridge.model.SessionSetupTimeoutException;
import me.go_gradually.liveavatar.application.bridge.model.SessionUpdate;
import me.go_gradually.liveavatar.application.bridge.policy.BridgePolicy;
import me.go_gradually.liveavatar.application.bridge.port.UpstreamConnection;
import me.go_gradually.liveavatar.domain.session.ClientId;
import me.go_gradually.liveavatar.domain.session.GreetingPolicy;
import me.go_gradually.liveavatar.domain.session.SessionConfig;

import java.time.Duration;
import java.util.logging.Logger;

public class SessionSetup {
    private static final Logger log = Logger.getLogger(SessionSetup.class.getName());

    private final BridgePolicy policy;

    public SessionSetup(BridgePolicy policy) {
        this.policy = policy;
    }

    public GreetingPolicy perform(ClientId clientId,
                                  SessionConfig config,
                                  UpstreamConnection connection,
                                  EventWaiter waiter,
                                  ClientSink sink) throws InterruptedException {
        connection.updateSession(SessionUpdate.full(config));
        log.info(() -> "bridge.setup.sent clientId=" + clientId + " mode=" + config.mode().code()
                + " model=" + config.sessionModel() + " avatar=" + config.avatarEnabled());

        Duration timeout = policy.setupTimeout();
        ServerEvent acknowledgement = waiter.await(ServerEventType.SESSION_UPDATED, timeout);
        if (acknowledgement == null) {
            throw new SessionSetupTimeoutException("session.updated not received within " + timeout.toMillis() + "ms");
        }
        ServerEvent.SessionUpdated updated = (ServerEvent.SessionUpdated) acknowledgement;

        if (config.avatarEnabled() && config.avatarOutputMode().isPeerToPeer()) {
            if (updated.iceServers().isEmpty()) {
                log.warning("bridge.setup.no_ice_servers clientId=" + clientId);
            } else {
                sink.send(OutboundMessage.iceServers(updated.iceServers()));
            }
        }

        sink.send(OutboundMessage.sessionStarted(
                updated.sessionId(),
                config.model(),
                config.avatarEnabled(),
                config.avatarOutputMode().code()
        ));
        log.info(() -> "bridge.setup.completed clientId=" + clientId + " sessionId=" + updated.sessionId());
        return GreetingPolicy.resolve(config);
    }
}
