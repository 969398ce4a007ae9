package com.plainer.collab.config;

import com.plainer.collab.client.ClientSettings;
import com.plainer.collab.client.content.ConflictStrategy;
import com.plainer.collab.room.RoomSettings;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Binds the {@code collab.server.*} and {@code collab.client.*} keys to the immutable settings
 * records the registry and the client are built from.
 */
@ApplicationScoped
public class CollabConfiguration {

    @ConfigProperty(name = "collab.server.member-grace-period", defaultValue = "PT1H")
    Duration memberGracePeriod;

    @ConfigProperty(name = "collab.server.lock-ttl", defaultValue = "PT2M")
    Duration lockTtl;

    @ConfigProperty(name = "collab.server.heartbeat-timeout", defaultValue = "PT90S")
    Duration serverHeartbeatTimeout;

    @ConfigProperty(name = "collab.server.room-idle-timeout", defaultValue = "PT5M")
    Duration roomIdleTimeout;

    @ConfigProperty(name = "collab.server.invite-ttl", defaultValue = "PT1H")
    Duration inviteTtl;

    @ConfigProperty(name = "collab.server.max-invite-ttl", defaultValue = "P30D")
    Duration maxInviteTtl;

    @ConfigProperty(name = "collab.server.max-protocol-errors", defaultValue = "5")
    int maxProtocolErrors;

    @ConfigProperty(name = "collab.server.auth-required", defaultValue = "false")
    boolean authRequired;

    @ConfigProperty(name = "collab.server.chat-history-limit", defaultValue = "500")
    int chatHistoryLimit;

    @ConfigProperty(name = "collab.server.chat-snapshot-size", defaultValue = "100")
    int chatSnapshotSize;

    @ConfigProperty(name = "collab.client.endpoint", defaultValue = "ws://localhost:8080/ws/rooms")
    URI endpoint;

    @ConfigProperty(name = "collab.client.heartbeat-interval", defaultValue = "PT30S")
    Duration heartbeatInterval;

    @ConfigProperty(name = "collab.client.heartbeat-timeout-multiplier", defaultValue = "2")
    int heartbeatTimeoutMultiplier;

    @ConfigProperty(name = "collab.client.reconnect-initial-delay", defaultValue = "PT1S")
    Duration reconnectInitialDelay;

    @ConfigProperty(name = "collab.client.reconnect-max-delay", defaultValue = "PT30S")
    Duration reconnectMaxDelay;

    @ConfigProperty(name = "collab.client.reconnect-max-attempts", defaultValue = "5")
    int reconnectMaxAttempts;

    @ConfigProperty(name = "collab.client.reconnect-jitter", defaultValue = "0.3")
    double reconnectJitter;

    @ConfigProperty(name = "collab.client.handshake-timeout", defaultValue = "PT10S")
    Duration handshakeTimeout;

    @ConfigProperty(name = "collab.client.request-timeout", defaultValue = "PT10S")
    Duration requestTimeout;

    @ConfigProperty(name = "collab.client.cursor-debounce", defaultValue = "PT0.05S")
    Duration cursorDebounce;

    @ConfigProperty(name = "collab.client.cursor-idle-timeout", defaultValue = "PT10S")
    Duration cursorIdleTimeout;

    @ConfigProperty(name = "collab.client.conflict-strategy", defaultValue = "last-write-wins")
    String conflictStrategy;

    @ConfigProperty(name = "collab.client.conflict-window", defaultValue = "PT2S")
    Duration conflictWindow;

    @Produces
    @Singleton
    public RoomSettings roomSettings() {
        return new RoomSettings(
                memberGracePeriod,
                lockTtl,
                serverHeartbeatTimeout,
                roomIdleTimeout,
                inviteTtl,
                maxInviteTtl,
                maxProtocolErrors,
                authRequired,
                chatHistoryLimit,
                chatSnapshotSize);
    }

    @Produces
    @Singleton
    public ClientSettings clientSettings() {
        return new ClientSettings(
                endpoint,
                heartbeatInterval,
                heartbeatTimeoutMultiplier,
                reconnectInitialDelay,
                reconnectMaxDelay,
                reconnectMaxAttempts,
                reconnectJitter,
                handshakeTimeout,
                requestTimeout,
                cursorDebounce,
                cursorIdleTimeout,
                ConflictStrategy.parse(conflictStrategy),
                conflictWindow);
    }

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }
}
