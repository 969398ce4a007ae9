package com.plainer.collab.client;

import com.plainer.collab.client.content.ConflictStrategy;
import com.plainer.collab.client.transport.BackoffPolicy;

import java.net.URI;
import java.time.Duration;

/**
 * Client-side timing, reconnection and conflict handling.
 *
 * @param endpoint WebSocket URL of the room endpoint, for example {@code ws://host:8080/ws/rooms}
 * @param heartbeatTimeoutMultiplier the connection is declared dead after this many heartbeat
 *     intervals without any inbound frame
 * @param cursorIdleTimeout remote cursors older than this are hidden
 * @param conflictWindow how long a local change counts as concurrent with incoming remote changes
 */
public record ClientSettings(
    URI endpoint,
    Duration heartbeatInterval,
    int heartbeatTimeoutMultiplier,
    Duration reconnectInitialDelay,
    Duration reconnectMaxDelay,
    int reconnectMaxAttempts,
    double reconnectJitter,
    Duration handshakeTimeout,
    Duration requestTimeout,
    Duration cursorDebounce,
    Duration cursorIdleTimeout,
    ConflictStrategy conflictStrategy,
    Duration conflictWindow
) {

    public static ClientSettings defaults(URI endpoint) {
        return new ClientSettings(
            endpoint,
            Duration.ofSeconds(30),
            2,
            Duration.ofSeconds(1),
            Duration.ofSeconds(30),
            5,
            0.3,
            Duration.ofSeconds(10),
            Duration.ofSeconds(10),
            Duration.ofMillis(50),
            Duration.ofSeconds(10),
            ConflictStrategy.LAST_WRITE_WINS,
            Duration.ofSeconds(2));
    }

    public BackoffPolicy backoff() {
        return new BackoffPolicy(reconnectInitialDelay, reconnectMaxDelay, reconnectMaxAttempts, reconnectJitter);
    }

    public Duration heartbeatTimeout() {
        return heartbeatInterval.multipliedBy(heartbeatTimeoutMultiplier);
    }

    public ClientSettings withConflictStrategy(ConflictStrategy strategy) {
        return new ClientSettings(endpoint, heartbeatInterval, heartbeatTimeoutMultiplier, reconnectInitialDelay,
            reconnectMaxDelay, reconnectMaxAttempts, reconnectJitter, handshakeTimeout, requestTimeout,
            cursorDebounce, cursorIdleTimeout, strategy, conflictWindow);
    }
}
