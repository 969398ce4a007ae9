package com.plainer.collab.client.transport;

import static com.plainer.collab.client.transport.ConnectionStatus.CONNECTED;
import static com.plainer.collab.client.transport.ConnectionStatus.CONNECTING;
import static com.plainer.collab.client.transport.ConnectionStatus.DISCONNECTED;
import static com.plainer.collab.client.transport.ConnectionStatus.RECONNECTING;

import java.util.EnumSet;
import java.util.Set;

/**
 * {@code disconnected → connecting → connected → reconnecting → disconnected}, with one typed method
 * per transition. A transition that is not allowed from the current status throws
 * {@link IllegalStateException}. Not thread-safe: driven from the transport's event loop only.
 */
public class ConnectionStateMachine {

    public static final String RETRIES_EXHAUSTED = "Max reconnection attempts reached";

    private volatile ConnectionStatus status = DISCONNECTED;
    private int attempt;

    public ConnectionStatus status() {
        return status;
    }

    public int attempt() {
        return attempt;
    }

    public StatusChange beginConnect() {
        attempt = 0;
        return move(EnumSet.of(DISCONNECTED), CONNECTING, null);
    }

    /** {@code room-joined} received. */
    public StatusChange handshakeAccepted() {
        attempt = 0;
        return move(EnumSet.of(CONNECTING, RECONNECTING), CONNECTED, null);
    }

    /** Transport failed or went silent; the next reconnection attempt is counted. */
    public StatusChange connectionLost(String error) {
        StatusChange change = move(EnumSet.of(CONNECTING, CONNECTED, RECONNECTING), RECONNECTING, error, attempt + 1);
        attempt++;
        return change;
    }

    /** {@code join-rejected}: fatal, never retried. */
    public StatusChange handshakeRejected(String error) {
        return terminate(EnumSet.of(CONNECTING, RECONNECTING), error);
    }

    /** {@code session-ended}: the server removed this connection. */
    public StatusChange sessionEnded(String error) {
        return terminate(EnumSet.of(CONNECTING, CONNECTED, RECONNECTING), error);
    }

    public StatusChange retriesExhausted() {
        return terminate(EnumSet.of(RECONNECTING), RETRIES_EXHAUSTED);
    }

    public StatusChange closeRequested() {
        return terminate(EnumSet.of(CONNECTING, CONNECTED, RECONNECTING), null);
    }

    private StatusChange terminate(Set<ConnectionStatus> from, String error) {
        StatusChange change = move(from, DISCONNECTED, error);
        attempt = 0;
        return change;
    }

    private StatusChange move(Set<ConnectionStatus> from, ConnectionStatus to, String error) {
        return move(from, to, error, attempt);
    }

    private StatusChange move(Set<ConnectionStatus> from, ConnectionStatus to, String error, int attemptNo) {
        ConnectionStatus previous = status;
        if (!from.contains(previous)) {
            throw new IllegalStateException("Cannot move from " + previous + " to " + to);
        }
        status = to;
        return new StatusChange(to, previous, error, attemptNo);
    }
}
