package com.plainer.collab.client.transport;

/**
 * One transition of the connection state machine.
 *
 * @param error human-readable cause, null for transitions that are not failures
 * @param attempt reconnection attempt about to be made, 0 outside of reconnection
 */
public record StatusChange(ConnectionStatus status, ConnectionStatus previous, String error, int attempt) {

    public boolean isTerminal() {
        return status == ConnectionStatus.DISCONNECTED;
    }
}
