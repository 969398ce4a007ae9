package com.plainer.collab.client.transport;

public enum ConnectionStatus {
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    RECONNECTING
}
