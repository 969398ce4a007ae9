package com.plainer.collab.client.transport;

/** An open client connection. Both methods return without waiting for the network. */
public interface WebSocketChannel {

    void send(String text);

    void close();
}
