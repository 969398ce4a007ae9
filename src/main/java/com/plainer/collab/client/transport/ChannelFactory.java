package com.plainer.collab.client.transport;

import java.net.URI;
import java.util.concurrent.CompletionStage;

@FunctionalInterface
public interface ChannelFactory {

    /**
     * Opens a connection to {@code endpoint}. The stage fails when the endpoint cannot be reached.
     *
     * @param bearerToken sent as {@code Authorization: Bearer}, may be null
     */
    CompletionStage<WebSocketChannel> open(URI endpoint, String bearerToken, ChannelListener listener);
}
