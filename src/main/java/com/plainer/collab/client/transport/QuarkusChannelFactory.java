package com.plainer.collab.client.transport;

import io.quarkus.websockets.next.BasicWebSocketConnector;
import io.quarkus.websockets.next.WebSocketClientConnection;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.concurrent.CompletionStage;

/**
 * Opens channels with the websockets-next {@link BasicWebSocketConnector}. Every call uses a fresh
 * connector, so callbacks of an old connection never reach a newer listener.
 */
@ApplicationScoped
public class QuarkusChannelFactory implements ChannelFactory {

    private static final Logger LOG = Logger.getLogger(QuarkusChannelFactory.class);

    @Inject
    Instance<BasicWebSocketConnector> connectors;

    @Override
    public CompletionStage<WebSocketChannel> open(URI endpoint, String bearerToken, ChannelListener listener) {
        BasicWebSocketConnector connector = connectors.get()
            .baseUri(baseUri(endpoint))
            .path(endpoint.getRawPath() != null && !endpoint.getRawPath().isEmpty() ? endpoint.getRawPath() : "/")
            .executionModel(BasicWebSocketConnector.ExecutionModel.NON_BLOCKING)
            .onTextMessage((connection, text) -> listener.onText(text))
            .onClose((connection, reason) -> listener.onClosed(
                reason != null && reason.getMessage() != null ? reason.getMessage() : "Connection closed"))
            .onError((connection, failure) -> {
                LOG.debugf("WebSocket error on %s: %s", endpoint, failure.getMessage());
                listener.onClosed(failure.getMessage());
            });
        if (bearerToken != null) {
            connector.addHeader("Authorization", "Bearer " + bearerToken);
        }
        return connector.connect()
            .map(connection -> (WebSocketChannel) new ClientChannel(connection))
            .subscribeAsCompletionStage();
    }

    // The connector resolves paths against an http(s) base.
    static URI baseUri(URI endpoint) {
        String scheme = switch (endpoint.getScheme()) {
            case "ws" -> "http";
            case "wss" -> "https";
            default -> endpoint.getScheme();
        };
        try {
            return new URI(scheme, null, endpoint.getHost(), endpoint.getPort(), null, null, null);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid endpoint " + endpoint, e);
        }
    }

    private record ClientChannel(WebSocketClientConnection connection) implements WebSocketChannel {

        @Override
        public void send(String text) {
            connection.sendText(text).subscribe().with(
                ignored -> {},
                failure -> LOG.debugf("Send failed: %s", failure.getMessage()));
        }

        @Override
        public void close() {
            if (connection.isOpen()) {
                connection.close().subscribe().with(
                    ignored -> {},
                    failure -> LOG.debugf("Close failed: %s", failure.getMessage()));
            }
        }
    }
}
