package com.plainer.collab.websocket;

import com.plainer.collab.message.JsonCodec;
import com.plainer.collab.room.RoomSettings;
import com.plainer.collab.security.AuthService;
import io.quarkus.websockets.next.CloseReason;
import io.quarkus.websockets.next.OnClose;
import io.quarkus.websockets.next.OnError;
import io.quarkus.websockets.next.OnOpen;
import io.quarkus.websockets.next.OnTextMessage;
import io.quarkus.websockets.next.WebSocket;
import io.quarkus.websockets.next.WebSocketConnection;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * WebSocket endpoint for room collaboration. One connection carries one room membership at a time.
 * With {@code collab.server.auth-required} the upgrade must carry a valid bearer token, and the
 * token's subject replaces whatever identity the client claims in {@code join-room}.
 */
@WebSocket(path = "/ws/rooms")
public class CollaborationSocket {

    private static final Logger LOG = Logger.getLogger(CollaborationSocket.class);

    private static final JsonCodec CODEC = new JsonCodec();

    @Inject
    RoomCommandHandler handler;

    @Inject
    AuthService authService;

    @Inject
    RoomSettings settings;

    @OnOpen
    public void onOpen(WebSocketConnection connection) {
        if (settings.authRequired() && !authService.isAuthenticated()) {
            LOG.warnf("Unauthenticated WebSocket connection attempt: %s", connection.id());
            connection.closeAndAwait(new CloseReason(ConnectionChannel.POLICY_VIOLATION, "Authentication required"));
            return;
        }
        handler.opened(new ConnectionChannel(connection, CODEC));
        LOG.debugf("WebSocket opened: %s", connection.id());
    }

    @OnTextMessage
    public void onMessage(String frame, WebSocketConnection connection) {
        handler.handle(connection.id(), frame);
    }

    @OnClose
    public void onClose(WebSocketConnection connection) {
        LOG.debugf("WebSocket closed: %s", connection.id());
        handler.closed(connection.id());
    }

    @OnError
    public void onError(WebSocketConnection connection, Throwable t) {
        LOG.warnf("WebSocket error on %s: %s", connection.id(), t.getMessage());
        handler.closed(connection.id());
    }
}
