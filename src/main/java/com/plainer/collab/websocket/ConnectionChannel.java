package com.plainer.collab.websocket;

import com.plainer.collab.message.JsonCodec;
import com.plainer.collab.message.ServerMessage;
import com.plainer.collab.room.MemberChannel;
import io.quarkus.websockets.next.CloseReason;
import io.quarkus.websockets.next.WebSocketConnection;
import org.jboss.logging.Logger;

/**
 * {@link MemberChannel} over a server-side WebSocket connection. Sends are asynchronous; frames
 * queued on one connection go out in call order.
 */
class ConnectionChannel implements MemberChannel {

    private static final Logger LOG = Logger.getLogger(ConnectionChannel.class);

    static final int POLICY_VIOLATION = 1008;

    private final WebSocketConnection connection;
    private final JsonCodec codec;

    ConnectionChannel(WebSocketConnection connection, JsonCodec codec) {
        this.connection = connection;
        this.codec = codec;
    }

    @Override
    public String connectionId() {
        return connection.id();
    }

    @Override
    public void send(ServerMessage message) {
        if (!connection.isOpen()) {
            return;
        }
        connection.sendText(codec.encode(message)).subscribe().with(
            ignored -> {},
            failure -> LOG.debugf("Send of %s on %s failed: %s", message.type(), connection.id(), failure.getMessage()));
    }

    @Override
    public void close(String reason) {
        if (!connection.isOpen()) {
            return;
        }
        connection.close(new CloseReason(POLICY_VIOLATION, reason)).subscribe().with(
            ignored -> {},
            failure -> LOG.debugf("Close of %s failed: %s", connection.id(), failure.getMessage()));
    }
}
