package com.plainer.collab.websocket;

import com.plainer.collab.error.CollaborationException;
import com.plainer.collab.error.ConflictException;
import com.plainer.collab.error.ProtocolException;
import com.plainer.collab.message.ClientMessage;
import com.plainer.collab.message.JsonCodec;
import com.plainer.collab.message.MessageTypes;
import com.plainer.collab.message.ServerMessage;
import com.plainer.collab.message.UserInfo;
import com.plainer.collab.room.JoinCredentials;
import com.plainer.collab.room.JoinResult;
import com.plainer.collab.room.MemberChannel;
import com.plainer.collab.room.RoomRegistry;
import com.plainer.collab.security.AuthService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decodes client frames and turns them into registry calls. Frames of one connection arrive
 * serially, so the per-connection state below is only read and written by one thread at a time.
 */
@ApplicationScoped
public class RoomCommandHandler {

    private static final Logger LOG = Logger.getLogger(RoomCommandHandler.class);

    static final String INTERNAL_ERROR = "internal_error";

    private final RoomRegistry registry;
    private final AuthService authService;
    private final JsonCodec codec = new JsonCodec();

    private final Map<String, ConnectionState> connections = new ConcurrentHashMap<>();

    static final class ConnectionState {
        final MemberChannel channel;
        String userId;
        String roomId;
        int protocolErrors;

        ConnectionState(MemberChannel channel) {
            this.channel = channel;
        }

        boolean joined() {
            return roomId != null;
        }
    }

    @Inject
    public RoomCommandHandler(RoomRegistry registry, AuthService authService) {
        this.registry = registry;
        this.authService = authService;
    }

    public void opened(MemberChannel channel) {
        connections.put(channel.connectionId(), new ConnectionState(channel));
    }

    public void handle(String connectionId, String frame) {
        ConnectionState state = connections.get(connectionId);
        if (state == null) {
            LOG.debugf("Frame on unknown connection %s dropped", connectionId);
            return;
        }
        ClientMessage msg = null;
        try {
            msg = codec.decodeClient(frame);
            if (msg.type() == null) {
                throw new ProtocolException(ProtocolException.MALFORMED, "Frame has no type");
            }
            if (state.joined()) {
                registry.touch(state.roomId, state.userId);
            }
            dispatch(state, msg);
            state.protocolErrors = 0;
        } catch (ProtocolException e) {
            state.protocolErrors++;
            LOG.debugf("Protocol error %d on %s: %s", state.protocolErrors, connectionId, e.getMessage());
            reply(state, msg, e);
            if (state.protocolErrors >= registry.settings().maxProtocolErrors()) {
                LOG.warnf("Closing %s after %d protocol errors", connectionId, state.protocolErrors);
                state.channel.close("Too many protocol errors");
            }
        } catch (CollaborationException e) {
            LOG.debugf("Command %s from %s failed: %s", msg.type(), state.userId, e.getCode());
            reply(state, msg, e);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected failure handling %s on %s", msg != null ? msg.type() : "frame", connectionId);
            state.channel.send(ServerMessage.error(msg != null ? msg.requestId() : null, INTERNAL_ERROR, "Internal error"));
        }
    }

    public void closed(String connectionId) {
        ConnectionState state = connections.remove(connectionId);
        if (state != null && state.joined()) {
            registry.disconnect(state.roomId, state.userId, connectionId);
        }
    }

    int connectionCount() {
        return connections.size();
    }

    private void dispatch(ConnectionState state, ClientMessage msg) {
        switch (msg.type()) {
            case MessageTypes.PING -> state.channel.send(ServerMessage.pong(
                msg.timestamp() != null ? msg.timestamp() : System.currentTimeMillis()));
            case MessageTypes.JOIN_ROOM -> handleJoin(state, msg);
            case MessageTypes.LEAVE_ROOM -> handleLeave(state, msg);
            case MessageTypes.CURSOR_UPDATE -> registry.updateCursor(joinedRoom(state, msg), state.userId, msg.cursor());
            case MessageTypes.CONTENT_CHANGE -> registry.applyContentChange(joinedRoom(state, msg), state.userId, msg.change());
            case MessageTypes.LOCK_ACQUIRE ->
                registry.acquireLock(joinedRoom(state, msg), state.userId, msg.resourceId(), msg.requestId());
            case MessageTypes.LOCK_RELEASE ->
                registry.releaseLock(joinedRoom(state, msg), state.userId, msg.resourceId(), msg.requestId());
            case MessageTypes.ROLE_CHANGE ->
                registry.changeRole(joinedRoom(state, msg), state.userId, msg.targetUserId(), msg.role(), msg.requestId());
            case MessageTypes.COMMENT_ADD -> registry.addComment(joinedRoom(state, msg), state.userId, msg.comment());
            case MessageTypes.COMMENT_UPDATE -> registry.updateComment(joinedRoom(state, msg), state.userId, msg.comment());
            case MessageTypes.COMMENT_DELETE -> registry.deleteComment(joinedRoom(state, msg), state.userId, msg.comment());
            case MessageTypes.COMMENT_RESOLVE -> registry.resolveComment(joinedRoom(state, msg), state.userId, msg.comment());
            case MessageTypes.REQUEST_PRESENCE -> registry.requestPresence(joinedRoom(state, msg), state.userId);
            case MessageTypes.CHAT_SEND -> registry.sendChat(joinedRoom(state, msg), state.userId, msg.chat());
            case MessageTypes.CHAT_REACTION -> registry.toggleReaction(joinedRoom(state, msg), state.userId, msg.chat());
            default -> throw new ProtocolException(ProtocolException.UNKNOWN_TYPE, "Unknown message type: " + msg.type());
        }
    }

    private void handleJoin(ConnectionState state, ClientMessage msg) {
        UserInfo user = authService.resolve(msg.user());
        if (state.joined() && !(state.roomId.equals(msg.roomId()) && user != null && state.userId.equals(user.id()))) {
            registry.leaveRoom(state.roomId, state.userId, state.channel.connectionId());
            state.roomId = null;
            state.userId = null;
        }
        JoinCredentials credentials = new JoinCredentials(msg.password(), msg.inviteToken(), msg.resumeToken(),
            authService.isAuthenticated());
        JoinResult result = registry.joinRoom(msg.roomId(), user, credentials, state.channel);
        if (!result.accepted()) {
            state.channel.send(ServerMessage.joinRejected(msg.roomId(), result.code(), result.reason()));
            return;
        }
        state.roomId = msg.roomId();
        state.userId = user.id();
        LOG.infof("User %s joined room %s as %s", state.userId, state.roomId, result.role());
    }

    private void handleLeave(ConnectionState state, ClientMessage msg) {
        if (!state.joined()) {
            return;
        }
        if (msg.roomId() != null && !msg.roomId().equals(state.roomId)) {
            throw new ConflictException(ConflictException.NOT_JOINED, "Not joined to room " + msg.roomId());
        }
        String roomId = state.roomId;
        // no-op in the registry when a newer connection has taken over
        registry.leaveRoom(roomId, state.userId, state.channel.connectionId());
        LOG.infof("User %s left room %s", state.userId, roomId);
        state.roomId = null;
        state.userId = null;
    }

    private String joinedRoom(ConnectionState state, ClientMessage msg) {
        if (!state.joined() || (msg.roomId() != null && !msg.roomId().equals(state.roomId))) {
            throw new ConflictException(ConflictException.NOT_JOINED, "Not joined to room " + msg.roomId());
        }
        if (!registry.isCurrentConnection(state.roomId, state.userId, state.channel.connectionId())) {
            LOG.debugf("Connection %s no longer carries %s in room %s", state.channel.connectionId(), state.userId, state.roomId);
            String roomId = state.roomId;
            state.roomId = null;
            state.userId = null;
            throw new ConflictException(ConflictException.NOT_JOINED, "Not joined to room " + roomId);
        }
        return state.roomId;
    }

    private static void reply(ConnectionState state, ClientMessage msg, CollaborationException e) {
        state.channel.send(ServerMessage.error(msg != null ? msg.requestId() : null, e.getCode(), e.getMessage()));
    }
}
