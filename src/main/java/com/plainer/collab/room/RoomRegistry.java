package com.plainer.collab.room;

import com.plainer.collab.error.AuthorizationException;
import com.plainer.collab.error.ConflictException;
import com.plainer.collab.error.ProtocolException;
import com.plainer.collab.error.RoomNotFoundException;
import com.plainer.collab.message.ChatMessageView;
import com.plainer.collab.message.ChatPayload;
import com.plainer.collab.message.CommentPayload;
import com.plainer.collab.message.CommentView;
import com.plainer.collab.message.ContentChange;
import com.plainer.collab.message.CursorPosition;
import com.plainer.collab.message.MemberView;
import com.plainer.collab.message.LockView;
import com.plainer.collab.message.RoomSnapshot;
import com.plainer.collab.message.ServerMessage;
import com.plainer.collab.message.UserInfo;
import com.plainer.collab.model.Role;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * All live rooms of this process. Rooms are created on first join (or explicitly through the
 * management API) and unlinked by {@link #sweep()} once empty and idle.
 */
@ApplicationScoped
public class RoomRegistry {

    private static final Logger LOG = Logger.getLogger(RoomRegistry.class);

    private final ConcurrentHashMap<String, Room> rooms = new ConcurrentHashMap<>();
    private final RoomSettings settings;
    private final Clock clock;

    @Inject
    public RoomRegistry(RoomSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public RoomSettings settings() {
        return settings;
    }

    public JoinResult joinRoom(String roomId, UserInfo user, JoinCredentials credentials, MemberChannel channel) {
        if (roomId == null || roomId.isBlank()) {
            throw ProtocolException.invalid("join-room requires a roomId");
        }
        if (user == null || user.id() == null || user.id().isBlank()) {
            throw ProtocolException.invalid("join-room requires a user id");
        }
        JoinCredentials creds = credentials != null ? credentials : JoinCredentials.NONE;
        while (true) {
            Room room = rooms.computeIfAbsent(roomId, id -> {
                LOG.infof("Creating room %s on first join by %s", id, user.id());
                return new Room(id, settings, clock.instant());
            });
            try {
                Optional<JoinResult> result = room.tryJoin(user, creds, channel, clock.instant());
                if (result.isPresent()) {
                    LOG.debugf("User %s joined room %s as %s", user.id(), roomId, result.get().role());
                    return result.get();
                }
            } catch (AuthorizationException e) {
                LOG.debugf("Join of %s to room %s rejected: %s", user.id(), roomId, e.getCode());
                return JoinResult.rejected(e.getCode(), e.getMessage());
            }
            // closed between lookup and join
            rooms.remove(roomId, room);
        }
    }

    /** Explicit leave, regardless of which connection the member is on. */
    public void leaveRoom(String roomId, String userId) {
        leaveRoom(roomId, userId, null);
    }

    public void leaveRoom(String roomId, String userId, String connectionId) {
        Room room = rooms.get(roomId);
        if (room != null && room.leave(userId, connectionId, clock.instant())) {
            LOG.debugf("User %s left room %s", userId, roomId);
        }
    }

    /** Transport-level disconnect. Ignored when the member has since moved to another connection. */
    public void disconnect(String roomId, String userId, String connectionId) {
        Room room = rooms.get(roomId);
        if (room != null && room.disconnect(userId, connectionId, clock.instant())) {
            LOG.debugf("User %s disconnected from room %s", userId, roomId);
        }
    }

    public void touch(String roomId, String userId) {
        Room room = rooms.get(roomId);
        if (room != null) {
            room.touch(userId, clock.instant());
        }
    }

    public void broadcast(String roomId, ServerMessage event, String excludeUserId) {
        require(roomId).broadcast(event, excludeUserId);
    }

    public void requestPresence(String roomId, String userId) {
        require(roomId).sendPresence(userId);
    }

    public void updateCursor(String roomId, String userId, CursorPosition position) {
        require(roomId).updateCursor(userId, position, clock.instant());
    }

    public ContentChange applyContentChange(String roomId, String userId, ContentChange change) {
        return require(roomId).applyContentChange(userId, change, clock.instant());
    }

    public LockResult acquireLock(String roomId, String userId, String resourceId, String requestId) {
        return require(roomId).acquireLock(userId, resourceId, requestId, clock.instant());
    }

    public void releaseLock(String roomId, String userId, String resourceId, String requestId) {
        require(roomId).releaseLock(userId, resourceId, requestId, clock.instant());
    }

    public void changeRole(String roomId, String actorId, String targetUserId, Role role, String requestId) {
        require(roomId).changeRole(actorId, targetUserId, role, requestId, clock.instant());
        LOG.infof("Role of %s in room %s set to %s by %s", targetUserId, roomId, role, actorId);
    }

    public CommentView addComment(String roomId, String userId, CommentPayload payload) {
        return require(roomId).addComment(userId, payload, clock.instant());
    }

    public CommentView updateComment(String roomId, String userId, CommentPayload payload) {
        return require(roomId).updateComment(userId, payload, clock.instant());
    }

    public List<String> deleteComment(String roomId, String userId, CommentPayload payload) {
        return require(roomId).deleteComment(userId, payload, clock.instant());
    }

    public CommentView resolveComment(String roomId, String userId, CommentPayload payload) {
        return require(roomId).resolveComment(userId, payload, clock.instant());
    }

    public ChatMessageView sendChat(String roomId, String userId, ChatPayload payload) {
        return require(roomId).sendChat(userId, payload, clock.instant());
    }

    public ChatMessageView toggleReaction(String roomId, String userId, ChatPayload payload) {
        return require(roomId).toggleReaction(userId, payload, clock.instant());
    }

    /** Whether {@code connectionId} is the connection the member is currently joined through. */
    public boolean isCurrentConnection(String roomId, String userId, String connectionId) {
        Room room = rooms.get(roomId);
        return room != null && room.isCurrentConnection(userId, connectionId);
    }

    // ---- management ----

    public RoomInfo createRoom(String roomId, String ownerId, String password, boolean inviteOnly) {
        String id = roomId == null || roomId.isBlank() ? "room_" + UUID.randomUUID() : roomId;
        Room room = new Room(id, settings, clock.instant());
        room.designateOwner(ownerId);
        room.configureAccess(password, inviteOnly);
        if (rooms.putIfAbsent(id, room) != null) {
            throw new ConflictException(ConflictException.ROOM_EXISTS, "Room already exists: " + id);
        }
        LOG.infof("Room %s created by %s", id, ownerId);
        return room.info();
    }

    public RoomInfo roomInfo(String roomId) {
        return require(roomId).info();
    }

    public RoomSnapshot snapshot(String roomId) {
        return require(roomId).snapshot();
    }

    public Optional<MemberView> member(String roomId, String userId) {
        Room room = rooms.get(roomId);
        return room != null ? room.member(userId) : Optional.empty();
    }

    public Optional<LockView> lock(String roomId, String resourceId) {
        Room room = rooms.get(roomId);
        return room != null ? room.lock(resourceId) : Optional.empty();
    }

    public List<RoomInfo> listRooms() {
        return rooms.values().stream()
            .map(Room::info)
            .sorted(Comparator.comparing(RoomInfo::createdAt))
            .toList();
    }

    public void setPassword(String roomId, String actorId, String password) {
        require(roomId).setPassword(actorId, password);
        LOG.infof("Password of room %s %s by %s", roomId,
            password == null || password.isBlank() ? "removed" : "set", actorId);
    }

    public void setInviteOnly(String roomId, String actorId, boolean enabled) {
        require(roomId).setInviteOnly(actorId, enabled);
    }

    public RoomInvite issueInvite(String roomId, String actorId, Role role, Duration requestedTtl) {
        RoomInvite invite = require(roomId).issueInvite(actorId, role, settings.clampInviteTtl(requestedTtl), clock.instant());
        LOG.debugf("Invite for room %s issued by %s with role %s until %s", roomId, actorId, invite.role(), invite.expiresAt());
        return invite;
    }

    public boolean revokeInvite(String roomId, String actorId, String token) {
        return require(roomId).revokeInvite(actorId, token);
    }

    public void kick(String roomId, String actorId, String targetUserId) {
        require(roomId).kick(actorId, targetUserId, clock.instant());
        LOG.infof("User %s removed from room %s by %s", targetUserId, roomId, actorId);
    }

    public void deleteRoom(String roomId, String actorId) {
        Room room = require(roomId);
        room.close(actorId);
        rooms.remove(roomId, room);
        LOG.infof("Room %s deleted by %s", roomId, actorId);
    }

    // ---- garbage collection ----

    public SweepResult sweep() {
        Instant now = clock.instant();
        SweepResult total = SweepResult.EMPTY;
        for (Room room : rooms.values()) {
            SweepResult result = room.sweep(now);
            if (room.isClosed()) {
                rooms.remove(room.id(), room);
                LOG.debugf("Room %s removed after being idle", room.id());
            }
            total = total.plus(result);
        }
        return total;
    }

    public int roomCount() {
        return rooms.size();
    }

    private Room require(String roomId) {
        Room room = roomId != null ? rooms.get(roomId) : null;
        if (room == null) {
            throw new RoomNotFoundException(roomId);
        }
        return room;
    }
}
