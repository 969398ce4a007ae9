package com.plainer.collab.room;

import com.plainer.collab.error.AuthorizationException;
import com.plainer.collab.error.ConflictException;
import com.plainer.collab.error.ProtocolException;
import com.plainer.collab.message.ChatMessageView;
import com.plainer.collab.message.ChatPayload;
import com.plainer.collab.message.CommentPayload;
import com.plainer.collab.message.CommentView;
import com.plainer.collab.message.ContentChange;
import com.plainer.collab.message.CursorPosition;
import com.plainer.collab.message.LockView;
import com.plainer.collab.message.MemberView;
import com.plainer.collab.message.RoomSnapshot;
import com.plainer.collab.message.ServerMessage;
import com.plainer.collab.message.UserInfo;
import com.plainer.collab.model.Role;
import com.plainer.collab.model.UserColors;
import com.plainer.collab.security.CredentialHasher;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * One collaboration session. Every public method runs under the room's monitor, so join, leave,
 * lock, role and comment mutations on the same room are atomic with respect to each other, and
 * broadcasts go out in the order the mutations happened.
 */
public class Room {

    private static final Logger LOG = Logger.getLogger(Room.class);

    public static final String ENDED_REPLACED = "replaced";
    public static final String ENDED_KICKED = "kicked";
    public static final String ENDED_ROOM_DELETED = "room_deleted";

    static final int MAX_CHAT_LENGTH = 2000;
    static final int MAX_EMOJI_LENGTH = 8;

    private final String id;
    private final RoomSettings settings;
    private final Instant createdAt;

    private final Map<String, Member> members = new LinkedHashMap<>();
    private final Map<String, LockView> locks = new LinkedHashMap<>();
    private final Map<String, CommentView> comments = new LinkedHashMap<>();
    private final Map<String, RoomInvite> invites = new HashMap<>();
    private final LinkedHashMap<String, ChatMessageView> chat = new LinkedHashMap<>();

    private String creatorId;
    private boolean designatedOwner;
    private String passwordHash;
    private boolean inviteOnly;
    private Instant lastActivity;
    private boolean closed;

    public Room(String id, RoomSettings settings, Instant now) {
        this.id = id;
        this.settings = settings;
        this.createdAt = now;
        this.lastActivity = now;
    }

    public String id() {
        return id;
    }

    synchronized void designateOwner(String ownerId) {
        this.creatorId = ownerId;
        this.designatedOwner = ownerId != null;
    }

    synchronized void configureAccess(String password, boolean requireInvite) {
        this.passwordHash = password == null || password.isBlank() ? null : CredentialHasher.hash(password);
        this.inviteOnly = requireInvite;
    }

    // ---- membership ----

    /**
     * Admits or re-admits a member. Empty when the room was closed by a concurrent sweep or delete;
     * the caller then retries against a fresh room.
     */
    synchronized Optional<JoinResult> tryJoin(UserInfo user, JoinCredentials credentials, MemberChannel channel, Instant now) {
        if (closed) {
            return Optional.empty();
        }
        Member member = members.get(user.id());
        Role role = admit(member, user.id(), credentials, channel.connectionId(), now);
        MemberChannel previous = null;
        if (member == null) {
            String name = user.name() != null && !user.name().isBlank() ? user.name() : user.id();
            member = new Member(user.id(), name, UserColors.colorFor(user.id()), role);
            members.put(member.id(), member);
        } else {
            previous = member.channel();
        }
        member.connect(user.name(), channel, now);
        lastActivity = now;

        if (previous != null && !previous.connectionId().equals(channel.connectionId())) {
            previous.send(ServerMessage.sessionEnded(id, ENDED_REPLACED, "Signed in from another connection"));
            previous.close("Replaced by connection " + channel.connectionId());
        }

        RoomSnapshot snapshot = snapshot();
        channel.send(ServerMessage.roomJoined(id, member.role(), snapshot, member.resumeToken()));
        broadcast(ServerMessage.presenceJoined(id, member.toView()), member.id());
        return Optional.of(JoinResult.accepted(member.role(), snapshot, member.resumeToken()));
    }

    /**
     * Identity, then password, then invite, then role. A known user id is only taken over from its own
     * connection, with that member's resume token or with a verified identity. A resume token or a
     * valid invite also satisfies the password.
     */
    private Role admit(Member known, String userId, JoinCredentials credentials, String connectionId, Instant now) {
        boolean resumed = known != null
            && (known.isCurrentConnection(connectionId) || known.canResumeWith(credentials.resumeToken()));
        if (known != null && !resumed && !credentials.verified()) {
            throw new AuthorizationException(AuthorizationException.IDENTITY_UNVERIFIED,
                "User " + userId + " is already a member of this room");
        }
        if (resumed) {
            return known.role();
        }
        RoomInvite invite = null;
        if (credentials.hasInvite()) {
            RoomInvite candidate = invites.get(credentials.inviteToken());
            if (candidate != null && !candidate.isExpired(now)) {
                invite = candidate;
            }
        }
        if (passwordHash != null && invite == null) {
            if (!credentials.hasPassword()) {
                throw new AuthorizationException(AuthorizationException.PASSWORD_REQUIRED, "Room is password protected");
            }
            if (!CredentialHasher.matches(credentials.password(), passwordHash)) {
                throw new AuthorizationException(AuthorizationException.INVALID_PASSWORD, "Incorrect room password");
            }
        }
        boolean designated = designatedOwner && userId.equals(creatorId);
        boolean vouched = credentials.verified() && (known != null || designated);
        if (inviteOnly && invite == null && !vouched) {
            throw credentials.hasInvite()
                ? new AuthorizationException(AuthorizationException.INVALID_INVITE, "Invite is invalid or expired")
                : new AuthorizationException(AuthorizationException.INVITE_REQUIRED, "Room requires an invite");
        }
        if (known != null) {
            return known.role();
        }
        if (invite != null) {
            invites.remove(invite.token());
        }
        if (designated) {
            return Role.OWNER;
        }
        if (!designatedOwner && members.isEmpty()) {
            creatorId = userId;
            return Role.OWNER;
        }
        return invite != null ? invite.role() : Role.EDITOR;
    }

    /** Transport went away. Locks survive so a quick reconnect finds them unchanged. */
    synchronized boolean disconnect(String userId, String connectionId, Instant now) {
        Member member = members.get(userId);
        if (member == null || !member.isOnline() || !member.isCurrentConnection(connectionId)) {
            return false;
        }
        member.goOffline(now);
        broadcast(ServerMessage.presenceLeft(id, userId), userId);
        return true;
    }

    /** Explicit leave: same as a disconnect, plus the member's locks are released. */
    synchronized boolean leave(String userId, String connectionId, Instant now) {
        Member member = members.get(userId);
        if (member == null || !member.isOnline()) {
            return false;
        }
        if (connectionId != null && !member.isCurrentConnection(connectionId)) {
            return false;
        }
        member.goOffline(now);
        releaseLocksOf(userId);
        broadcast(ServerMessage.presenceLeft(id, userId), userId);
        return true;
    }

    synchronized void touch(String userId, Instant now) {
        Member member = members.get(userId);
        if (member != null && member.isOnline()) {
            member.touch(now);
        }
    }

    synchronized void sendPresence(String userId) {
        Member member = requireOnline(userId);
        member.channel().send(ServerMessage.presenceUpdated(id, memberViews()));
    }

    // ---- cursors and content ----

    synchronized void updateCursor(String userId, CursorPosition position, Instant now) {
        Member member = requireOnline(userId);
        if (position == null) {
            throw ProtocolException.invalid("cursor-update requires a cursor");
        }
        member.cursor(position.isOutside() ? null : position);
        member.touch(now);
        broadcast(ServerMessage.cursor(id, userId, position), userId);
    }

    synchronized ContentChange applyContentChange(String userId, ContentChange change, Instant now) {
        requireEditor(userId, "edit content");
        if (change == null || change.type() == null || change.elementId() == null || change.elementId().isBlank()) {
            throw ProtocolException.invalid("content-change requires elementId and type");
        }
        LockView lock = locks.get(change.elementId());
        if (lock != null && !lock.ownerId().equals(userId) && !lock.isExpired(now)) {
            throw new ConflictException(ConflictException.LOCKED,
                change.elementId() + " is locked by " + lock.ownerName());
        }
        ContentChange stamped = change.withAuthor(userId, change.timestamp() != null ? change.timestamp() : now);
        lastActivity = now;
        broadcast(ServerMessage.contentChange(id, stamped), userId);
        return stamped;
    }

    // ---- locks ----

    synchronized LockResult acquireLock(String userId, String resourceId, String requestId, Instant now) {
        Member member = requireEditor(userId, "acquire locks");
        requireResource(resourceId);
        LockView existing = locks.get(resourceId);
        if (existing != null && !existing.ownerId().equals(userId) && !existing.isExpired(now)) {
            member.channel().send(ServerMessage.lockDenied(requestId, id, existing));
            return LockResult.denied(existing);
        }
        boolean refresh = existing != null && existing.ownerId().equals(userId) && !existing.isExpired(now);
        LockView lock = new LockView(resourceId, userId, member.name(),
            refresh ? existing.acquiredAt() : now, now.plus(settings.lockTtl()));
        locks.put(resourceId, lock);
        lastActivity = now;
        broadcast(ServerMessage.lockGranted(requestId, id, lock), null);
        return LockResult.granted(lock);
    }

    synchronized void releaseLock(String userId, String resourceId, String requestId, Instant now) {
        Member member = requireEditor(userId, "release locks");
        requireResource(resourceId);
        LockView existing = locks.get(resourceId);
        if (existing == null || existing.isExpired(now)) {
            throw new ConflictException(ConflictException.LOCK_NOT_HELD, "No lock held on " + resourceId);
        }
        if (!existing.ownerId().equals(userId) && member.role() != Role.OWNER) {
            throw new ConflictException(ConflictException.LOCK_NOT_OWNED,
                resourceId + " is locked by " + existing.ownerName());
        }
        locks.remove(resourceId);
        lastActivity = now;
        broadcast(ServerMessage.lockReleased(requestId, id, resourceId), null);
    }

    private int releaseLocksOf(String userId) {
        List<String> owned = new ArrayList<>();
        locks.forEach((resourceId, lock) -> {
            if (lock.ownerId().equals(userId)) owned.add(resourceId);
        });
        for (String resourceId : owned) {
            locks.remove(resourceId);
            broadcast(ServerMessage.lockReleased(null, id, resourceId), null);
        }
        return owned.size();
    }

    // ---- roles ----

    synchronized void changeRole(String actorId, String targetUserId, Role role, String requestId, Instant now) {
        Member actor = requireOnline(actorId);
        if (actor.role() != Role.OWNER) {
            throw AuthorizationException.ownerRequired("change roles");
        }
        if (role == null || targetUserId == null) {
            throw ProtocolException.invalid("role-change requires targetUserId and role");
        }
        if (actorId.equals(targetUserId)) {
            throw new ConflictException(ConflictException.SELF_TARGET, "Owners cannot change their own role");
        }
        Member target = members.get(targetUserId);
        if (target == null) {
            throw new ConflictException(ConflictException.MEMBER_NOT_FOUND, "No member " + targetUserId);
        }
        target.role(role);
        if (!role.canEdit()) {
            releaseLocksOf(targetUserId);
        }
        lastActivity = now;
        broadcast(ServerMessage.roleChanged(requestId, id, targetUserId, role), null);
        broadcast(ServerMessage.presenceUpdated(id, memberViews()), null);
    }

    // ---- comments ----

    synchronized CommentView addComment(String userId, CommentPayload payload, Instant now) {
        Member author = requireEditor(userId, "comment");
        if (payload == null || payload.stepId() == null || payload.stepId().isBlank() || payload.content() == null) {
            throw ProtocolException.invalid("comment-add requires stepId and content");
        }
        if (payload.parentId() != null && !comments.containsKey(payload.parentId())) {
            throw new ConflictException(ConflictException.COMMENT_NOT_FOUND, "No comment " + payload.parentId());
        }
        CommentView comment = new CommentView(
            "c_" + UUID.randomUUID(),
            payload.stepId(),
            payload.parentId(),
            userId,
            author.name(),
            payload.content(),
            payload.mentions() != null ? List.copyOf(payload.mentions()) : List.of(),
            false,
            now,
            now);
        comments.put(comment.id(), comment);
        lastActivity = now;
        broadcast(ServerMessage.commentAdded(id, comment), null);
        return comment;
    }

    synchronized CommentView updateComment(String userId, CommentPayload payload, Instant now) {
        requireEditor(userId, "comment");
        CommentView existing = requireComment(payload);
        if (!existing.authorId().equals(userId)) {
            throw AuthorizationException.forbidden("Only the author can edit a comment");
        }
        if (payload.content() == null) {
            throw ProtocolException.invalid("comment-update requires content");
        }
        CommentView updated = existing.edited(payload.content(), payload.mentions(), now);
        comments.put(updated.id(), updated);
        lastActivity = now;
        broadcast(ServerMessage.commentUpdated(id, updated), null);
        return updated;
    }

    synchronized List<String> deleteComment(String userId, CommentPayload payload, Instant now) {
        Member member = requireEditor(userId, "comment");
        CommentView existing = requireComment(payload);
        if (!existing.authorId().equals(userId) && member.role() != Role.OWNER) {
            throw AuthorizationException.forbidden("Only the author or an owner can delete a comment");
        }
        List<String> removed = new ArrayList<>();
        collectThread(existing.id(), removed);
        for (String commentId : removed) {
            CommentView gone = comments.remove(commentId);
            broadcast(ServerMessage.commentDeleted(id, commentId, gone.stepId()), null);
        }
        lastActivity = now;
        return removed;
    }

    private void collectThread(String rootId, List<String> out) {
        out.add(rootId);
        for (CommentView candidate : comments.values()) {
            if (rootId.equals(candidate.parentId())) {
                collectThread(candidate.id(), out);
            }
        }
    }

    synchronized CommentView resolveComment(String userId, CommentPayload payload, Instant now) {
        requireEditor(userId, "resolve comments");
        CommentView existing = requireComment(payload);
        boolean resolved = payload.resolved() == null || payload.resolved();
        CommentView updated = existing.withResolved(resolved, now);
        comments.put(updated.id(), updated);
        lastActivity = now;
        broadcast(ServerMessage.commentResolved(id, updated.id(), updated.stepId(), resolved), null);
        return updated;
    }

    private CommentView requireComment(CommentPayload payload) {
        if (payload == null || payload.id() == null) {
            throw ProtocolException.invalid("comment command requires an id");
        }
        CommentView existing = comments.get(payload.id());
        if (existing == null) {
            throw new ConflictException(ConflictException.COMMENT_NOT_FOUND, "No comment " + payload.id());
        }
        return existing;
    }

    // ---- chat ----

    synchronized ChatMessageView sendChat(String userId, ChatPayload payload, Instant now) {
        Member author = requireOnline(userId);
        if (payload == null || payload.content() == null || payload.content().isBlank()) {
            throw ProtocolException.invalid("chat-send requires content");
        }
        ChatMessageView message = new ChatMessageView("m_" + UUID.randomUUID(), userId, author.name(),
            author.color(), truncate(payload.content(), MAX_CHAT_LENGTH), now, Map.of());
        chat.put(message.id(), message);
        Iterator<String> oldest = chat.keySet().iterator();
        while (chat.size() > settings.chatHistoryLimit()) {
            oldest.next();
            oldest.remove();
        }
        lastActivity = now;
        broadcast(ServerMessage.chatMessage(id, message), null);
        return message;
    }

    synchronized ChatMessageView toggleReaction(String userId, ChatPayload payload, Instant now) {
        requireOnline(userId);
        if (payload == null || payload.messageId() == null || payload.emoji() == null || payload.emoji().isBlank()) {
            throw ProtocolException.invalid("chat-reaction requires messageId and emoji");
        }
        ChatMessageView existing = chat.get(payload.messageId());
        if (existing == null) {
            throw new ConflictException(ConflictException.MESSAGE_NOT_FOUND, "No chat message " + payload.messageId());
        }
        String emoji = truncate(payload.emoji().strip(), MAX_EMOJI_LENGTH);
        ChatMessageView updated = existing.withReactionToggled(emoji, userId);
        chat.put(updated.id(), updated);
        lastActivity = now;
        broadcast(ServerMessage.chatReaction(id, updated, emoji, userId), null);
        return updated;
    }

    private static String truncate(String value, int maxCodePoints) {
        if (value.codePointCount(0, value.length()) <= maxCodePoints) {
            return value;
        }
        return value.substring(0, value.offsetByCodePoints(0, maxCodePoints));
    }

    // ---- management ----

    synchronized void setPassword(String actorId, String password) {
        requireManager(actorId, "set the room password");
        passwordHash = password == null || password.isBlank() ? null : CredentialHasher.hash(password);
    }

    synchronized void setInviteOnly(String actorId, boolean enabled) {
        requireManager(actorId, "change invite requirements");
        inviteOnly = enabled;
    }

    synchronized RoomInvite issueInvite(String actorId, Role role, Duration ttl, Instant now) {
        requireManager(actorId, "issue invites");
        RoomInvite invite = new RoomInvite(CredentialHasher.newToken(), id,
            role != null ? role : Role.VIEWER, now.plus(ttl));
        invites.put(invite.token(), invite);
        return invite;
    }

    synchronized boolean revokeInvite(String actorId, String token) {
        requireManager(actorId, "revoke invites");
        return invites.remove(token) != null;
    }

    synchronized void kick(String actorId, String targetUserId, Instant now) {
        requireManager(actorId, "remove members");
        if (actorId.equals(targetUserId)) {
            throw new ConflictException(ConflictException.SELF_TARGET, "Owners cannot remove themselves");
        }
        Member target = members.remove(targetUserId);
        if (target == null) {
            throw new ConflictException(ConflictException.MEMBER_NOT_FOUND, "No member " + targetUserId);
        }
        if (target.channel() != null) {
            target.channel().send(ServerMessage.sessionEnded(id, ENDED_KICKED, "You have been removed from the room"));
        }
        releaseLocksOf(targetUserId);
        lastActivity = now;
        broadcast(ServerMessage.presenceLeft(id, targetUserId), null);
    }

    synchronized void close(String actorId) {
        requireManager(actorId, "delete the room");
        closed = true;
        broadcast(ServerMessage.sessionEnded(id, ENDED_ROOM_DELETED, "Room has been deleted"), null);
        members.clear();
        locks.clear();
    }

    synchronized RoomInfo info() {
        int online = (int) members.values().stream().filter(Member::isOnline).count();
        return new RoomInfo(id, members.size(), online, passwordHash != null, inviteOnly, createdAt, lastActivity);
    }

    synchronized boolean isClosed() {
        return closed;
    }

    // ---- sweep ----

    /**
     * Ages out soft state: silent members go offline, offline members past the grace period are
     * purged with their locks, expired locks and invites are dropped. Closes the room when it has
     * been empty for the idle timeout; the registry then unlinks it.
     */
    synchronized SweepResult sweep(Instant now) {
        if (closed) {
            return new SweepResult(0, 0, 0, 1);
        }
        int markedOffline = 0;
        int purged = 0;
        int expiredLocks = 0;

        for (Member member : List.copyOf(members.values())) {
            if (member.isOnline() && isOlderThan(member.lastSeen(), settings.heartbeatTimeout(), now)) {
                MemberChannel dead = member.channel();
                member.goOffline(member.lastSeen());
                markedOffline++;
                LOG.debugf("Member %s in room %s missed heartbeats, marking offline", member.id(), id);
                broadcast(ServerMessage.presenceLeft(id, member.id()), member.id());
                if (dead != null) {
                    dead.close("Heartbeat timeout");
                }
            }
            if (!member.isOnline() && isOlderThan(member.lastSeen(), settings.memberGracePeriod(), now)) {
                members.remove(member.id());
                expiredLocks += releaseLocksOf(member.id());
                purged++;
            }
        }

        List<String> expired = new ArrayList<>();
        locks.forEach((resourceId, lock) -> {
            if (lock.isExpired(now)) expired.add(resourceId);
        });
        for (String resourceId : expired) {
            locks.remove(resourceId);
            broadcast(ServerMessage.lockReleased(null, id, resourceId), null);
        }
        expiredLocks += expired.size();

        invites.values().removeIf(invite -> invite.isExpired(now));

        boolean idle = members.isEmpty() && isOlderThan(lastActivity, settings.roomIdleTimeout(), now);
        if (idle) {
            closed = true;
        }
        return new SweepResult(markedOffline, purged, expiredLocks, idle ? 1 : 0);
    }

    private static boolean isOlderThan(Instant at, Duration age, Instant now) {
        return !at.plus(age).isAfter(now);
    }

    // ---- state ----

    synchronized RoomSnapshot snapshot() {
        List<ChatMessageView> history = List.copyOf(chat.values());
        int from = Math.max(0, history.size() - settings.chatSnapshotSize());
        return new RoomSnapshot(id, memberViews(), List.copyOf(locks.values()),
            List.copyOf(comments.values()), history.subList(from, history.size()), passwordHash != null, inviteOnly);
    }

    synchronized boolean isCurrentConnection(String userId, String connectionId) {
        Member member = members.get(userId);
        return member != null && member.isOnline() && member.isCurrentConnection(connectionId);
    }

    private List<MemberView> memberViews() {
        return members.values().stream().map(Member::toView).toList();
    }

    synchronized Optional<MemberView> member(String userId) {
        return Optional.ofNullable(members.get(userId)).map(Member::toView);
    }

    synchronized Optional<LockView> lock(String resourceId) {
        return Optional.ofNullable(locks.get(resourceId));
    }

    /** Sends to every online member except {@code excludeUserId} (null excludes nobody). */
    synchronized void broadcast(ServerMessage message, String excludeUserId) {
        for (Member member : members.values()) {
            MemberChannel channel = member.channel();
            if (channel == null || !member.isOnline() || member.id().equals(excludeUserId)) {
                continue;
            }
            try {
                channel.send(message);
            } catch (RuntimeException e) {
                LOG.warnf("Failed to deliver %s to %s in room %s: %s", message.type(), member.id(), id, e.getMessage());
            }
        }
    }

    private Member requireOnline(String userId) {
        Member member = userId != null ? members.get(userId) : null;
        if (member == null || !member.isOnline()) {
            throw new ConflictException(ConflictException.NOT_JOINED, "Not joined to room " + id);
        }
        return member;
    }

    private Member requireEditor(String userId, String action) {
        Member member = requireOnline(userId);
        if (!member.role().canEdit()) {
            throw AuthorizationException.forbidden("Viewers cannot " + action);
        }
        return member;
    }

    private void requireManager(String actorId, String action) {
        Member member = actorId != null ? members.get(actorId) : null;
        boolean owner = member != null ? member.role() == Role.OWNER : actorId != null && actorId.equals(creatorId);
        if (!owner) {
            throw AuthorizationException.ownerRequired(action);
        }
    }

    private static void requireResource(String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            throw ProtocolException.invalid("resourceId is required");
        }
    }
}
