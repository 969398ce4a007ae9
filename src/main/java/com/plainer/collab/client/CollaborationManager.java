package com.plainer.collab.client;

import com.plainer.collab.client.content.ConflictResolver;
import com.plainer.collab.client.content.ConflictStrategy;
import com.plainer.collab.client.content.ContentChanges;
import com.plainer.collab.client.content.MergeFunction;
import com.plainer.collab.client.content.TextDiff;
import com.plainer.collab.client.transport.ChannelFactory;
import com.plainer.collab.client.transport.ConnectionHandle;
import com.plainer.collab.client.transport.ConnectionStatus;
import com.plainer.collab.client.transport.ConnectionTransport;
import com.plainer.collab.client.transport.JoinOptions;
import com.plainer.collab.client.transport.StatusChange;
import com.plainer.collab.client.ui.PointerListener;
import com.plainer.collab.client.ui.PointerSurface;
import com.plainer.collab.client.ui.TextField;
import com.plainer.collab.error.ApplyException;
import com.plainer.collab.error.AuthorizationException;
import com.plainer.collab.error.ConnectionException;
import com.plainer.collab.message.ChatMessageView;
import com.plainer.collab.message.ClientMessage;
import com.plainer.collab.message.CommentView;
import com.plainer.collab.message.ContentChange;
import com.plainer.collab.message.CursorPosition;
import com.plainer.collab.message.LockView;
import com.plainer.collab.message.MemberView;
import com.plainer.collab.message.MessageTypes;
import com.plainer.collab.message.RoomSnapshot;
import com.plainer.collab.message.ServerMessage;
import com.plainer.collab.message.UserInfo;
import com.plainer.collab.model.Role;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Client façade over one room membership: presence, cursors, field synchronisation, locks, roles,
 * comments and chat.
 *
 * <p>Inbound events are applied on the transport thread. Trackers returned by
 * {@link #trackCursor(PointerSurface)} and {@link #trackTextInput(TextField)} stay active until
 * their cancel action runs; {@link #disconnect()} does not cancel them.
 */
public class CollaborationManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(CollaborationManager.class);

    static final int CHAT_HISTORY_LIMIT = 500;

    private final ClientSettings settings;
    private final ConnectionTransport transport;
    private final Clock clock;
    private final ConflictResolver resolver;
    private final ScheduledExecutorService scheduler;
    private final List<CollaborationListener> listeners = new CopyOnWriteArrayList<>();

    private final Map<String, MemberView> users = new ConcurrentHashMap<>();
    private final Map<String, RemoteCursor> cursors = new ConcurrentHashMap<>();
    private final Map<String, LockView> locks = new ConcurrentHashMap<>();
    private final Map<String, CommentView> comments = new ConcurrentHashMap<>();
    private final Map<String, ChatMessageView> chat = Collections.synchronizedMap(new LinkedHashMap<String, ChatMessageView>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, ChatMessageView> eldest) {
            return size() > CHAT_HISTORY_LIMIT;
        }
    });

    private final Map<String, TextField> fields = new ConcurrentHashMap<>();
    private final Map<String, String> baselines = new ConcurrentHashMap<>();
    private final Map<String, Deque<ContentChange>> recentLocal = new ConcurrentHashMap<>();

    private volatile UserInfo self;
    private volatile String roomId;
    private volatile Role role;

    public CollaborationManager(ClientSettings settings, ChannelFactory channels) {
        this(settings, new ConnectionTransport(settings, channels), Clock.systemUTC(), Map.of());
    }

    public CollaborationManager(ClientSettings settings, ConnectionTransport transport, Clock clock,
                                Map<String, MergeFunction> mergeFunctions) {
        this.settings = settings;
        this.transport = transport;
        this.clock = clock;
        this.resolver = ConflictResolver.forStrategy(settings.conflictStrategy(), mergeFunctions);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "collab-cursor");
            t.setDaemon(true);
            return t;
        });

        transport.onStatusChange(this::onStatusChange);
        transport.on(MessageTypes.ROOM_JOINED, this::onRoomJoined);
        transport.on(MessageTypes.PRESENCE_JOINED, this::onPresenceJoined);
        transport.on(MessageTypes.PRESENCE_LEFT, this::onPresenceLeft);
        transport.on(MessageTypes.PRESENCE_UPDATED, this::onPresenceUpdated);
        transport.on(MessageTypes.CURSOR_UPDATE, this::onCursor);
        transport.on(MessageTypes.CONTENT_CHANGE, msg -> applyRemote(msg.change()));
        transport.on(MessageTypes.LOCK_GRANTED, this::onLockGranted);
        transport.on(MessageTypes.LOCK_DENIED, this::onLockDenied);
        transport.on(MessageTypes.LOCK_RELEASED, this::onLockReleased);
        transport.on(MessageTypes.ROLE_CHANGED, this::onRoleChanged);
        transport.on(MessageTypes.COMMENT_ADDED, this::onCommentUpserted);
        transport.on(MessageTypes.COMMENT_UPDATED, this::onCommentUpserted);
        transport.on(MessageTypes.COMMENT_RESOLVED, this::onCommentResolved);
        transport.on(MessageTypes.COMMENT_DELETED, this::onCommentDeleted);
        transport.on(MessageTypes.CHAT_MESSAGE, this::onChatMessage);
        transport.on(MessageTypes.CHAT_REACTION, this::onChatReaction);
        transport.on(MessageTypes.ERROR, msg -> notifyListeners(l -> l.onError(msg.code(), msg.error())));
        transport.on(MessageTypes.SESSION_ENDED, msg -> notifyListeners(l -> l.onSessionEnded(msg.code(), msg.error())));
    }

    public void addListener(CollaborationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(CollaborationListener listener) {
        listeners.remove(listener);
    }

    // ---- connection ----

    public CompletableFuture<ConnectionHandle> connect(String roomId, String userId, String userName) {
        return connect(roomId, new UserInfo(userId, userName, null), JoinOptions.NONE);
    }

    public CompletableFuture<ConnectionHandle> connect(String roomId, UserInfo user, JoinOptions options) {
        this.self = user;
        this.roomId = roomId;
        return transport.connect(roomId, user, options);
    }

    /** Leaves the room. Returns once the heartbeat and any pending reconnection are stopped. */
    public void disconnect() {
        transport.disconnect();
        clearRoomState();
    }

    @Override
    public void close() {
        disconnect();
        transport.close();
        scheduler.shutdownNow();
    }

    // ---- cursor tracking ----

    /**
     * Publishes pointer movements over {@code surface}, throttled to the cursor debounce interval.
     * Leaving the surface publishes an off-surface cursor so peers hide it.
     *
     * @return cancel action; removes the listener and drops any pending emission
     */
    public Runnable trackCursor(PointerSurface surface) {
        Throttle<CursorPosition> throttle = new Throttle<>(settings.cursorDebounce(), scheduler,
            position -> transport.send(ClientMessage.cursorUpdate(roomId, position)));
        PointerListener listener = new PointerListener() {
            @Override
            public void moved(double x, double y) {
                throttle.submit(new CursorPosition(x, y, surface.id()));
            }

            @Override
            public void left() {
                throttle.submit(CursorPosition.OUTSIDE);
            }
        };
        surface.addPointerListener(listener);
        AtomicBoolean active = new AtomicBoolean(true);
        return () -> {
            if (active.compareAndSet(true, false)) {
                surface.removePointerListener(listener);
                throttle.cancel();
            }
        };
    }

    // ---- text tracking ----

    /**
     * Sends a content change for every edit of {@code field} and applies remote changes to it.
     *
     * @return cancel action; stops both directions
     */
    public Runnable trackTextInput(TextField field) {
        Runnable unregister = registerField(field);
        Consumer<String> listener = value -> onLocalEdit(field, value);
        field.addChangeListener(listener);
        AtomicBoolean active = new AtomicBoolean(true);
        return () -> {
            if (active.compareAndSet(true, false)) {
                field.removeChangeListener(listener);
                unregister.run();
            }
        };
    }

    /** Makes {@code field} a target for remote changes without observing local edits. */
    public Runnable registerField(TextField field) {
        fields.put(field.id(), field);
        baselines.put(field.id(), field.value() != null ? field.value() : "");
        return () -> {
            if (fields.remove(field.id(), field)) {
                baselines.remove(field.id());
                recentLocal.remove(field.id());
            }
        };
    }

    void onLocalEdit(TextField field, String value) {
        String previous = baselines.getOrDefault(field.id(), "");
        String current = value != null ? value : "";
        baselines.put(field.id(), current);
        Optional<ContentChange> diff = TextDiff.diff(field.id(), previous, current);
        if (diff.isEmpty()) {
            return;
        }
        Role currentRole = role;
        if (currentRole != null && !currentRole.canEdit()) {
            LOG.debugf("Edit of %s not sent: %s cannot edit", field.id(), currentRole);
            return;
        }
        UserInfo me = self;
        ContentChange change = diff.get()
            .withId(UUID.randomUUID().toString())
            .withAuthor(me != null ? me.id() : null, clock.instant());
        remember(change);
        transport.send(ClientMessage.contentChange(roomId, change));
    }

    private void remember(ContentChange change) {
        Deque<ContentChange> recent = recentLocal.computeIfAbsent(change.elementId(), id -> new ArrayDeque<>());
        synchronized (recent) {
            recent.addLast(change);
            prune(recent, clock.instant());
        }
    }

    private List<ContentChange> concurrentLocal(String elementId) {
        Deque<ContentChange> recent = recentLocal.get(elementId);
        if (recent == null) {
            return List.of();
        }
        synchronized (recent) {
            prune(recent, clock.instant());
            return new ArrayList<>(recent);
        }
    }

    private void prune(Deque<ContentChange> recent, Instant now) {
        Instant horizon = now.minus(settings.conflictWindow());
        while (!recent.isEmpty() && recent.peekFirst().timestamp().isBefore(horizon)) {
            recent.removeFirst();
        }
    }

    /**
     * Applies a change received from another member to its registered field, after the active
     * conflict strategy has had its say. Failures are logged and the change is dropped.
     */
    void applyRemote(ContentChange change) {
        if (change == null) {
            return;
        }
        UserInfo me = self;
        if (me != null && me.id().equals(change.authorId())) {
            return;
        }
        TextField field = change.elementId() != null ? fields.get(change.elementId()) : null;
        try {
            if (field == null) {
                throw new ApplyException(ApplyException.FIELD_NOT_FOUND, "No registered field " + change.elementId());
            }
            Optional<ContentChange> resolved = resolver.resolve(change, concurrentLocal(change.elementId()));
            if (resolved.isEmpty()) {
                LOG.debugf("Remote change %s on %s dropped by %s", change.id(), change.elementId(), resolver.strategy());
                return;
            }
            String updated = ContentChanges.apply(field.value(), resolved.get());
            baselines.put(field.id(), updated);
            field.setValue(updated);
            notifyListeners(l -> l.onRemoteChange(resolved.get(), updated));
        } catch (ApplyException e) {
            LOG.debugf("Remote change on %s not applied: %s", change.elementId(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.warnf(e, "Applying remote change on %s failed", change.elementId());
        }
    }

    // ---- locks and roles ----

    public CompletableFuture<LockOutcome> acquireLock(String resourceId) {
        Optional<CompletableFuture<LockOutcome>> refused = precheckEditor("acquire locks");
        if (refused.isPresent()) {
            return refused.get();
        }
        return transport.request(id -> ClientMessage.lockAcquire(id, roomId, resourceId))
            .thenApply(reply -> MessageTypes.LOCK_GRANTED.equals(reply.type())
                ? new LockOutcome(true, resourceId, reply.currentOwner(), reply.lock())
                : new LockOutcome(false, resourceId, reply.currentOwner(), reply.lock()));
    }

    public CompletableFuture<Void> releaseLock(String resourceId) {
        Optional<CompletableFuture<Void>> refused = precheckEditor("release locks");
        if (refused.isPresent()) {
            return refused.get();
        }
        return transport.request(id -> ClientMessage.lockRelease(id, roomId, resourceId)).thenApply(reply -> null);
    }

    public CompletableFuture<Void> changeRole(String targetUserId, Role newRole) {
        if (!transport.isConnected()) {
            return CompletableFuture.failedFuture(notConnected());
        }
        if (role != Role.OWNER) {
            return CompletableFuture.failedFuture(AuthorizationException.ownerRequired("change roles"));
        }
        return transport.request(id -> ClientMessage.roleChange(id, roomId, targetUserId, newRole)).thenApply(reply -> null);
    }

    // ---- comments ----

    public void addComment(String stepId, String content, List<String> mentions, String parentId) {
        requireCommenter();
        transport.send(ClientMessage.commentAdd(roomId, stepId, content, mentions, parentId));
    }

    public void updateComment(String commentId, String content, List<String> mentions) {
        requireCommenter();
        CommentView existing = comments.get(commentId);
        transport.send(ClientMessage.commentUpdate(roomId, commentId,
            existing != null ? existing.stepId() : null, content, mentions));
    }

    public void deleteComment(String commentId) {
        requireCommenter();
        CommentView existing = comments.get(commentId);
        transport.send(ClientMessage.commentDelete(roomId, commentId, existing != null ? existing.stepId() : null));
    }

    public void resolveComment(String commentId, boolean resolved) {
        requireCommenter();
        CommentView existing = comments.get(commentId);
        transport.send(ClientMessage.commentResolve(roomId, commentId,
            existing != null ? existing.stepId() : null, resolved));
    }

    // ---- chat ----

    /** Posts to the room chat. Open to every role, viewers included. */
    public void sendChatMessage(String content) {
        if (!transport.isConnected()) {
            throw notConnected();
        }
        if (content == null || content.isBlank()) {
            return;
        }
        transport.send(ClientMessage.chatSend(roomId, content));
    }

    /** Adds the local user's {@code emoji} to a chat message, or takes it back when already there. */
    public void toggleChatReaction(String messageId, String emoji) {
        if (!transport.isConnected()) {
            throw notConnected();
        }
        transport.send(ClientMessage.chatReaction(roomId, messageId, emoji));
    }

    public void requestPresence() {
        transport.send(ClientMessage.requestPresence(roomId));
    }

    // ---- state ----

    public List<MemberView> users() {
        return users.values().stream().sorted(Comparator.comparing(MemberView::id)).toList();
    }

    /** Cursors of other members, minus those not updated within the cursor idle timeout. */
    public Map<String, RemoteCursor> cursors() {
        Instant horizon = clock.instant().minus(settings.cursorIdleTimeout());
        UserInfo me = self;
        Map<String, RemoteCursor> fresh = new ConcurrentHashMap<>();
        cursors.forEach((userId, cursor) -> {
            if ((me == null || !me.id().equals(userId)) && !cursor.updatedAt().isBefore(horizon)) {
                fresh.put(userId, cursor);
            }
        });
        return Map.copyOf(fresh);
    }

    public Map<String, LockView> locks() {
        Instant now = clock.instant();
        Map<String, LockView> live = new ConcurrentHashMap<>();
        locks.forEach((resourceId, lock) -> {
            if (!lock.isExpired(now)) live.put(resourceId, lock);
        });
        return Map.copyOf(live);
    }

    /** Holder of {@code resourceId} when it is someone other than the local user. */
    public Optional<LockView> lockedByOther(String resourceId) {
        LockView lock = locks().get(resourceId);
        UserInfo me = self;
        if (lock == null || (me != null && me.id().equals(lock.ownerId()))) {
            return Optional.empty();
        }
        return Optional.of(lock);
    }

    public List<CommentView> comments() {
        return comments.values().stream().sorted(Comparator.comparing(CommentView::createdAt)).toList();
    }

    /** Chat history, oldest first. */
    public List<ChatMessageView> chatMessages() {
        synchronized (chat) {
            return List.copyOf(chat.values());
        }
    }

    public Role role() {
        return role;
    }

    public boolean isConnected() {
        return transport.status() == ConnectionStatus.CONNECTED;
    }

    public boolean isReconnecting() {
        return transport.status() == ConnectionStatus.RECONNECTING;
    }

    public ConnectionStatus status() {
        return transport.status();
    }

    public String lastError() {
        return transport.lastError();
    }

    public ConflictStrategy conflictStrategy() {
        return resolver.strategy();
    }

    // ---- inbound ----

    private void onStatusChange(StatusChange change) {
        if (change.status() == ConnectionStatus.DISCONNECTED) {
            cursors.clear();
        }
        notifyListeners(l -> l.onStatusChange(change));
    }

    private void onRoomJoined(ServerMessage msg) {
        role = msg.role();
        RoomSnapshot snapshot = msg.snapshot();
        users.clear();
        locks.clear();
        comments.clear();
        cursors.clear();
        chat.clear();
        if (snapshot != null) {
            snapshot.members().forEach(m -> users.put(m.id(), m));
            snapshot.locks().forEach(l -> locks.put(l.resourceId(), l));
            snapshot.comments().forEach(c -> comments.put(c.id(), c));
            if (snapshot.chat() != null) {
                snapshot.chat().forEach(m -> chat.put(m.id(), m));
            }
        }
        notifyListeners(l -> l.onRoleChanged(msg.role()));
        publishUsers();
        publishLocks();
        publishComments();
        publishChat();
        users.values().forEach(this::restoreCursor);
    }

    private void onPresenceJoined(ServerMessage msg) {
        if (msg.member() != null) {
            users.put(msg.member().id(), msg.member());
            publishUsers();
            restoreCursor(msg.member());
        }
    }

    // A member's last known cursor travels in its presence entry.
    private void restoreCursor(MemberView member) {
        UserInfo me = self;
        CursorPosition position = member.cursor();
        if (!member.online() || position == null || position.isOutside() || (me != null && me.id().equals(member.id()))) {
            return;
        }
        RemoteCursor cursor = new RemoteCursor(member.id(), member.name(), member.color(),
            position.x(), position.y(), position.elementId(), clock.instant());
        cursors.put(member.id(), cursor);
        notifyListeners(l -> l.onCursorMoved(cursor));
    }

    private void onPresenceLeft(ServerMessage msg) {
        Instant now = clock.instant();
        users.computeIfPresent(msg.userId(), (id, member) -> member.withOnline(false, now));
        if (cursors.remove(msg.userId()) != null) {
            notifyListeners(l -> l.onCursorRemoved(msg.userId()));
        }
        publishUsers();
    }

    private void onPresenceUpdated(ServerMessage msg) {
        users.clear();
        if (msg.members() != null) {
            msg.members().forEach(m -> users.put(m.id(), m));
        }
        MemberView me = self != null ? users.get(self.id()) : null;
        if (me != null && me.role() != role) {
            role = me.role();
            notifyListeners(l -> l.onRoleChanged(me.role()));
        }
        publishUsers();
    }

    private void onCursor(ServerMessage msg) {
        String userId = msg.userId();
        UserInfo me = self;
        if (userId == null || (me != null && me.id().equals(userId))) {
            return;
        }
        CursorPosition position = msg.cursor();
        if (position == null || position.isOutside()) {
            if (cursors.remove(userId) != null) {
                notifyListeners(l -> l.onCursorRemoved(userId));
            }
            return;
        }
        MemberView member = users.get(userId);
        RemoteCursor cursor = new RemoteCursor(userId,
            member != null ? member.name() : userId,
            member != null ? member.color() : null,
            position.x(), position.y(), position.elementId(), clock.instant());
        cursors.put(userId, cursor);
        notifyListeners(l -> l.onCursorMoved(cursor));
    }

    private void onLockGranted(ServerMessage msg) {
        if (msg.lock() != null) {
            locks.put(msg.lock().resourceId(), msg.lock());
            publishLocks();
        }
    }

    private void onLockDenied(ServerMessage msg) {
        if (msg.lock() != null) {
            locks.put(msg.lock().resourceId(), msg.lock());
            publishLocks();
        }
    }

    private void onLockReleased(ServerMessage msg) {
        if (msg.resourceId() != null && locks.remove(msg.resourceId()) != null) {
            publishLocks();
        }
    }

    private void onRoleChanged(ServerMessage msg) {
        users.computeIfPresent(msg.userId(), (id, member) -> member.withRole(msg.role()));
        UserInfo me = self;
        if (me != null && me.id().equals(msg.userId())) {
            role = msg.role();
            notifyListeners(l -> l.onRoleChanged(msg.role()));
        }
        publishUsers();
    }

    private void onCommentUpserted(ServerMessage msg) {
        if (msg.comment() != null) {
            comments.put(msg.comment().id(), msg.comment());
            publishComments();
        }
    }

    private void onCommentResolved(ServerMessage msg) {
        Instant now = clock.instant();
        CommentView updated = comments.computeIfPresent(msg.commentId(),
            (id, comment) -> comment.withResolved(Boolean.TRUE.equals(msg.resolved()), now));
        if (updated != null) {
            publishComments();
        }
    }

    private void onCommentDeleted(ServerMessage msg) {
        if (msg.commentId() != null && comments.remove(msg.commentId()) != null) {
            publishComments();
        }
    }

    private void onChatMessage(ServerMessage msg) {
        ChatMessageView message = msg.chat();
        if (message == null) {
            return;
        }
        chat.put(message.id(), message);
        notifyListeners(l -> l.onChatMessage(message));
        publishChat();
    }

    private void onChatReaction(ServerMessage msg) {
        ChatMessageView updated = msg.chat();
        if (updated != null && chat.replace(updated.id(), updated) != null) {
            publishChat();
        }
    }

    // ---- helpers ----

    private void clearRoomState() {
        users.clear();
        cursors.clear();
        locks.clear();
        comments.clear();
        chat.clear();
        role = null;
    }

    private <T> Optional<CompletableFuture<T>> precheckEditor(String action) {
        if (!transport.isConnected()) {
            return Optional.of(CompletableFuture.failedFuture(notConnected()));
        }
        if (role == null || !role.canEdit()) {
            return Optional.of(CompletableFuture.failedFuture(AuthorizationException.forbidden("Viewers cannot " + action)));
        }
        return Optional.empty();
    }

    private void requireCommenter() {
        if (!transport.isConnected()) {
            throw notConnected();
        }
        if (role == null || !role.canEdit()) {
            throw AuthorizationException.forbidden("Viewers cannot comment");
        }
    }

    private static ConnectionException notConnected() {
        return new ConnectionException(ConnectionException.NOT_CONNECTED, "Not connected");
    }

    private void publishUsers() {
        List<MemberView> snapshot = users();
        notifyListeners(l -> l.onUsersChanged(snapshot));
    }

    private void publishLocks() {
        Collection<LockView> snapshot = locks().values();
        notifyListeners(l -> l.onLocksChanged(snapshot));
    }

    private void publishComments() {
        List<CommentView> snapshot = comments();
        notifyListeners(l -> l.onCommentsChanged(snapshot));
    }

    private void publishChat() {
        List<ChatMessageView> snapshot = chatMessages();
        notifyListeners(l -> l.onChatChanged(snapshot));
    }

    private void notifyListeners(Consumer<CollaborationListener> event) {
        for (CollaborationListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Collaboration listener failed");
            }
        }
    }
}
