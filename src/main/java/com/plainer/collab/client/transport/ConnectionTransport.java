package com.plainer.collab.client.transport;

import com.plainer.collab.client.ClientSettings;
import com.plainer.collab.error.AuthorizationException;
import com.plainer.collab.error.CollaborationException;
import com.plainer.collab.error.ConnectionException;
import com.plainer.collab.error.ProtocolException;
import com.plainer.collab.message.ClientMessage;
import com.plainer.collab.message.JsonCodec;
import com.plainer.collab.message.MessageTypes;
import com.plainer.collab.message.ServerMessage;
import com.plainer.collab.message.UserInfo;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.DoubleSupplier;
import java.util.function.Function;

/**
 * Client half of the connection: handshake, heartbeat, reconnection with backoff and request
 * correlation for one room membership.
 *
 * <p>All state lives on a single event-loop thread. Inbound frames, channel callbacks and timers are
 * queued onto it, and status listeners and message handlers are invoked from it, so a handler never
 * runs concurrently with a reconnect.
 */
public class ConnectionTransport implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(ConnectionTransport.class);

    private final ClientSettings settings;
    private final ChannelFactory channels;
    private final BackoffPolicy backoff;
    private final DoubleSupplier random;
    private final JsonCodec codec = new JsonCodec();
    private final ScheduledExecutorService loop;
    private volatile Thread loopThread;

    private final ConnectionStateMachine state = new ConnectionStateMachine();
    private final Map<String, List<Consumer<ServerMessage>>> handlers = new ConcurrentHashMap<>();
    private final List<Consumer<StatusChange>> statusListeners = new CopyOnWriteArrayList<>();

    private volatile ConnectionHandle handle;
    private volatile String lastError;

    // event-loop confined
    private Session session;
    private WebSocketChannel channel;
    private long generation;
    private long lastInboundNanos;
    private CompletableFuture<ConnectionHandle> connectFuture;
    private final Map<String, PendingRequest> pending = new HashMap<>();
    // "roomId/userId" -> token from the last room-joined, presented on every rejoin
    private final Map<String, String> resumeTokens = new HashMap<>();
    private ScheduledFuture<?> heartbeatTask;
    private ScheduledFuture<?> handshakeTimer;
    private ScheduledFuture<?> reconnectTimer;

    private record Session(String roomId, UserInfo user, JoinOptions options) {

        String key() {
            return roomId + "/" + (user != null ? user.id() : "");
        }
    }

    private record PendingRequest(CompletableFuture<ServerMessage> future, ScheduledFuture<?> timeout) {}

    public ConnectionTransport(ClientSettings settings, ChannelFactory channels) {
        this(settings, channels, () -> ThreadLocalRandom.current().nextDouble());
    }

    ConnectionTransport(ClientSettings settings, ChannelFactory channels, DoubleSupplier random) {
        this.settings = settings;
        this.channels = channels;
        this.backoff = settings.backoff();
        this.random = random;
        this.loop = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "collab-transport");
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
    }

    // ---- public API ----

    /**
     * Opens the connection and joins {@code roomId}. The future completes on {@code room-joined},
     * survives transient failures while reconnection is retried, and fails with
     * {@link AuthorizationException} on {@code join-rejected} or {@link ConnectionException} when
     * retries are exhausted or {@link #disconnect()} is called first.
     */
    public CompletableFuture<ConnectionHandle> connect(String roomId, UserInfo user, JoinOptions options) {
        CompletableFuture<ConnectionHandle> result = new CompletableFuture<>();
        boolean queued = execute(() -> {
            if (state.status() != ConnectionStatus.DISCONNECTED) {
                result.completeExceptionally(new IllegalStateException("Transport is already " + state.status()));
                return;
            }
            session = new Session(roomId, user, options != null ? options : JoinOptions.NONE);
            connectFuture = result;
            lastError = null;
            publish(state.beginConnect());
            LOG.infof("Connecting to room %s at %s", roomId, settings.endpoint());
            openChannel();
        });
        if (!queued) {
            result.completeExceptionally(new ConnectionException(ConnectionException.CLOSED, "Transport is closed"));
        }
        return result;
    }

    /** Fire-and-forget. Dropped with a debug log when not connected. */
    public void send(ClientMessage message) {
        execute(() -> {
            if (channel == null || state.status() != ConnectionStatus.CONNECTED) {
                LOG.debugf("Dropping %s while %s", message.type(), state.status());
                return;
            }
            channel.send(codec.encode(message));
        });
    }

    /**
     * Sends a command that the server answers with a frame echoing its {@code requestId}. An
     * {@code error} reply fails the future with the matching {@link CollaborationException}.
     */
    public CompletableFuture<ServerMessage> request(Function<String, ClientMessage> command) {
        CompletableFuture<ServerMessage> result = new CompletableFuture<>();
        boolean queued = execute(() -> {
            if (channel == null || state.status() != ConnectionStatus.CONNECTED) {
                result.completeExceptionally(new ConnectionException(ConnectionException.NOT_CONNECTED, "Not connected"));
                return;
            }
            String requestId = UUID.randomUUID().toString();
            ClientMessage message = command.apply(requestId);
            ScheduledFuture<?> timeout = loop.schedule(() -> {
                PendingRequest expired = pending.remove(requestId);
                if (expired != null) {
                    expired.future().completeExceptionally(new ConnectionException(ConnectionException.TIMEOUT,
                        message.type() + " timed out after " + settings.requestTimeout()));
                }
            }, settings.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
            pending.put(requestId, new PendingRequest(result, timeout));
            channel.send(codec.encode(message));
        });
        if (!queued) {
            result.completeExceptionally(new ConnectionException(ConnectionException.CLOSED, "Transport is closed"));
        }
        return result;
    }

    /** Registers a handler for inbound frames of {@code type}. */
    public void on(String type, Consumer<ServerMessage> handler) {
        handlers.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public void onStatusChange(Consumer<StatusChange> listener) {
        statusListeners.add(listener);
    }

    /**
     * Leaves the room and closes the connection. Stops the heartbeat, cancels a pending
     * reconnection and fails outstanding requests before returning.
     */
    public void disconnect() {
        if (Thread.currentThread() == loopThread) {
            doDisconnect();
            return;
        }
        try {
            loop.submit(this::doDisconnect).get();
        } catch (RejectedExecutionException e) {
            LOG.debug("Transport already closed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Disconnect failed", e.getCause());
        }
    }

    @Override
    public void close() {
        disconnect();
        loop.shutdownNow();
    }

    public ConnectionStatus status() {
        return state.status();
    }

    public boolean isConnected() {
        return state.status() == ConnectionStatus.CONNECTED;
    }

    public ConnectionHandle handle() {
        return handle;
    }

    public String lastError() {
        return lastError;
    }

    // ---- event loop ----

    private void openChannel() {
        long gen = ++generation;
        Session current = session;
        ChannelListener listener = new ChannelListener() {
            @Override
            public void onText(String text) {
                execute(() -> {
                    if (gen == generation) onFrame(text);
                });
            }

            @Override
            public void onClosed(String reason) {
                execute(() -> {
                    if (gen == generation) onChannelLost(reason != null ? reason : "Connection closed");
                });
            }
        };

        cancel(handshakeTimer);
        handshakeTimer = loop.schedule(() -> {
            if (gen == generation && state.status() != ConnectionStatus.CONNECTED) {
                onChannelLost("Handshake timed out after " + settings.handshakeTimeout());
            }
        }, settings.handshakeTimeout().toMillis(), TimeUnit.MILLISECONDS);

        CompletionStage<WebSocketChannel> opening;
        try {
            opening = channels.open(settings.endpoint(), current.options().bearerToken(), listener);
        } catch (RuntimeException e) {
            opening = CompletableFuture.failedFuture(e);
        }
        opening.whenComplete((opened, failure) -> {
            boolean queued = execute(() -> {
                if (gen != generation) {
                    if (opened != null) opened.close();
                    return;
                }
                if (failure != null) {
                    onChannelLost("Cannot reach " + settings.endpoint() + ": " + rootMessage(failure));
                    return;
                }
                channel = opened;
                lastInboundNanos = System.nanoTime();
                channel.send(codec.encode(ClientMessage.joinRoom(current.roomId(), current.user(),
                    current.options().password(), current.options().inviteToken(), resumeTokens.get(current.key()))));
                startHeartbeat(gen);
            });
            if (!queued && opened != null) {
                opened.close();
            }
        });
    }

    private void startHeartbeat(long gen) {
        cancel(heartbeatTask);
        long interval = settings.heartbeatInterval().toMillis();
        heartbeatTask = loop.scheduleAtFixedRate(() -> {
            if (gen != generation || channel == null) {
                return;
            }
            Duration silence = Duration.ofNanos(System.nanoTime() - lastInboundNanos);
            if (silence.compareTo(settings.heartbeatTimeout()) > 0) {
                LOG.warnf("No frame from server for %s, connection considered dead", silence);
                onChannelLost("Heartbeat timeout");
                return;
            }
            channel.send(codec.encode(ClientMessage.ping(System.currentTimeMillis())));
        }, interval, interval, TimeUnit.MILLISECONDS);
    }

    private void onFrame(String text) {
        lastInboundNanos = System.nanoTime();
        ServerMessage msg;
        try {
            msg = codec.decodeServer(text);
        } catch (ProtocolException e) {
            LOG.debugf("Dropping undecodable frame: %s", e.getMessage());
            return;
        }
        if (msg.type() == null) {
            LOG.debug("Dropping frame without type");
            return;
        }
        switch (msg.type()) {
            case MessageTypes.PONG -> { }
            case MessageTypes.ROOM_JOINED -> onJoined(msg);
            case MessageTypes.JOIN_REJECTED -> {
                dispatch(msg);
                if (state.status() == ConnectionStatus.CONNECTED) {
                    return;
                }
                String code = msg.code() != null ? msg.code() : AuthorizationException.FORBIDDEN;
                String reason = msg.error() != null ? msg.error() : "Join rejected";
                LOG.infof("Join of room %s rejected: %s", session.roomId(), code);
                terminate(new AuthorizationException(code, reason), state.handshakeRejected(reason));
            }
            case MessageTypes.SESSION_ENDED -> {
                dispatch(msg);
                String reason = msg.error() != null ? msg.error() : "Session ended";
                LOG.infof("Session in room %s ended by server: %s", session.roomId(), msg.code());
                terminate(new ConnectionException(ConnectionException.CLOSED, reason), state.sessionEnded(reason));
            }
            case MessageTypes.ERROR -> {
                PendingRequest request = msg.requestId() != null ? pending.remove(msg.requestId()) : null;
                if (request != null) {
                    request.timeout().cancel(false);
                    request.future().completeExceptionally(CollaborationException.fromCode(msg.code(), msg.error()));
                } else {
                    dispatch(msg);
                }
            }
            default -> {
                dispatch(msg);
                PendingRequest request = msg.requestId() != null ? pending.remove(msg.requestId()) : null;
                if (request != null) {
                    request.timeout().cancel(false);
                    request.future().complete(msg);
                }
            }
        }
    }

    private void onJoined(ServerMessage msg) {
        if (state.status() == ConnectionStatus.CONNECTED) {
            dispatch(msg);
            return;
        }
        cancel(handshakeTimer);
        if (msg.resumeToken() != null) {
            resumeTokens.put(session.key(), msg.resumeToken());
        }
        handle = new ConnectionHandle(session.roomId(), session.user(), msg.role(), msg.snapshot());
        StatusChange change = state.handshakeAccepted();
        LOG.infof("Joined room %s as %s", session.roomId(), msg.role());
        dispatch(msg);
        publish(change);
        if (connectFuture != null && !connectFuture.isDone()) {
            connectFuture.complete(handle);
        }
    }

    private void onChannelLost(String reason) {
        if (state.status() == ConnectionStatus.DISCONNECTED) {
            return;
        }
        generation++;
        dropChannel();
        failPending(new ConnectionException(ConnectionException.CLOSED, "Connection lost: " + reason));

        StatusChange change = state.connectionLost(reason);
        if (backoff.isExhausted(change.attempt())) {
            LOG.infof("Giving up on room %s after %d reconnection attempts", session.roomId(), backoff.maxAttempts());
            terminate(new ConnectionException(ConnectionException.UNREACHABLE, ConnectionStateMachine.RETRIES_EXHAUSTED),
                state.retriesExhausted());
            return;
        }
        publish(change);
        Duration delay = backoff.delayFor(change.attempt(), random);
        LOG.infof("Connection lost (%s), reconnection attempt %d in %s", reason, change.attempt(), delay);
        reconnectTimer = loop.schedule(() -> {
            if (state.status() == ConnectionStatus.RECONNECTING) {
                openChannel();
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void doDisconnect() {
        if (state.status() == ConnectionStatus.DISCONNECTED) {
            return;
        }
        if (channel != null && state.status() == ConnectionStatus.CONNECTED && session != null) {
            channel.send(codec.encode(ClientMessage.leaveRoom(session.roomId())));
        }
        LOG.infof("Disconnecting from room %s", session != null ? session.roomId() : null);
        terminate(new ConnectionException(ConnectionException.CLOSED, "Disconnected"), state.closeRequested());
    }

    private void terminate(CollaborationException cause, StatusChange change) {
        generation++;
        dropChannel();
        failPending(cause);
        publish(change);
        if (connectFuture != null && !connectFuture.isDone()) {
            connectFuture.completeExceptionally(cause);
        }
        connectFuture = null;
        session = null;
        handle = null;
    }

    private void dropChannel() {
        cancel(heartbeatTask);
        cancel(handshakeTimer);
        cancel(reconnectTimer);
        heartbeatTask = null;
        handshakeTimer = null;
        reconnectTimer = null;
        if (channel != null) {
            WebSocketChannel closing = channel;
            channel = null;
            try {
                closing.close();
            } catch (RuntimeException e) {
                LOG.debugf("Closing channel failed: %s", e.getMessage());
            }
        }
    }

    private void failPending(CollaborationException cause) {
        if (pending.isEmpty()) {
            return;
        }
        List<PendingRequest> failed = new ArrayList<>(pending.values());
        pending.clear();
        for (PendingRequest request : failed) {
            request.timeout().cancel(false);
            request.future().completeExceptionally(cause);
        }
    }

    private void publish(StatusChange change) {
        if (change.error() != null) {
            lastError = change.error();
        }
        for (Consumer<StatusChange> listener : statusListeners) {
            try {
                listener.accept(change);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Status listener failed on %s", change.status());
            }
        }
    }

    private void dispatch(ServerMessage msg) {
        List<Consumer<ServerMessage>> registered = handlers.get(msg.type());
        if (registered == null) {
            return;
        }
        for (Consumer<ServerMessage> handler : registered) {
            try {
                handler.accept(msg);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Handler for %s failed", msg.type());
            }
        }
    }

    private boolean execute(Runnable task) {
        try {
            loop.execute(task);
            return true;
        } catch (RejectedExecutionException e) {
            LOG.debug("Transport closed, task dropped");
            return false;
        }
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    private static String rootMessage(Throwable failure) {
        Throwable root = failure;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
