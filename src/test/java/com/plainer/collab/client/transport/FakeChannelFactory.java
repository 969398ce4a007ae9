package com.plainer.collab.client.transport;

import com.plainer.collab.message.ChatMessageView;
import com.plainer.collab.message.MemberView;
import com.plainer.collab.message.RoomSnapshot;
import com.plainer.collab.model.Role;
import java.net.ConnectException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory stand-in for the server side of the WebSocket. Channels are handed out in open order;
 * with {@link #acceptJoinsAs(Role)} every join frame is answered with {@code room-joined}.
 */
public class FakeChannelFactory implements ChannelFactory {

    private final BlockingQueue<FakeChannel> opened = new LinkedBlockingQueue<>();
    private final AtomicInteger attempts = new AtomicInteger();
    private final List<MemberView> otherMembers = new ArrayList<>();
    private final List<ChatMessageView> chatHistory = new ArrayList<>();
    private volatile boolean unreachable;
    private volatile Role acceptAs;
    private volatile String lastBearerToken;

    public FakeChannelFactory unreachable(boolean value) {
        this.unreachable = value;
        return this;
    }

    public FakeChannelFactory acceptJoinsAs(Role role) {
        this.acceptAs = role;
        return this;
    }

    public FakeChannelFactory withMember(MemberView member) {
        otherMembers.add(member);
        return this;
    }

    public FakeChannelFactory withChat(ChatMessageView message) {
        chatHistory.add(message);
        return this;
    }

    @Override
    public CompletionStage<WebSocketChannel> open(URI endpoint, String bearerToken, ChannelListener listener) {
        attempts.incrementAndGet();
        lastBearerToken = bearerToken;
        if (unreachable) {
            return CompletableFuture.failedFuture(new ConnectException("Connection refused"));
        }
        FakeChannel channel = new FakeChannel(listener, this);
        opened.add(channel);
        return CompletableFuture.completedFuture(channel);
    }

    public FakeChannel nextChannel() {
        try {
            FakeChannel channel = opened.poll(5, TimeUnit.SECONDS);
            if (channel == null) {
                throw new AssertionError("No channel opened within 5s");
            }
            return channel;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError(e);
        }
    }

    public int attempts() {
        return attempts.get();
    }

    public String lastBearerToken() {
        return lastBearerToken;
    }

    Role acceptAs() {
        return acceptAs;
    }

    RoomSnapshot snapshotFor(String roomId, MemberView joiner) {
        List<MemberView> members = new ArrayList<>(otherMembers);
        members.add(joiner);
        return new RoomSnapshot(roomId, members, List.of(), List.of(), List.copyOf(chatHistory), false, false);
    }
}
