package com.plainer.collab.room;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.plainer.collab.MutableClock;
import com.plainer.collab.error.AuthorizationException;
import com.plainer.collab.error.ConflictException;
import com.plainer.collab.error.RoomNotFoundException;
import com.plainer.collab.message.ChangeType;
import com.plainer.collab.message.ContentChange;
import com.plainer.collab.message.CursorPosition;
import com.plainer.collab.message.MessageTypes;
import com.plainer.collab.message.ServerMessage;
import com.plainer.collab.message.UserInfo;
import com.plainer.collab.model.Role;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RoomRegistryTest {

    private static final String ROOM = "project-42";

    private MutableClock clock;
    private RoomRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        registry = new RoomRegistry(RoomSettings.defaults(), clock);
    }

    private JoinResult join(String userId, RecordingChannel channel) {
        return registry.joinRoom(ROOM, new UserInfo(userId, userId.toUpperCase(), null), JoinCredentials.NONE, channel);
    }

    private JoinResult rejoin(String userId, RecordingChannel channel, JoinResult earlier) {
        return registry.joinRoom(ROOM, new UserInfo(userId, userId.toUpperCase(), null),
            new JoinCredentials(null, null, earlier.resumeToken(), false), channel);
    }

    @Test
    void firstJoinCreatesRoomAndMakesJoinerOwner() {
        RecordingChannel alice = new RecordingChannel("c-alice");

        JoinResult result = join("alice", alice);

        assertThat(result.accepted()).isTrue();
        assertThat(result.role()).isEqualTo(Role.OWNER);
        assertThat(result.snapshot().members()).extracting("id").containsExactly("alice");
        assertThat(alice.ofType(MessageTypes.ROOM_JOINED)).hasSize(1);
        assertThat(registry.roomCount()).isEqualTo(1);
    }

    @Test
    void laterJoinersBecomeEditorsAndExistingMembersAreNotified() {
        RecordingChannel alice = new RecordingChannel("c-alice");
        RecordingChannel bob = new RecordingChannel("c-bob");
        join("alice", alice);

        JoinResult result = join("bob", bob);

        assertThat(result.role()).isEqualTo(Role.EDITOR);
        List<ServerMessage> joined = alice.ofType(MessageTypes.PRESENCE_JOINED);
        assertThat(joined).hasSize(1);
        assertThat(joined.get(0).member().id()).isEqualTo("bob");
        assertThat(joined.get(0).member().color()).isNotBlank();
        assertThat(bob.ofType(MessageTypes.PRESENCE_JOINED)).isEmpty();
    }

    @Test
    void rejoiningWithSameUserKeepsOneMemberEntry() {
        RecordingChannel first = new RecordingChannel("c-1");
        RecordingChannel second = new RecordingChannel("c-2");
        JoinResult initial = join("alice", first);
        join("bob", new RecordingChannel("c-bob"));
        registry.updateCursor(ROOM, "alice", new CursorPosition(10, 20, "canvas"));

        JoinResult again = rejoin("alice", second, initial);

        assertThat(again.role()).isEqualTo(Role.OWNER);
        assertThat(again.snapshot().members()).extracting("id").containsExactly("alice", "bob");
        assertThat(again.snapshot().members().get(0).cursor()).isEqualTo(new CursorPosition(10, 20, "canvas"));
        assertThat(first.ofType(MessageTypes.SESSION_ENDED)).singleElement()
            .extracting(ServerMessage::code).isEqualTo(Room.ENDED_REPLACED);
        assertThat(first.closedReason()).isNotNull();
        assertThat(second.closedReason()).isNull();
        assertThat(registry.isCurrentConnection(ROOM, "alice", "c-1")).isFalse();
        assertThat(registry.isCurrentConnection(ROOM, "alice", "c-2")).isTrue();
        assertThat(registry.roomInfo(ROOM).memberCount()).isEqualTo(2);
        assertThat(registry.roomInfo(ROOM).onlineCount()).isEqualTo(2);
    }

    @Test
    void roomJoinedCarriesResumeToken() {
        RecordingChannel alice = new RecordingChannel("c-alice");

        JoinResult result = join("alice", alice);

        assertThat(result.resumeToken()).hasSize(32);
        assertThat(alice.ofType(MessageTypes.ROOM_JOINED)).singleElement()
            .extracting(ServerMessage::resumeToken).isEqualTo(result.resumeToken());
    }

    @Test
    void claimingKnownUserIdWithoutProofIsRejected() {
        registry.createRoom(ROOM, "owner", "s3cret", false);
        RecordingChannel owner = new RecordingChannel("c-owner");
        registry.joinRoom(ROOM, new UserInfo("owner", "Owner", null), new JoinCredentials("s3cret", null), owner);
        JoinResult bob = registry.joinRoom(ROOM, new UserInfo("bob", "Bob", null),
            new JoinCredentials("s3cret", null), new RecordingChannel("c-bob"));

        JoinResult bare = registry.joinRoom(ROOM, new UserInfo("owner", "Mallory", null),
            JoinCredentials.NONE, new RecordingChannel("c-m1"));
        JoinResult withPassword = registry.joinRoom(ROOM, new UserInfo("owner", "Mallory", null),
            new JoinCredentials("s3cret", null), new RecordingChannel("c-m2"));
        JoinResult borrowedToken = registry.joinRoom(ROOM, new UserInfo("owner", "Mallory", null),
            new JoinCredentials(null, null, bob.resumeToken(), false), new RecordingChannel("c-m3"));

        assertThat(List.of(bare, withPassword, borrowedToken)).allSatisfy(result -> {
            assertThat(result.accepted()).isFalse();
            assertThat(result.code()).isEqualTo(AuthorizationException.IDENTITY_UNVERIFIED);
        });
        assertThat(owner.ofType(MessageTypes.SESSION_ENDED)).isEmpty();
        assertThat(owner.closedReason()).isNull();
        assertThat(registry.isCurrentConnection(ROOM, "owner", "c-owner")).isTrue();
    }

    @Test
    void resumeTokenStandsInForPasswordAndKeepsRole() {
        registry.createRoom(ROOM, "owner", "s3cret", false);
        JoinResult first = registry.joinRoom(ROOM, new UserInfo("owner", "Owner", null),
            new JoinCredentials("s3cret", null), new RecordingChannel("c-1"));
        registry.disconnect(ROOM, "owner", "c-1");

        JoinResult again = rejoin("owner", new RecordingChannel("c-2"), first);

        assertThat(again.accepted()).isTrue();
        assertThat(again.role()).isEqualTo(Role.OWNER);
        assertThat(again.resumeToken()).isEqualTo(first.resumeToken());
    }

    @Test
    void verifiedKnownMemberStillPresentsPassword() {
        registry.createRoom(ROOM, "owner", "s3cret", false);
        registry.joinRoom(ROOM, new UserInfo("ada", "Ada", null),
            new JoinCredentials("s3cret", null), new RecordingChannel("c-1"));
        registry.disconnect(ROOM, "ada", "c-1");

        JoinResult noPassword = registry.joinRoom(ROOM, new UserInfo("ada", "Ada", null),
            new JoinCredentials(null, null, null, true), new RecordingChannel("c-2"));
        JoinResult withPassword = registry.joinRoom(ROOM, new UserInfo("ada", "Ada", null),
            new JoinCredentials("s3cret", null, null, true), new RecordingChannel("c-3"));

        assertThat(noPassword.code()).isEqualTo(AuthorizationException.PASSWORD_REQUIRED);
        assertThat(withPassword.accepted()).isTrue();
        assertThat(withPassword.role()).isEqualTo(Role.EDITOR);
    }

    @Test
    void repeatedJoinOnSameConnectionNeedsNoToken() {
        RecordingChannel channel = new RecordingChannel("c-1");
        join("alice", channel);

        JoinResult again = join("alice", channel);

        assertThat(again.accepted()).isTrue();
        assertThat(again.role()).isEqualTo(Role.OWNER);
        assertThat(channel.ofType(MessageTypes.SESSION_ENDED)).isEmpty();
        assertThat(channel.closedReason()).isNull();
    }

    @Test
    void snapshotCarriesLatestCursorUntilMemberGoesOffline() {
        RecordingChannel bob = new RecordingChannel("c-bob");
        join("alice", new RecordingChannel("c-alice"));
        join("bob", bob);
        registry.updateCursor(ROOM, "bob", new CursorPosition(1, 2, "canvas"));
        registry.updateCursor(ROOM, "bob", new CursorPosition(30, 40, "canvas"));

        assertThat(registry.member(ROOM, "bob")).get()
            .extracting("cursor").isEqualTo(new CursorPosition(30, 40, "canvas"));

        registry.updateCursor(ROOM, "bob", CursorPosition.OUTSIDE);
        assertThat(registry.member(ROOM, "bob")).get().extracting("cursor").isNull();

        registry.updateCursor(ROOM, "bob", new CursorPosition(5, 5, "canvas"));
        registry.disconnect(ROOM, "bob", "c-bob");
        assertThat(registry.snapshot(ROOM).members()).filteredOn(m -> m.id().equals("bob"))
            .singleElement().extracting("cursor").isNull();
    }

    @Test
    void passwordIsCheckedBeforeAdmission() {
        registry.createRoom(ROOM, "owner", "s3cret", false);

        JoinResult missing = join("bob", new RecordingChannel("c-1"));
        JoinResult wrong = registry.joinRoom(ROOM, new UserInfo("bob", "Bob", null),
            new JoinCredentials("nope", null), new RecordingChannel("c-2"));
        JoinResult right = registry.joinRoom(ROOM, new UserInfo("bob", "Bob", null),
            new JoinCredentials("s3cret", null), new RecordingChannel("c-3"));

        assertThat(missing.accepted()).isFalse();
        assertThat(missing.code()).isEqualTo(AuthorizationException.PASSWORD_REQUIRED);
        assertThat(wrong.code()).isEqualTo(AuthorizationException.INVALID_PASSWORD);
        assertThat(right.accepted()).isTrue();
        assertThat(right.role()).isEqualTo(Role.EDITOR);
        assertThat(right.snapshot().passwordProtected()).isTrue();
    }

    @Test
    void designatedOwnerPresentsRoomPassword() {
        registry.createRoom(ROOM, "owner", "s3cret", false);

        JoinResult missing = join("owner", new RecordingChannel("c-1"));
        JoinResult result = registry.joinRoom(ROOM, new UserInfo("owner", "Owner", null),
            new JoinCredentials("s3cret", null), new RecordingChannel("c-2"));

        assertThat(missing.code()).isEqualTo(AuthorizationException.PASSWORD_REQUIRED);
        assertThat(result.accepted()).isTrue();
        assertThat(result.role()).isEqualTo(Role.OWNER);
    }

    @Test
    void verifiedDesignatedOwnerNeedsNoInvite() {
        registry.createRoom(ROOM, "owner", null, true);

        JoinResult claimed = join("owner", new RecordingChannel("c-1"));
        JoinResult verified = registry.joinRoom(ROOM, new UserInfo("owner", "Owner", null),
            new JoinCredentials(null, null, null, true), new RecordingChannel("c-2"));

        assertThat(claimed.code()).isEqualTo(AuthorizationException.INVITE_REQUIRED);
        assertThat(verified.accepted()).isTrue();
        assertThat(verified.role()).isEqualTo(Role.OWNER);
    }

    @Test
    void inviteCarriesRoleBypassesPasswordAndIsSingleUse() {
        registry.createRoom(ROOM, "owner", "s3cret", true);
        RoomInvite invite = registry.issueInvite(ROOM, "owner", Role.VIEWER, null);

        JoinResult noInvite = join("guest", new RecordingChannel("c-0"));
        JoinResult guest = registry.joinRoom(ROOM, new UserInfo("guest", "Guest", null),
            new JoinCredentials(null, invite.token()), new RecordingChannel("c-1"));
        JoinResult reused = registry.joinRoom(ROOM, new UserInfo("other", "Other", null),
            new JoinCredentials("s3cret", invite.token()), new RecordingChannel("c-2"));

        assertThat(noInvite.code()).isEqualTo(AuthorizationException.PASSWORD_REQUIRED);
        assertThat(guest.accepted()).isTrue();
        assertThat(guest.role()).isEqualTo(Role.VIEWER);
        assertThat(reused.accepted()).isFalse();
        assertThat(reused.code()).isEqualTo(AuthorizationException.INVALID_INVITE);
    }

    @Test
    void knownMemberRejoinsAfterInviteWasConsumed() {
        registry.createRoom(ROOM, "owner", null, true);
        RoomInvite invite = registry.issueInvite(ROOM, "owner", Role.EDITOR, null);
        RecordingChannel first = new RecordingChannel("c-1");
        JoinResult initial = registry.joinRoom(ROOM, new UserInfo("guest", "Guest", null),
            new JoinCredentials(null, invite.token()), first);
        registry.disconnect(ROOM, "guest", "c-1");

        JoinResult replayedInvite = registry.joinRoom(ROOM, new UserInfo("guest", "Guest", null),
            new JoinCredentials(null, invite.token()), new RecordingChannel("c-2"));
        JoinResult again = registry.joinRoom(ROOM, new UserInfo("guest", "Guest", null),
            new JoinCredentials(null, invite.token(), initial.resumeToken(), false), new RecordingChannel("c-3"));

        assertThat(replayedInvite.code()).isEqualTo(AuthorizationException.IDENTITY_UNVERIFIED);
        assertThat(again.accepted()).isTrue();
        assertThat(again.role()).isEqualTo(Role.EDITOR);
    }

    @Test
    void expiredInviteIsRejected() {
        registry.createRoom(ROOM, "owner", null, true);
        RoomInvite invite = registry.issueInvite(ROOM, "owner", Role.EDITOR, Duration.ofSeconds(60));
        clock.advance(Duration.ofSeconds(61));

        JoinResult result = registry.joinRoom(ROOM, new UserInfo("guest", "Guest", null),
            new JoinCredentials(null, invite.token()), new RecordingChannel("c-1"));

        assertThat(result.code()).isEqualTo(AuthorizationException.INVALID_INVITE);
    }

    @Test
    void inviteLifetimeIsClamped() {
        registry.createRoom(ROOM, "owner", null, false);
        Instant now = clock.instant();

        RoomInvite shortLived = registry.issueInvite(ROOM, "owner", null, Duration.ofSeconds(5));
        RoomInvite defaulted = registry.issueInvite(ROOM, "owner", null, null);
        RoomInvite longLived = registry.issueInvite(ROOM, "owner", null, Duration.ofDays(365));

        assertThat(shortLived.expiresAt()).isEqualTo(now.plusSeconds(60));
        assertThat(shortLived.role()).isEqualTo(Role.VIEWER);
        assertThat(defaulted.expiresAt()).isEqualTo(now.plus(Duration.ofHours(1)));
        assertThat(longLived.expiresAt()).isEqualTo(now.plus(Duration.ofDays(30)));
    }

    @Test
    void onlyOwnersManageInvites() {
        join("alice", new RecordingChannel("c-alice"));
        join("bob", new RecordingChannel("c-bob"));

        assertThatThrownBy(() -> registry.issueInvite(ROOM, "bob", Role.EDITOR, null))
            .isInstanceOf(AuthorizationException.class)
            .extracting("code").isEqualTo(AuthorizationException.OWNER_REQUIRED);
    }

    @Test
    void twoEditorRace() {
        RecordingChannel a = new RecordingChannel("c-a");
        RecordingChannel b = new RecordingChannel("c-b");
        join("owner", new RecordingChannel("c-owner"));
        join("a", a);
        join("b", b);

        LockResult first = registry.acquireLock(ROOM, "a", "step-title-1", "req-1");
        LockResult second = registry.acquireLock(ROOM, "b", "step-title-1", "req-2");
        registry.releaseLock(ROOM, "a", "step-title-1", "req-3");
        LockResult third = registry.acquireLock(ROOM, "b", "step-title-1", "req-4");

        assertThat(first.granted()).isTrue();
        assertThat(second.granted()).isFalse();
        assertThat(second.currentOwner()).isEqualTo("a");
        assertThat(b.ofType(MessageTypes.LOCK_DENIED)).singleElement().satisfies(m -> {
            assertThat(m.requestId()).isEqualTo("req-2");
            assertThat(m.currentOwner()).isEqualTo("a");
        });
        assertThat(third.granted()).isTrue();
        assertThat(registry.lock(ROOM, "step-title-1")).get().extracting("ownerId").isEqualTo("b");
        assertThat(a.ofType(MessageTypes.LOCK_RELEASED)).extracting(ServerMessage::resourceId).contains("step-title-1");
    }

    @Test
    void reacquireByHolderRefreshesExpiry() {
        join("a", new RecordingChannel("c-a"));
        LockResult first = registry.acquireLock(ROOM, "a", "title", null);
        clock.advance(Duration.ofSeconds(30));

        LockResult again = registry.acquireLock(ROOM, "a", "title", null);

        assertThat(again.granted()).isTrue();
        assertThat(again.lock().acquiredAt()).isEqualTo(first.lock().acquiredAt());
        assertThat(again.lock().expiresAt()).isEqualTo(first.lock().expiresAt().plusSeconds(30));
    }

    @Test
    void expiredLockIsTreatedAsAbsentWithoutSweep() {
        join("a", new RecordingChannel("c-a"));
        join("b", new RecordingChannel("c-b"));
        registry.acquireLock(ROOM, "a", "title", null);
        clock.advance(Duration.ofMinutes(2));

        LockResult result = registry.acquireLock(ROOM, "b", "title", null);

        assertThat(result.granted()).isTrue();
        assertThat(result.currentOwner()).isEqualTo("b");
    }

    @Test
    void concurrentAcquiresGrantExactlyOne() throws Exception {
        int editors = 8;
        join("owner", new RecordingChannel("c-owner"));
        for (int i = 0; i < editors; i++) {
            join("editor-" + i, new RecordingChannel("c-" + i));
        }
        ExecutorService pool = Executors.newFixedThreadPool(editors);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<LockResult>> results = new ArrayList<>();
        try {
            for (int i = 0; i < editors; i++) {
                String userId = "editor-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    return registry.acquireLock(ROOM, userId, "shared", null);
                }));
            }
            start.countDown();
            int granted = 0;
            for (Future<LockResult> result : results) {
                if (result.get(5, TimeUnit.SECONDS).granted()) granted++;
            }
            assertThat(granted).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void viewersCannotEditOrLock() {
        RecordingChannel owner = new RecordingChannel("c-owner");
        join("owner", owner);
        join("viewer", new RecordingChannel("c-viewer"));
        registry.changeRole(ROOM, "owner", "viewer", Role.VIEWER, null);
        owner.clear();
        ContentChange change = new ContentChange("ch-1", "title", ChangeType.INSERT, 0, "x", null, null, null);

        assertThatThrownBy(() -> registry.applyContentChange(ROOM, "viewer", change))
            .isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> registry.acquireLock(ROOM, "viewer", "title", null))
            .isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> registry.changeRole(ROOM, "viewer", "owner", Role.VIEWER, null))
            .isInstanceOf(AuthorizationException.class);
        assertThat(owner.sent()).isEmpty();
    }

    @Test
    void contentChangeIsRelayedToOthersWithServerAuthor() {
        RecordingChannel alice = new RecordingChannel("c-alice");
        RecordingChannel bob = new RecordingChannel("c-bob");
        join("alice", alice);
        join("bob", bob);
        alice.clear();
        bob.clear();

        ContentChange sent = new ContentChange("ch-1", "title", ChangeType.INSERT, 5, "X", null, "mallory", null);
        registry.applyContentChange(ROOM, "bob", sent);

        assertThat(bob.sent()).isEmpty();
        ServerMessage relayed = alice.last();
        assertThat(relayed.type()).isEqualTo(MessageTypes.CONTENT_CHANGE);
        assertThat(relayed.change().authorId()).isEqualTo("bob");
        assertThat(relayed.change().timestamp()).isEqualTo(clock.instant());
        assertThat(relayed.change().content()).isEqualTo("X");
    }

    @Test
    void contentChangeOnFieldLockedByAnotherIsRejected() {
        RecordingChannel alice = new RecordingChannel("c-alice");
        join("alice", alice);
        join("bob", new RecordingChannel("c-bob"));
        registry.acquireLock(ROOM, "alice", "title", null);
        alice.clear();

        ContentChange change = new ContentChange(null, "title", ChangeType.INSERT, 0, "x", null, null, null);

        assertThatThrownBy(() -> registry.applyContentChange(ROOM, "bob", change))
            .isInstanceOf(ConflictException.class)
            .extracting("code").isEqualTo(ConflictException.LOCKED);
        assertThat(alice.sent()).isEmpty();
        registry.applyContentChange(ROOM, "alice", change);
    }

    @Test
    void releaseByNonHolderIsRejectedButOwnerMayForceRelease() {
        join("owner", new RecordingChannel("c-owner"));
        join("a", new RecordingChannel("c-a"));
        join("b", new RecordingChannel("c-b"));
        registry.acquireLock(ROOM, "a", "title", null);

        assertThatThrownBy(() -> registry.releaseLock(ROOM, "b", "title", null))
            .isInstanceOf(ConflictException.class)
            .extracting("code").isEqualTo(ConflictException.LOCK_NOT_OWNED);
        registry.releaseLock(ROOM, "owner", "title", null);
        assertThat(registry.lock(ROOM, "title")).isEmpty();
        assertThatThrownBy(() -> registry.releaseLock(ROOM, "a", "title", null))
            .extracting("code").isEqualTo(ConflictException.LOCK_NOT_HELD);
    }

    @Test
    void roleChangeIsOwnerOnlyAndDemotionReleasesLocks() {
        RecordingChannel owner = new RecordingChannel("c-owner");
        RecordingChannel editor = new RecordingChannel("c-editor");
        join("owner", owner);
        join("editor", editor);
        registry.acquireLock(ROOM, "editor", "title", null);
        editor.clear();

        assertThatThrownBy(() -> registry.changeRole(ROOM, "editor", "owner", Role.VIEWER, "r1"))
            .extracting("code").isEqualTo(AuthorizationException.OWNER_REQUIRED);
        assertThatThrownBy(() -> registry.changeRole(ROOM, "owner", "owner", Role.EDITOR, "r2"))
            .extracting("code").isEqualTo(ConflictException.SELF_TARGET);
        assertThatThrownBy(() -> registry.changeRole(ROOM, "owner", "ghost", Role.EDITOR, "r3"))
            .extracting("code").isEqualTo(ConflictException.MEMBER_NOT_FOUND);

        registry.changeRole(ROOM, "owner", "editor", Role.VIEWER, "r4");

        assertThat(registry.lock(ROOM, "title")).isEmpty();
        assertThat(registry.member(ROOM, "editor")).get().extracting("role").isEqualTo(Role.VIEWER);
        assertThat(editor.sent()).extracting(ServerMessage::type).containsExactly(
            MessageTypes.LOCK_RELEASED, MessageTypes.ROLE_CHANGED, MessageTypes.PRESENCE_UPDATED);
        assertThat(owner.ofType(MessageTypes.ROLE_CHANGED)).singleElement()
            .extracting(ServerMessage::requestId).isEqualTo("r4");
    }

    @Test
    void abruptDisconnectIsDetectedAndMembershipSurvivesGracePeriod() {
        RoomSettings settings = new RoomSettings(Duration.ofHours(1), Duration.ofHours(2), Duration.ofSeconds(90),
            Duration.ofMinutes(5), Duration.ofHours(1), Duration.ofDays(30), 5, false, 500, 100);
        registry = new RoomRegistry(settings, clock);
        RecordingChannel a = new RecordingChannel("c-a");
        RecordingChannel c = new RecordingChannel("c-c1");
        join("a", a);
        JoinResult cFirst = join("c", c);
        registry.acquireLock(ROOM, "c", "step-title-1", null);
        a.clear();

        clock.advance(Duration.ofSeconds(60));
        registry.touch(ROOM, "a");
        clock.advance(Duration.ofSeconds(40));
        SweepResult sweep = registry.sweep();

        assertThat(sweep.membersMarkedOffline()).isEqualTo(1);
        assertThat(a.ofType(MessageTypes.PRESENCE_LEFT)).singleElement()
            .extracting(ServerMessage::userId).isEqualTo("c");
        assertThat(c.closedReason()).isNotNull();
        assertThat(registry.member(ROOM, "c")).get().extracting("online").isEqualTo(false);

        RecordingChannel cAgain = new RecordingChannel("c-c2");
        JoinResult rejoin = rejoin("c", cAgain, cFirst);

        assertThat(rejoin.role()).isEqualTo(Role.EDITOR);
        assertThat(rejoin.snapshot().locks()).singleElement().extracting("ownerId").isEqualTo("c");

        registry.disconnect(ROOM, "c", "c-c2");
        clock.advance(Duration.ofHours(1).plusSeconds(1));
        registry.touch(ROOM, "a");
        a.clear();
        SweepResult purge = registry.sweep();

        assertThat(purge.membersPurged()).isEqualTo(1);
        assertThat(registry.member(ROOM, "c")).isEmpty();
        assertThat(registry.lock(ROOM, "step-title-1")).isEmpty();
        assertThat(a.ofType(MessageTypes.LOCK_RELEASED)).extracting(ServerMessage::resourceId)
            .containsExactly("step-title-1");
    }

    @Test
    void staleConnectionCloseIsIgnored() {
        RecordingChannel other = new RecordingChannel("c-other");
        join("other", other);
        JoinResult first = join("alice", new RecordingChannel("c-1"));
        rejoin("alice", new RecordingChannel("c-2"), first);
        other.clear();

        registry.disconnect(ROOM, "alice", "c-1");

        assertThat(registry.member(ROOM, "alice")).get().extracting("online").isEqualTo(true);
        assertThat(other.sent()).isEmpty();
    }

    @Test
    void leaveReleasesLocksButDisconnectKeepsThem() {
        join("owner", new RecordingChannel("c-owner"));
        join("a", new RecordingChannel("c-a"));
        join("b", new RecordingChannel("c-b"));
        registry.acquireLock(ROOM, "a", "title", null);
        registry.acquireLock(ROOM, "b", "body", null);

        registry.disconnect(ROOM, "a", "c-a");
        registry.leaveRoom(ROOM, "b");

        assertThat(registry.lock(ROOM, "title")).isPresent();
        assertThat(registry.lock(ROOM, "body")).isEmpty();
        assertThat(registry.member(ROOM, "b")).get().extracting("online").isEqualTo(false);
    }

    @Test
    void sweepRemovesEmptyIdleRoomsAndExpiredLocks() {
        RecordingChannel a = new RecordingChannel("c-a");
        join("a", a);
        registry.acquireLock(ROOM, "a", "title", null);
        clock.advance(Duration.ofMinutes(1));
        registry.touch(ROOM, "a");
        clock.advance(Duration.ofMinutes(1));
        registry.touch(ROOM, "a");
        a.clear();

        SweepResult expired = registry.sweep();

        assertThat(expired.locksExpired()).isEqualTo(1);
        assertThat(a.ofType(MessageTypes.LOCK_RELEASED)).hasSize(1);

        registry.leaveRoom(ROOM, "a");
        clock.advance(Duration.ofHours(2));
        SweepResult removed = registry.sweep();

        assertThat(removed.membersPurged()).isEqualTo(1);
        assertThat(removed.roomsRemoved()).isEqualTo(1);
        assertThat(registry.roomCount()).isZero();
        assertThatThrownBy(() -> registry.roomInfo(ROOM)).isInstanceOf(RoomNotFoundException.class);
    }

    @Test
    void joinAfterRoomWasSweptCreatesFreshRoom() {
        join("a", new RecordingChannel("c-a"));
        registry.leaveRoom(ROOM, "a");
        clock.advance(Duration.ofHours(2));
        registry.sweep();

        JoinResult result = join("b", new RecordingChannel("c-b"));

        assertThat(result.role()).isEqualTo(Role.OWNER);
        assertThat(result.snapshot().members()).extracting("id").containsExactly("b");
    }

    @Test
    void createRoomRejectsDuplicateIds() {
        RoomInfo created = registry.createRoom(null, "owner", null, false);

        assertThat(created.id()).startsWith("room_");
        assertThatThrownBy(() -> registry.createRoom(created.id(), "owner", null, false))
            .isInstanceOf(ConflictException.class)
            .extracting("code").isEqualTo(ConflictException.ROOM_EXISTS);
    }

    @Test
    void kickEndsSessionAndRemovesMember() {
        RecordingChannel owner = new RecordingChannel("c-owner");
        RecordingChannel bob = new RecordingChannel("c-bob");
        join("owner", owner);
        join("bob", bob);
        registry.acquireLock(ROOM, "bob", "title", null);

        registry.kick(ROOM, "owner", "bob");

        assertThat(bob.ofType(MessageTypes.SESSION_ENDED)).singleElement()
            .extracting(ServerMessage::code).isEqualTo(Room.ENDED_KICKED);
        assertThat(registry.member(ROOM, "bob")).isEmpty();
        assertThat(registry.lock(ROOM, "title")).isEmpty();
        assertThat(owner.ofType(MessageTypes.PRESENCE_LEFT)).extracting(ServerMessage::userId).containsExactly("bob");
    }

    @Test
    void deleteRoomEndsEverySession() {
        RecordingChannel owner = new RecordingChannel("c-owner");
        RecordingChannel bob = new RecordingChannel("c-bob");
        join("owner", owner);
        join("bob", bob);

        assertThatThrownBy(() -> registry.deleteRoom(ROOM, "bob")).isInstanceOf(AuthorizationException.class);
        registry.deleteRoom(ROOM, "owner");

        assertThat(owner.ofType(MessageTypes.SESSION_ENDED)).hasSize(1);
        assertThat(bob.ofType(MessageTypes.SESSION_ENDED)).singleElement()
            .extracting(ServerMessage::code).isEqualTo(Room.ENDED_ROOM_DELETED);
        assertThat(registry.roomCount()).isZero();
    }

    @Test
    void commandsOnUnknownRoomFail() {
        assertThatThrownBy(() -> registry.acquireLock("nowhere", "a", "title", null))
            .isInstanceOf(RoomNotFoundException.class);
    }

    @Test
    void broadcastCanExcludeOneMember() {
        RecordingChannel alice = new RecordingChannel("c-alice");
        RecordingChannel bob = new RecordingChannel("c-bob");
        join("alice", alice);
        join("bob", bob);
        alice.clear();
        bob.clear();

        registry.broadcast(ROOM, ServerMessage.presenceLeft(ROOM, "ghost"), "alice");

        assertThat(alice.sent()).isEmpty();
        assertThat(bob.sent()).hasSize(1);
    }
}
