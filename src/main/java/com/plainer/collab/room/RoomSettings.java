package com.plainer.collab.room;

import java.time.Duration;

/**
 * Server-side timing and limits.
 *
 * @param memberGracePeriod how long an offline member (and the locks it holds) survives before sweep purges it
 * @param lockTtl lifetime of a lock after each acquire
 * @param heartbeatTimeout silence after which an online member is considered gone
 * @param roomIdleTimeout how long an empty room is kept
 * @param inviteTtl default invite lifetime
 * @param maxInviteTtl upper bound for a requested invite lifetime
 * @param maxProtocolErrors consecutive malformed frames tolerated on one connection
 * @param authRequired reject WebSocket connections without a valid bearer token
 * @param chatHistoryLimit chat messages a room keeps, oldest dropped first
 * @param chatSnapshotSize most recent chat messages handed to a joining member
 */
public record RoomSettings(
    Duration memberGracePeriod,
    Duration lockTtl,
    Duration heartbeatTimeout,
    Duration roomIdleTimeout,
    Duration inviteTtl,
    Duration maxInviteTtl,
    int maxProtocolErrors,
    boolean authRequired,
    int chatHistoryLimit,
    int chatSnapshotSize
) {

    public static final Duration MIN_INVITE_TTL = Duration.ofSeconds(60);

    public static RoomSettings defaults() {
        return new RoomSettings(
            Duration.ofHours(1),
            Duration.ofMinutes(2),
            Duration.ofSeconds(90),
            Duration.ofMinutes(5),
            Duration.ofHours(1),
            Duration.ofDays(30),
            5,
            false,
            500,
            100);
    }

    public Duration clampInviteTtl(Duration requested) {
        if (requested == null) return inviteTtl;
        if (requested.compareTo(MIN_INVITE_TTL) < 0) return MIN_INVITE_TTL;
        if (requested.compareTo(maxInviteTtl) > 0) return maxInviteTtl;
        return requested;
    }
}
