package com.plainer.collab.room;

import java.time.Instant;

// Room metadata served by the management API.
public record RoomInfo(
    String id,
    int memberCount,
    int onlineCount,
    boolean passwordRequired,
    boolean inviteRequired,
    Instant createdAt,
    Instant lastActivity
) {}
