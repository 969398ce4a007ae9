package com.plainer.collab.room;

import com.plainer.collab.model.Role;

import java.time.Instant;

public record RoomInvite(String token, String roomId, Role role, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
