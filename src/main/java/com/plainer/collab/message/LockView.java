package com.plainer.collab.message;

import java.time.Instant;

public record LockView(
    String resourceId,
    String ownerId,
    String ownerName,
    Instant acquiredAt,
    Instant expiresAt
) {

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
