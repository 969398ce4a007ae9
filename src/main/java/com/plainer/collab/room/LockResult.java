package com.plainer.collab.room;

import com.plainer.collab.message.LockView;

/** Outcome of a lock request. On denial {@code lock} is the lock that is still held. */
public record LockResult(boolean granted, LockView lock) {

    public static LockResult granted(LockView lock) {
        return new LockResult(true, lock);
    }

    public static LockResult denied(LockView heldBy) {
        return new LockResult(false, heldBy);
    }

    public String currentOwner() {
        return lock != null ? lock.ownerId() : null;
    }
}
