package com.plainer.collab.client;

import com.plainer.collab.message.LockView;

/**
 * Answer to a lock request.
 *
 * @param currentOwner the holder after the request: the caller when granted, someone else when denied
 */
public record LockOutcome(boolean granted, String resourceId, String currentOwner, LockView lock) {}
