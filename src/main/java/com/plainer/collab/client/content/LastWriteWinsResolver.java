package com.plainer.collab.client.content;

import com.plainer.collab.message.ContentChange;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Drops a remote change when a newer local change touches the same range. Remote changes that do
 * not overlap any local change are applied unchanged.
 */
public class LastWriteWinsResolver implements ConflictResolver {

    @Override
    public ConflictStrategy strategy() {
        return ConflictStrategy.LAST_WRITE_WINS;
    }

    @Override
    public Optional<ContentChange> resolve(ContentChange remote, List<ContentChange> concurrentLocal) {
        for (ContentChange local : concurrentLocal) {
            if (overlaps(remote, local) && isNewer(local, remote)) {
                return Optional.empty();
            }
        }
        return Optional.of(remote);
    }

    static boolean overlaps(ContentChange a, ContentChange b) {
        int aEnd = a.position() + Math.max(a.removedLength(), a.insertedLength());
        int bEnd = b.position() + Math.max(b.removedLength(), b.insertedLength());
        return a.position() <= bEnd && b.position() <= aEnd;
    }

    private static boolean isNewer(ContentChange local, ContentChange remote) {
        Instant l = local.timestamp() != null ? local.timestamp() : Instant.MIN;
        Instant r = remote.timestamp() != null ? remote.timestamp() : Instant.MIN;
        int cmp = l.compareTo(r);
        return cmp > 0 || (cmp == 0 && ConflictResolver.compareAuthors(local, remote) > 0);
    }
}
