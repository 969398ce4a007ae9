package com.plainer.collab.client.content;

import com.plainer.collab.message.ChangeType;
import com.plainer.collab.message.ContentChange;

import java.util.List;
import java.util.Optional;

/**
 * Rebases the position of a remote change across every concurrent local change, in the order the
 * local changes were applied. Replace is treated as a delete followed by an insert.
 */
public class OperationalTransformResolver implements ConflictResolver {

    @Override
    public ConflictStrategy strategy() {
        return ConflictStrategy.OPERATIONAL_TRANSFORM;
    }

    @Override
    public Optional<ContentChange> resolve(ContentChange remote, List<ContentChange> concurrentLocal) {
        int pos = remote.position();
        for (ContentChange local : concurrentLocal) {
            pos = transform(pos, remote, local);
        }
        return Optional.of(pos == remote.position() ? remote : remote.withPosition(pos));
    }

    static int transform(int pos, ContentChange remote, ContentChange local) {
        int at = local.position();
        int removed = local.removedLength();
        int inserted = local.insertedLength();

        if (removed > 0) {
            if (pos >= at + removed) {
                pos -= removed;
            } else if (pos > at) {
                // inside the deleted range
                pos = at;
            }
        }
        if (inserted > 0) {
            boolean localFirst = at < pos
                || (at == pos && (remote.type() != ChangeType.INSERT || ConflictResolver.compareAuthors(local, remote) < 0));
            if (localFirst) {
                pos += inserted;
            }
        }
        return pos;
    }
}
