package com.plainer.collab.client.content;

import com.plainer.collab.message.ContentChange;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides how a remote change is applied when the local user changed the same field concurrently.
 */
public interface ConflictResolver {

    ConflictStrategy strategy();

    /**
     * @param remote change received from another member
     * @param concurrentLocal local changes to the same field, already applied locally and not older
     *     than the conflict window, oldest first
     * @return the change to apply, possibly rebased, or empty to drop it
     */
    Optional<ContentChange> resolve(ContentChange remote, List<ContentChange> concurrentLocal);

    static ConflictResolver forStrategy(ConflictStrategy strategy, Map<String, MergeFunction> mergeFunctions) {
        return switch (strategy) {
            case LAST_WRITE_WINS -> new LastWriteWinsResolver();
            case OPERATIONAL_TRANSFORM -> new OperationalTransformResolver();
            case MERGE -> new MergeResolver(mergeFunctions, MergeFunction.ACCEPT_REMOTE);
        };
    }

    /** Same-instant changes are ordered by author id. */
    static int compareAuthors(ContentChange a, ContentChange b) {
        String left = a.authorId() != null ? a.authorId() : "";
        String right = b.authorId() != null ? b.authorId() : "";
        return left.compareTo(right);
    }
}
