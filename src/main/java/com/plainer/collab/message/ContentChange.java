package com.plainer.collab.message;

import java.time.Instant;

/**
 * A single positional patch to one addressable text field.
 *
 * <p>{@code length} is the number of characters a delete or replace removes. When it is null the
 * removal count is the length of {@code content}.
 */
public record ContentChange(
    String id,
    String elementId,
    ChangeType type,
    int position,
    String content,
    Integer length,
    String authorId,
    Instant timestamp
) {

    public ContentChange withId(String newId) {
        return new ContentChange(newId, elementId, type, position, content, length, authorId, timestamp);
    }

    public ContentChange withPosition(int newPosition) {
        return new ContentChange(id, elementId, type, newPosition, content, length, authorId, timestamp);
    }

    public ContentChange withAuthor(String newAuthorId, Instant newTimestamp) {
        return new ContentChange(id, elementId, type, position, content, length, newAuthorId, newTimestamp);
    }

    /** Characters removed from the target before {@code content} is inserted. */
    public int removedLength() {
        if (type == ChangeType.INSERT) return 0;
        if (length != null) return Math.max(0, length);
        return content == null ? 0 : content.length();
    }

    /** Characters added to the target. */
    public int insertedLength() {
        if (type == ChangeType.DELETE || content == null) return 0;
        return content.length();
    }
}
