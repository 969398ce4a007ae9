package com.plainer.collab.message;

import java.time.Instant;
import java.util.List;

public record CommentView(
    String id,
    String stepId,
    String parentId,
    String authorId,
    String authorName,
    String content,
    List<String> mentions,
    boolean resolved,
    Instant createdAt,
    Instant updatedAt
) {

    public CommentView edited(String newContent, List<String> newMentions, Instant at) {
        return new CommentView(id, stepId, parentId, authorId, authorName, newContent,
            newMentions != null ? List.copyOf(newMentions) : mentions, resolved, createdAt, at);
    }

    public CommentView withResolved(boolean value, Instant at) {
        return new CommentView(id, stepId, parentId, authorId, authorName, content, mentions, value, createdAt, at);
    }
}
