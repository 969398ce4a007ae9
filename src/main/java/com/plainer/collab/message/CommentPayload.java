package com.plainer.collab.message;

import java.util.List;

// Body of the comment-* commands; which fields matter depends on the command.
public record CommentPayload(
    String id,
    String stepId,
    String parentId,
    String content,
    List<String> mentions,
    Boolean resolved
) {}
