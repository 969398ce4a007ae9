package com.plainer.collab.message;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One chat line as kept in the room history.
 *
 * @param reactions emoji to the ids of the users who reacted with it, in first-reaction order
 */
public record ChatMessageView(
    String id,
    String userId,
    String userName,
    String userColor,
    String content,
    Instant createdAt,
    Map<String, List<String>> reactions
) {

    public ChatMessageView {
        reactions = reactions != null ? Collections.unmodifiableMap(new LinkedHashMap<>(reactions)) : Map.of();
    }

    /** Adds {@code reactorId} to the emoji's reactors, or removes it when already there. */
    public ChatMessageView withReactionToggled(String emoji, String reactorId) {
        Map<String, List<String>> next = new LinkedHashMap<>(reactions);
        List<String> users = new ArrayList<>(next.getOrDefault(emoji, List.of()));
        if (!users.remove(reactorId)) {
            users.add(reactorId);
        }
        if (users.isEmpty()) {
            next.remove(emoji);
        } else {
            next.put(emoji, List.copyOf(users));
        }
        return new ChatMessageView(id, userId, userName, userColor, content, createdAt, next);
    }

    public boolean hasReaction(String emoji, String reactorId) {
        return reactions.getOrDefault(emoji, List.of()).contains(reactorId);
    }
}
