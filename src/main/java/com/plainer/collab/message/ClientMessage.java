package com.plainer.collab.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.plainer.collab.model.Role;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClientMessage(
    String type,
    String requestId,
    String roomId,
    UserInfo user,
    String password,
    String inviteToken,
    CursorPosition cursor,
    ContentChange change,
    String resourceId,
    String targetUserId,
    Role role,
    CommentPayload comment,
    ChatPayload chat,
    String resumeToken,
    Long timestamp
) {

    public static ClientMessage joinRoom(String roomId, UserInfo user, String password, String inviteToken) {
        return joinRoom(roomId, user, password, inviteToken, null);
    }

    public static ClientMessage joinRoom(String roomId, UserInfo user, String password, String inviteToken, String resumeToken) {
        return new ClientMessage(MessageTypes.JOIN_ROOM, null, roomId, user, password, inviteToken,
            null, null, null, null, null, null, null, resumeToken, null);
    }

    public static ClientMessage leaveRoom(String roomId) {
        return of(MessageTypes.LEAVE_ROOM, null, roomId);
    }

    public static ClientMessage cursorUpdate(String roomId, CursorPosition cursor) {
        return new ClientMessage(MessageTypes.CURSOR_UPDATE, null, roomId, null, null, null,
            cursor, null, null, null, null, null, null, null, null);
    }

    public static ClientMessage contentChange(String roomId, ContentChange change) {
        return new ClientMessage(MessageTypes.CONTENT_CHANGE, null, roomId, null, null, null,
            null, change, null, null, null, null, null, null, null);
    }

    public static ClientMessage lockAcquire(String requestId, String roomId, String resourceId) {
        return new ClientMessage(MessageTypes.LOCK_ACQUIRE, requestId, roomId, null, null, null,
            null, null, resourceId, null, null, null, null, null, null);
    }

    public static ClientMessage lockRelease(String requestId, String roomId, String resourceId) {
        return new ClientMessage(MessageTypes.LOCK_RELEASE, requestId, roomId, null, null, null,
            null, null, resourceId, null, null, null, null, null, null);
    }

    public static ClientMessage roleChange(String requestId, String roomId, String targetUserId, Role role) {
        return new ClientMessage(MessageTypes.ROLE_CHANGE, requestId, roomId, null, null, null,
            null, null, null, targetUserId, role, null, null, null, null);
    }

    public static ClientMessage commentAdd(String roomId, String stepId, String content, List<String> mentions, String parentId) {
        return comment(MessageTypes.COMMENT_ADD, roomId, new CommentPayload(null, stepId, parentId, content, mentions, null));
    }

    public static ClientMessage commentUpdate(String roomId, String id, String stepId, String content, List<String> mentions) {
        return comment(MessageTypes.COMMENT_UPDATE, roomId, new CommentPayload(id, stepId, null, content, mentions, null));
    }

    public static ClientMessage commentDelete(String roomId, String id, String stepId) {
        return comment(MessageTypes.COMMENT_DELETE, roomId, new CommentPayload(id, stepId, null, null, null, null));
    }

    public static ClientMessage commentResolve(String roomId, String id, String stepId, boolean resolved) {
        return comment(MessageTypes.COMMENT_RESOLVE, roomId, new CommentPayload(id, stepId, null, null, null, resolved));
    }

    public static ClientMessage requestPresence(String roomId) {
        return of(MessageTypes.REQUEST_PRESENCE, null, roomId);
    }

    public static ClientMessage chatSend(String roomId, String content) {
        return chat(MessageTypes.CHAT_SEND, roomId, new ChatPayload(null, content, null));
    }

    public static ClientMessage chatReaction(String roomId, String messageId, String emoji) {
        return chat(MessageTypes.CHAT_REACTION, roomId, new ChatPayload(messageId, null, emoji));
    }

    public static ClientMessage ping(long timestamp) {
        return new ClientMessage(MessageTypes.PING, null, null, null, null, null,
            null, null, null, null, null, null, null, null, timestamp);
    }

    private static ClientMessage comment(String type, String roomId, CommentPayload payload) {
        return new ClientMessage(type, null, roomId, null, null, null,
            null, null, null, null, null, payload, null, null, null);
    }

    private static ClientMessage chat(String type, String roomId, ChatPayload payload) {
        return new ClientMessage(type, null, roomId, null, null, null,
            null, null, null, null, null, null, payload, null, null);
    }

    private static ClientMessage of(String type, String requestId, String roomId) {
        return new ClientMessage(type, requestId, roomId, null, null, null,
            null, null, null, null, null, null, null, null, null);
    }
}
