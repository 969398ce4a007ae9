package com.plainer.collab.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.plainer.collab.model.Role;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerMessage(
    String type,
    String requestId,
    String roomId,
    Role role,
    RoomSnapshot snapshot,
    MemberView member,
    List<MemberView> members,
    String userId,
    CursorPosition cursor,
    ContentChange change,
    LockView lock,
    String resourceId,
    String currentOwner,
    CommentView comment,
    String commentId,
    String stepId,
    Boolean resolved,
    ChatMessageView chat,
    String messageId,
    String emoji,
    String resumeToken,
    String code,
    String error,
    Long timestamp
) {

    public static ServerMessage roomJoined(String roomId, Role role, RoomSnapshot snapshot) {
        return roomJoined(roomId, role, snapshot, null);
    }

    /** {@code resumeToken} lets this member rejoin after its invite has been consumed. */
    public static ServerMessage roomJoined(String roomId, Role role, RoomSnapshot snapshot, String resumeToken) {
        return builder(MessageTypes.ROOM_JOINED, roomId).role(role).snapshot(snapshot).resumeToken(resumeToken).build();
    }

    public static ServerMessage joinRejected(String roomId, String code, String reason) {
        return builder(MessageTypes.JOIN_REJECTED, roomId).code(code).error(reason).build();
    }

    public static ServerMessage presenceJoined(String roomId, MemberView member) {
        return builder(MessageTypes.PRESENCE_JOINED, roomId).member(member).userId(member.id()).build();
    }

    public static ServerMessage presenceLeft(String roomId, String userId) {
        return builder(MessageTypes.PRESENCE_LEFT, roomId).userId(userId).build();
    }

    public static ServerMessage presenceUpdated(String roomId, List<MemberView> members) {
        return builder(MessageTypes.PRESENCE_UPDATED, roomId).members(members).build();
    }

    public static ServerMessage cursor(String roomId, String userId, CursorPosition position) {
        return builder(MessageTypes.CURSOR_UPDATE, roomId).userId(userId).cursor(position).build();
    }

    public static ServerMessage contentChange(String roomId, ContentChange change) {
        return builder(MessageTypes.CONTENT_CHANGE, roomId).change(change).userId(change.authorId()).build();
    }

    public static ServerMessage lockGranted(String requestId, String roomId, LockView lock) {
        return builder(MessageTypes.LOCK_GRANTED, roomId).requestId(requestId).lock(lock)
            .resourceId(lock.resourceId()).currentOwner(lock.ownerId()).build();
    }

    public static ServerMessage lockDenied(String requestId, String roomId, LockView heldBy) {
        return builder(MessageTypes.LOCK_DENIED, roomId).requestId(requestId).lock(heldBy)
            .resourceId(heldBy.resourceId()).currentOwner(heldBy.ownerId()).build();
    }

    public static ServerMessage lockReleased(String requestId, String roomId, String resourceId) {
        return builder(MessageTypes.LOCK_RELEASED, roomId).requestId(requestId).resourceId(resourceId).build();
    }

    public static ServerMessage roleChanged(String requestId, String roomId, String userId, Role role) {
        return builder(MessageTypes.ROLE_CHANGED, roomId).requestId(requestId).userId(userId).role(role).build();
    }

    public static ServerMessage commentAdded(String roomId, CommentView comment) {
        return commentEvent(MessageTypes.COMMENT_ADDED, roomId, comment);
    }

    public static ServerMessage commentUpdated(String roomId, CommentView comment) {
        return commentEvent(MessageTypes.COMMENT_UPDATED, roomId, comment);
    }

    public static ServerMessage commentDeleted(String roomId, String commentId, String stepId) {
        return builder(MessageTypes.COMMENT_DELETED, roomId).commentId(commentId).stepId(stepId).build();
    }

    public static ServerMessage commentResolved(String roomId, String commentId, String stepId, boolean resolved) {
        return builder(MessageTypes.COMMENT_RESOLVED, roomId).commentId(commentId).stepId(stepId)
            .resolved(resolved).build();
    }

    public static ServerMessage chatMessage(String roomId, ChatMessageView message) {
        return builder(MessageTypes.CHAT_MESSAGE, roomId).chat(message).messageId(message.id())
            .userId(message.userId()).build();
    }

    public static ServerMessage chatReaction(String roomId, ChatMessageView message, String emoji, String userId) {
        return builder(MessageTypes.CHAT_REACTION, roomId).chat(message).messageId(message.id())
            .emoji(emoji).userId(userId).build();
    }

    public static ServerMessage sessionEnded(String roomId, String code, String reason) {
        return builder(MessageTypes.SESSION_ENDED, roomId).code(code).error(reason).build();
    }

    public static ServerMessage error(String requestId, String code, String message) {
        return builder(MessageTypes.ERROR, null).requestId(requestId).code(code).error(message).build();
    }

    public static ServerMessage pong(long timestamp) {
        return builder(MessageTypes.PONG, null).timestamp(timestamp).build();
    }

    private static ServerMessage commentEvent(String type, String roomId, CommentView comment) {
        return builder(type, roomId).comment(comment).commentId(comment.id()).stepId(comment.stepId()).build();
    }

    private static Builder builder(String type, String roomId) {
        return new Builder(type, roomId);
    }

    private static final class Builder {
        private final String type;
        private final String roomId;
        private String requestId;
        private Role role;
        private RoomSnapshot snapshot;
        private MemberView member;
        private List<MemberView> members;
        private String userId;
        private CursorPosition cursor;
        private ContentChange change;
        private LockView lock;
        private String resourceId;
        private String currentOwner;
        private CommentView comment;
        private String commentId;
        private String stepId;
        private Boolean resolved;
        private ChatMessageView chat;
        private String messageId;
        private String emoji;
        private String resumeToken;
        private String code;
        private String error;
        private Long timestamp;

        private Builder(String type, String roomId) {
            this.type = type;
            this.roomId = roomId;
        }

        Builder requestId(String v) { requestId = v; return this; }
        Builder role(Role v) { role = v; return this; }
        Builder snapshot(RoomSnapshot v) { snapshot = v; return this; }
        Builder member(MemberView v) { member = v; return this; }
        Builder members(List<MemberView> v) { members = v; return this; }
        Builder userId(String v) { userId = v; return this; }
        Builder cursor(CursorPosition v) { cursor = v; return this; }
        Builder change(ContentChange v) { change = v; return this; }
        Builder lock(LockView v) { lock = v; return this; }
        Builder resourceId(String v) { resourceId = v; return this; }
        Builder currentOwner(String v) { currentOwner = v; return this; }
        Builder comment(CommentView v) { comment = v; return this; }
        Builder commentId(String v) { commentId = v; return this; }
        Builder stepId(String v) { stepId = v; return this; }
        Builder resolved(Boolean v) { resolved = v; return this; }
        Builder chat(ChatMessageView v) { chat = v; return this; }
        Builder messageId(String v) { messageId = v; return this; }
        Builder emoji(String v) { emoji = v; return this; }
        Builder resumeToken(String v) { resumeToken = v; return this; }
        Builder code(String v) { code = v; return this; }
        Builder error(String v) { error = v; return this; }
        Builder timestamp(Long v) { timestamp = v; return this; }

        ServerMessage build() {
            return new ServerMessage(type, requestId, roomId, role, snapshot, member, members, userId,
                cursor, change, lock, resourceId, currentOwner, comment, commentId, stepId, resolved,
                chat, messageId, emoji, resumeToken, code, error, timestamp);
        }
    }
}
